package com.sentinel.webui.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinel.core.scan.ScanManager;
import com.sentinel.webui.websocket.ScanWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Конфигурация WebSocket: один канал на скан, {@code /ws/{scanId}}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ScanManager scanManager;
    private final ObjectMapper objectMapper;
    private final SentinelProperties properties;

    public WebSocketConfig(ScanManager scanManager, ObjectMapper objectMapper, SentinelProperties properties) {
        this.scanManager = scanManager;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Bean
    public ScanWebSocketHandler scanWebSocketHandler() {
        return new ScanWebSocketHandler(scanManager, objectMapper);
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(scanWebSocketHandler(), "/ws/*")
                .setAllowedOrigins(properties.getCors().getAllowedOrigins().toArray(new String[0]));
    }
}
