package com.sentinel.webui;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sentinel.webui.config.SentinelProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Точка входа веб-приложения Sentinel.
 *
 * <p>Возможности:
 * <ul>
 *   <li>REST API запуска, просмотра и остановки сканов</li>
 *   <li>Поток событий скана через WebSocket с повтором истории при подключении</li>
 *   <li>Отчет по скану с оценкой риска</li>
 * </ul>
 *
 * <p>Запуск: java -jar webui/target/sentinel-webui.jar
 * <br>Доступ: http://localhost:8080
 */
@SpringBootApplication
@EnableConfigurationProperties(SentinelProperties.class)
public class SentinelWebUI {

    public static void main(String[] args) {
        SpringApplication.run(SentinelWebUI.class, args);
    }

    /**
     * Настройка Jackson ObjectMapper для сериализации JSON.
     */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * CORS для фронтенда; разрешенные источники задаются в {@code sentinel.cors.allowed-origins}.
     */
    @Bean
    public WebMvcConfigurer corsConfigurer(SentinelProperties properties) {
        String[] origins = properties.getCors().getAllowedOrigins().toArray(new String[0]);
        return new WebMvcConfigurer() {
            @Override
            public void addCorsMappings(CorsRegistry registry) {
                registry.addMapping("/**")
                        .allowedOrigins(origins)
                        .allowedMethods("GET", "POST", "OPTIONS")
                        .allowedHeaders("*")
                        .allowCredentials(true);
            }
        };
    }
}
