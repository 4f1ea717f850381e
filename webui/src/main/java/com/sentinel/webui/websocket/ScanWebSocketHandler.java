package com.sentinel.webui.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sentinel.core.broadcast.Subscriber;
import com.sentinel.core.scan.ScanManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.util.Optional;

/**
 * Обработчик WebSocket канала скана {@code /ws/{scanId}}.
 *
 * <p>При подключении клиент получает всю историю событий скана, затем живой поток.
 * Сервер закрывает соединение после терминального события. Подключение к неизвестному
 * скану закрывается со статусом POLICY_VIOLATION.
 */
public class ScanWebSocketHandler extends TextWebSocketHandler {
    private static final Logger logger = LoggerFactory.getLogger(ScanWebSocketHandler.class);

    static final String SUBSCRIBER_ATTRIBUTE = "sentinel.subscriber";

    private final ScanManager scanManager;
    private final ObjectWriter eventWriter;

    public ScanWebSocketHandler(ScanManager scanManager, ObjectMapper objectMapper) {
        this.scanManager = scanManager;
        this.eventWriter = objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String scanId = scanIdOf(session.getUri());
        Optional<Subscriber> subscriber = scanManager.join(scanId, new WebSocketEventSink(session, eventWriter));
        if (subscriber.isEmpty()) {
            logger.warn("WebSocket {} requested unknown scan {}", session.getId(), scanId);
            session.close(CloseStatus.POLICY_VIOLATION.withReason("Unknown scan"));
            return;
        }
        session.getAttributes().put(SUBSCRIBER_ATTRIBUTE, subscriber.get());
        logger.info("WebSocket {} subscribed to scan {}", session.getId(), scanId);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // the channel is server-to-client only
        logger.debug("Ignoring message from WebSocket {}", session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.warn("WebSocket {} transport error: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Object subscriber = session.getAttributes().remove(SUBSCRIBER_ATTRIBUTE);
        if (subscriber instanceof Subscriber) {
            scanManager.leave((Subscriber) subscriber);
        }
        logger.info("WebSocket connection closed: {} ({})", session.getId(), status);
    }

    static String scanIdOf(URI uri) {
        if (uri == null || uri.getPath() == null) {
            return null;
        }
        String path = uri.getPath();
        int slash = path.lastIndexOf('/');
        String scanId = slash >= 0 ? path.substring(slash + 1) : path;
        return scanId.isEmpty() ? null : scanId;
    }
}
