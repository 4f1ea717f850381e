package com.sentinel.webui.websocket;

import com.fasterxml.jackson.databind.ObjectWriter;
import com.sentinel.core.broadcast.EventSink;
import com.sentinel.core.model.EventRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * Доставка событий скана в одно WebSocket соединение: одно событие - одно текстовое сообщение.
 */
public class WebSocketEventSink implements EventSink {
    private static final Logger logger = LoggerFactory.getLogger(WebSocketEventSink.class);

    private final WebSocketSession session;
    private final ObjectWriter writer;

    public WebSocketEventSink(WebSocketSession session, ObjectWriter writer) {
        this.session = session;
        this.writer = writer;
    }

    @Override
    public void send(EventRecord event) throws IOException {
        TextMessage message = new TextMessage(writer.writeValueAsString(event));
        // Synchronize on session to prevent concurrent writes
        synchronized (session) {
            if (!session.isOpen()) {
                throw new IOException("WebSocket session " + session.getId() + " is closed");
            }
            try {
                session.sendMessage(message);
            } catch (IllegalStateException e) {
                throw new IOException("WebSocket session " + session.getId() + " is in invalid state", e);
            }
        }
    }

    @Override
    public void close() {
        synchronized (session) {
            if (!session.isOpen()) {
                return;
            }
            try {
                session.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                logger.debug("Error closing WebSocket session {}: {}", session.getId(), e.getMessage());
            }
        }
    }
}
