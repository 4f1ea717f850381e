package com.sentinel.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinel.core.model.EventRecord;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.framing.CloseFrame;
import org.java_websocket.handshake.ServerHandshake;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

/**
 * WebSocket клиент канала скана {@code /ws/{scanId}}. Каждое текстовое сообщение - одно событие.
 */
class ScanFeedClient extends WebSocketClient {
    private static final Logger logger = LoggerFactory.getLogger(ScanFeedClient.class);

    static final int CLOSE_NORMAL = CloseFrame.NORMAL;
    static final int CLOSE_POLICY_VIOLATION = CloseFrame.POLICY_VALIDATION;

    private final ObjectMapper objectMapper;
    private final ConsoleEventPrinter printer;
    private final CountDownLatch closed = new CountDownLatch(1);
    private volatile int closeCode = CloseFrame.ABNORMAL_CLOSE;
    private volatile String closeReason = "";

    ScanFeedClient(URI serverUri, ObjectMapper objectMapper, ConsoleEventPrinter printer) {
        super(serverUri);
        this.objectMapper = objectMapper;
        this.printer = printer;
    }

    @Override
    public void onOpen(ServerHandshake handshake) {
        logger.debug("Connected to {}", getURI());
    }

    @Override
    public void onMessage(String message) {
        try {
            printer.send(parseEvent(objectMapper, message));
        } catch (JsonProcessingException e) {
            logger.warn("Skipping malformed event message: {}", e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            logger.warn("Skipping event message: {}", e.getMessage());
        }
    }

    @Override
    public void onClose(int code, String reason, boolean remote) {
        logger.debug("Connection closed: code={}, reason={}, remote={}", code, reason, remote);
        closeCode = code;
        closeReason = reason;
        printer.close();
        closed.countDown();
    }

    @Override
    public void onError(Exception ex) {
        logger.warn("WebSocket error: {}", ex.getMessage());
    }

    void awaitClosed() throws InterruptedException {
        closed.await();
    }

    int getCloseCode() {
        return closeCode;
    }

    String getCloseReason() {
        return closeReason;
    }

    /**
     * @throws IllegalArgumentException если в сообщении нет типа события
     */
    @SuppressWarnings("unchecked")
    static EventRecord parseEvent(ObjectMapper objectMapper, String message) throws JsonProcessingException {
        Map<String, Object> json = objectMapper.readValue(message, Map.class);
        Object type = json.get("type");
        if (type == null) {
            throw new IllegalArgumentException("Event without type");
        }
        Object data = json.get("data");
        return new EventRecord(
            type.toString(),
            json.get("workerId") instanceof Number ? ((Number) json.get("workerId")).intValue() : 0,
            json.get("role") != null ? json.get("role").toString() : null,
            json.get("scanId") != null ? json.get("scanId").toString() : null,
            data instanceof Map ? (Map<String, Object>) data : Map.of(),
            json.get("timestamp") instanceof Number ? ((Number) json.get("timestamp")).doubleValue() : EventRecord.nowSeconds(),
            message.getBytes(StandardCharsets.UTF_8).length);
    }
}
