package com.sentinel.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinel.core.model.EventKind;
import com.sentinel.core.model.EventRecord;
import com.sentinel.core.model.WorkerIdentity;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Декодер строк протокола событий воркеров.
 *
 * <p>Строка протокола - один JSON-объект вида
 * {@code {"type": ..., "workerId": ..., "role": ..., "scanId": ..., "data": {...}, "timestamp": ...}}.
 *
 * <p>Правила декодирования:
 * <ul>
 *   <li>Идентификаторы воркера, роли и скана всегда берутся из контекста вызова,
 *       значения из строки игнорируются: воркер не может выдать себя за другого</li>
 *   <li>Отсутствующий или нечисловой {@code timestamp} заменяется текущим временем</li>
 *   <li>Нечитаемая строка, в том числе с чем-либо после первого JSON-значения, превращается
 *       в синтетическое событие {@code agent.log} с исходным текстом</li>
 *   <li>Строки внутри записи ограничены только лимитом длины строки протокола</li>
 *   <li>Строка длиннее лимита превращается в событие {@code protocol.oversized}</li>
 * </ul>
 *
 * <p>Метод {@link #decode} никогда не бросает исключений.
 */
public final class EventLineCodec {

    /** Максимальная длина исходного текста, сохраняемого в синтетическом событии. */
    static final int MAX_MALFORMED_TEXT_CHARS = 4096;

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final int maxLineBytes;

    /**
     * @param objectMapper базовые настройки Jackson; копируется, исходный экземпляр не меняется
     * @param maxLineBytes лимит длины строки протокола в байтах
     */
    public EventLineCodec(ObjectMapper objectMapper, int maxLineBytes) {
        this.objectMapper = objectMapper.copy();
        this.objectMapper.getFactory().setStreamReadConstraints(StreamReadConstraints.builder()
            .maxStringLength(maxLineBytes)
            .build());
        this.objectMapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.maxLineBytes = maxLineBytes;
    }

    public int getMaxLineBytes() {
        return maxLineBytes;
    }

    /**
     * Декодирует одну строку вывода воркера.
     *
     * @param line строка без терминатора
     * @param identity воркер, которому принадлежит поток
     * @return декодированное или синтетическое событие
     */
    public EventRecord decode(RawLine line, WorkerIdentity identity) {
        if (line.oversized() || line.length() > maxLineBytes) {
            return oversized(line.length(), identity);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(line.bytes());
        } catch (JsonProcessingException e) {
            return malformed(line, identity, e.getOriginalMessage());
        } catch (IOException e) {
            return malformed(line, identity, e.getMessage());
        }

        if (root == null || !root.isObject()) {
            return malformed(line, identity, "not a JSON object");
        }
        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual() || typeNode.asText().isBlank()) {
            return malformed(line, identity, "missing 'type'");
        }

        JsonNode timestampNode = root.get("timestamp");
        double timestamp = timestampNode != null && timestampNode.isNumber()
            ? timestampNode.asDouble()
            : EventRecord.nowSeconds();

        return new EventRecord(
            typeNode.asText(),
            identity.workerId(),
            identity.role(),
            identity.scanId(),
            toData(root.get("data")),
            timestamp,
            line.length()
        );
    }

    private Map<String, Object> toData(JsonNode dataNode) {
        if (dataNode == null || dataNode.isNull()) {
            return Map.of();
        }
        if (dataNode.isObject()) {
            return objectMapper.convertValue(dataNode, MAP_TYPE);
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("value", objectMapper.convertValue(dataNode, Object.class));
        return wrapped;
    }

    private EventRecord malformed(RawLine line, WorkerIdentity identity, String reason) {
        String text = line.text();
        boolean truncated = text.length() > MAX_MALFORMED_TEXT_CHARS;
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", truncated ? text.substring(0, MAX_MALFORMED_TEXT_CHARS) : text);
        data.put("malformed", true);
        data.put("reason", reason);
        data.put("truncated", truncated);
        data.put("lengthBytes", line.length());
        return new EventRecord(EventKind.LOG.getTag(), identity.workerId(), identity.role(), identity.scanId(),
            data, EventRecord.nowSeconds(), line.length());
    }

    /**
     * Синтетическое событие для строки, превысившей лимит длины.
     */
    public EventRecord oversized(long lengthBytes, WorkerIdentity identity) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", "Protocol line exceeded " + maxLineBytes + " bytes and was discarded");
        data.put("lengthBytes", lengthBytes);
        data.put("limitBytes", maxLineBytes);
        return EventRecord.synthetic(EventKind.OVERSIZED, identity, data);
    }

    /**
     * Сериализует событие в одну строку JSON для транспорта подписчикам.
     */
    public String encode(EventRecord event) throws JsonProcessingException {
        return objectMapper.writeValueAsString(event);
    }
}
