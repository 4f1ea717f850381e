package com.sentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One protocol message, immutable once decoded.
 * Serialised with the stable wire shape {@code {type, workerId, role, scanId, data, timestamp}}.
 *
 * @param type string tag as sent by the worker
 * @param workerId worker identifier, injected by the orchestrator
 * @param role role tag, injected by the orchestrator
 * @param scanId scan identifier, injected by the orchestrator
 * @param data arbitrary payload
 * @param timestamp epoch seconds
 * @param sizeBytes raw size of the line this record was decoded from, not part of the wire shape
 */
@JsonPropertyOrder({"type", "workerId", "role", "scanId", "data", "timestamp"})
public record EventRecord(
    String type,
    int workerId,
    String role,
    String scanId,
    Map<String, Object> data,
    double timestamp,
    @JsonIgnore long sizeBytes
) {
    public EventRecord {
        Objects.requireNonNull(type, "Type cannot be null");
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }

    /**
     * Событие, порожденное самим оркестратором или кодеком, а не строкой воркера.
     */
    public static EventRecord synthetic(EventKind kind, WorkerIdentity identity, Map<String, Object> data) {
        return new EventRecord(kind.getTag(), identity.workerId(), identity.role(), identity.scanId(),
            data, nowSeconds(), 0);
    }

    public static double nowSeconds() {
        return System.currentTimeMillis() / 1000.0;
    }

    @JsonIgnore
    public EventKind kind() {
        return EventKind.fromTag(type);
    }

    /**
     * Copy with a different payload, same identity, timestamp and size.
     */
    public EventRecord withData(Map<String, Object> newData) {
        return new EventRecord(type, workerId, role, scanId, newData, timestamp, sizeBytes);
    }

    /**
     * Returns a string value from the payload, or {@code null}.
     */
    public String dataString(String key) {
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }
}
