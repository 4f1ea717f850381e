package com.sentinel.core.model;

import java.time.Instant;
import java.util.*;

/**
 * Результат, извлеченный из события {@code vulnerability.found}.
 *
 * <p>Содержит:
 * <ul>
 *   <li>Категорию (тип уязвимости) и уровень критичности</li>
 *   <li>Место обнаружения, доказательства и рекомендацию по устранению</li>
 *   <li>Идентификатор воркера и роль, приславшие находку</li>
 * </ul>
 *
 * <p>Идентификатор {@link #getId()} служит ключом идемпотентной записи в хранилище.
 */
public final class Finding {
    private final String id;
    private final String category;
    private final Severity severity;
    private final String location;
    private final String evidence;
    private final String remediation;
    private final int workerId;
    private final String role;
    private final Instant reportedAt;
    private final Map<String, Object> metadata;

    public Finding(String category, Severity severity, String location, String evidence,
                   String remediation, int workerId, String role, Map<String, Object> metadata) {
        this.id = UUID.randomUUID().toString();
        this.category = category != null && !category.isBlank() ? category : "Unknown";
        this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
        this.location = location;
        this.evidence = evidence;
        this.remediation = remediation;
        this.workerId = workerId;
        this.role = role;
        this.reportedAt = Instant.now();
        this.metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Collections.emptyMap();
    }

    /**
     * Извлекает находку из события. Полезная нагрузка берется из {@code data.vulnerability},
     * а при его отсутствии из самого {@code data}.
     *
     * @param event событие любого типа
     * @return находка, если событие имеет тип {@link EventKind#FINDING}
     */
    public static Optional<Finding> fromEvent(EventRecord event) {
        if (event.kind() != EventKind.FINDING) {
            return Optional.empty();
        }
        Map<?, ?> payload = event.data();
        Object nested = payload.get("vulnerability");
        if (nested instanceof Map) {
            payload = (Map<?, ?>) nested;
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        copyIfPresent(payload, "payload", metadata);
        copyIfPresent(payload, "cwe", metadata);

        return Optional.of(new Finding(
            firstString(payload, "type", "vuln_type", "title"),
            Severity.parse(firstString(payload, "severity"), Severity.MEDIUM),
            firstString(payload, "location", "url"),
            firstString(payload, "evidence"),
            firstString(payload, "remediation", "recommendation"),
            event.workerId(),
            event.role(),
            metadata
        ));
    }

    private static String firstString(Map<?, ?> payload, String... keys) {
        for (String key : keys) {
            Object value = payload.get(key);
            if (value != null && !value.toString().isEmpty()) {
                return value.toString();
            }
        }
        return null;
    }

    private static void copyIfPresent(Map<?, ?> payload, String key, Map<String, Object> target) {
        Object value = payload.get(key);
        if (value != null && !value.toString().isEmpty()) {
            target.put(key, value);
        }
    }

    public String getId() {
        return id;
    }

    public String getCategory() {
        return category;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getLocation() {
        return location;
    }

    public String getEvidence() {
        return evidence;
    }

    public String getRemediation() {
        return remediation;
    }

    public int getWorkerId() {
        return workerId;
    }

    public String getRole() {
        return role;
    }

    public Instant getReportedAt() {
        return reportedAt;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "Finding{" +
                "id='" + id + '\'' +
                ", severity=" + severity +
                ", category='" + category + '\'' +
                ", location='" + location + '\'' +
                ", workerId=" + workerId +
                '}';
    }
}
