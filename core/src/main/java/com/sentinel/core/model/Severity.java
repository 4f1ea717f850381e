package com.sentinel.core.model;

import java.util.Locale;

/**
 * Уровни критичности находок.
 * Порядок констант задает порядок сортировки: от самого опасного к информационному.
 */
public enum Severity {
    CRITICAL("Critical", 4, 25),
    HIGH("High", 3, 10),
    MEDIUM("Medium", 2, 3),
    LOW("Low", 1, 1),
    INFO("Info", 0, 0);

    private final String displayName;
    private final int priority;
    private final int riskWeight;

    Severity(String displayName, int priority, int riskWeight) {
        this.displayName = displayName;
        this.priority = priority;
        this.riskWeight = riskWeight;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Вес находки при расчете риск-оценки скана.
     */
    public int getRiskWeight() {
        return riskWeight;
    }

    public boolean isCriticalOrHigh() {
        return this == CRITICAL || this == HIGH;
    }

    /**
     * Разбирает значение severity, присланное агентом.
     *
     * @param value строковое значение (регистр не важен), может быть null
     * @param fallback значение по умолчанию для пустых и неизвестных строк
     * @return распознанный уровень или {@code fallback}
     */
    public static Severity parse(String value, Severity fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
