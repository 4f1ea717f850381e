package com.sentinel.report;

/**
 * Поддерживаемые форматы вывода отчетов по скану.
 *
 * <ul>
 *   <li>{@link #CONSOLE} - интерактивный вывод в консоль с цветами</li>
 *   <li>{@link #JSON} - структурированный формат для программной обработки</li>
 * </ul>
 */
public enum ReportFormat {
    CONSOLE("Console output with colors"),
    JSON("JSON format");

    private final String description;

    ReportFormat(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
