package com.sentinel.report;

/**
 * Фабрика генераторов отчетов.
 */
public final class ReporterFactory {

    private ReporterFactory() {
        // Утилитный класс - конструктор закрыт
    }

    /**
     * Создает генератор отчетов для указанного формата.
     *
     * @param format формат отчета
     * @param useColors использовать ли ANSI цвета (только для {@link ReportFormat#CONSOLE})
     * @return генератор отчетов
     */
    public static Reporter createReporter(ReportFormat format, boolean useColors) {
        return switch (format) {
            case CONSOLE -> new ConsoleReporter(useColors);
            case JSON -> new JsonReporter();
        };
    }

    public static Reporter createReporter(ReportFormat format) {
        return createReporter(format, true);
    }
}
