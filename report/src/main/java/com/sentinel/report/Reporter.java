package com.sentinel.report;

import java.io.IOException;
import java.io.PrintWriter;

/**
 * Генератор отчета по скану в конкретном формате.
 *
 * <p>Пример использования:
 * <pre>{@code
 * ScanReport report = ScanReport.from(manager.getScanState(scanId).orElseThrow());
 * Reporter reporter = ReporterFactory.createReporter(ReportFormat.CONSOLE);
 * PrintWriter writer = new PrintWriter(System.out, true);
 * reporter.generate(report, writer);
 * }</pre>
 *
 * @see ScanReport
 * @see ReporterFactory
 */
public interface Reporter {

    /**
     * Генерирует отчет.
     *
     * @param report отчет по скану
     * @param writer поток вывода
     * @throws IOException если возникла ошибка при записи отчета
     */
    void generate(ScanReport report, PrintWriter writer) throws IOException;

    ReportFormat getFormat();
}
