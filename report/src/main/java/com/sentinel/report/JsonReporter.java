package com.sentinel.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sentinel.core.model.Finding;
import com.sentinel.core.model.Severity;
import com.sentinel.core.model.WorkerSnapshot;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Генератор отчетов в формате JSON для программной обработки результатов.
 *
 * <p>Особенности формата:
 * <ul>
 *   <li>pretty-print с отступами</li>
 *   <li>временные метки в ISO-8601, а не Unix timestamp</li>
 *   <li>находки отсортированы от самой серьезной</li>
 * </ul>
 */
public final class JsonReporter implements Reporter {

    private final ObjectMapper objectMapper;

    public JsonReporter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void generate(ScanReport report, PrintWriter writer) throws IOException {
        writer.println(objectMapper.writeValueAsString(toDocument(report)));
        writer.flush();
    }

    /**
     * Structure of the JSON report, also served as-is by the web API.
     */
    public Map<String, Object> toDocument(ScanReport report) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("scanId", report.getScanId());
        document.put("target", report.getTargetDescriptor());
        document.put("status", report.getStatus());
        document.put("startedAt", report.getStartedAt());
        document.put("endedAt", report.getEndedAt());
        document.put("generatedAt", report.getGeneratedAt());
        document.put("durationSeconds", report.getDuration().getSeconds());

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("riskScore", report.getRiskScore());
        summary.put("grade", report.getGrade());
        summary.put("totalFindings", report.getFindings().size());
        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        for (Map.Entry<Severity, Integer> entry : report.getSeverityCounts().entrySet()) {
            bySeverity.put(entry.getKey().name(), entry.getValue());
        }
        summary.put("bySeverity", bySeverity);
        summary.put("completedWorkers", report.getCompletedWorkerCount());
        summary.put("totalWorkers", report.getTotalWorkerCount());
        summary.put("eventCount", report.getEventCount());
        document.put("summary", summary);

        List<Map<String, Object>> workers = new ArrayList<>();
        for (WorkerSnapshot worker : report.getWorkers()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("workerId", worker.workerId());
            item.put("role", worker.role());
            item.put("phase", worker.phase());
            item.put("state", worker.state());
            item.put("completed", worker.completed());
            item.put("exitCode", worker.exitCode());
            workers.add(item);
        }
        document.put("workers", workers);

        List<Map<String, Object>> findings = new ArrayList<>();
        for (Finding finding : report.getFindings()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", finding.getId());
            item.put("category", finding.getCategory());
            item.put("severity", finding.getSeverity());
            item.put("location", finding.getLocation());
            item.put("evidence", finding.getEvidence());
            item.put("remediation", finding.getRemediation());
            item.put("workerId", finding.getWorkerId());
            item.put("role", finding.getRole());
            item.put("reportedAt", finding.getReportedAt());
            if (!finding.getMetadata().isEmpty()) {
                item.put("metadata", finding.getMetadata());
            }
            findings.add(item);
        }
        document.put("findings", findings);
        return document;
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.JSON;
    }
}
