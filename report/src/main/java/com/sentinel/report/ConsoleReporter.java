package com.sentinel.report;

import com.sentinel.core.model.Finding;
import com.sentinel.core.model.ScanStatus;
import com.sentinel.core.model.Severity;
import com.sentinel.core.model.WorkerSnapshot;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Console-based reporter with colored output.
 */
public final class ConsoleReporter implements Reporter {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_BLUE = "\u001B[34m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_GRAY = "\u001B[90m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";

    private final boolean useColors;

    public ConsoleReporter(boolean useColors) {
        this.useColors = useColors;
    }

    public ConsoleReporter() {
        this(true);
    }

    @Override
    public void generate(ScanReport report, PrintWriter writer) {
        printHeader(writer, "Sentinel Scan Report");
        writer.println("Scan: " + report.getScanId());
        writer.println("Target: " + report.getTargetDescriptor());
        writer.println("Status: " + colorize(report.getStatus().name(), getStatusColor(report.getStatus())));
        writer.println("Duration: " + formatDuration(report.getDuration()));
        writer.println();

        printWorkers(writer, report);
        printFindings(writer, report);
        printSummary(writer, report);
        writer.flush();
    }

    private void printWorkers(PrintWriter writer, ScanReport report) {
        printSection(writer, "Workers");
        writer.println("Completed: " + report.getCompletedWorkerCount() + "/" + report.getTotalWorkerCount());
        for (WorkerSnapshot worker : report.getWorkers()) {
            String exit = worker.exitCode() != null ? " exit " + worker.exitCode() : "";
            String color = worker.exitCode() != null && worker.exitCode() != 0 ? ANSI_YELLOW : ANSI_GRAY;
            writer.println("  #" + worker.workerId() + " " + colorize(worker.role(), ANSI_BOLD)
                + " [" + worker.phase() + "] " + colorize(worker.state() + exit, color));
        }
    }

    private void printFindings(PrintWriter writer, ScanReport report) {
        printSection(writer, "Findings");
        List<Finding> findings = report.getFindings();
        if (findings.isEmpty()) {
            printSuccess(writer, "No vulnerabilities found!");
            return;
        }

        writer.println("Found " + colorize(String.valueOf(findings.size()), ANSI_BOLD) + " issues");
        writer.println();
        writer.println(colorize("By Severity:", ANSI_BOLD));
        for (Map.Entry<Severity, Integer> entry : report.getSeverityCounts().entrySet()) {
            if (entry.getValue() > 0) {
                Severity severity = entry.getKey();
                writer.println("  " + colorize(getSeverityIcon(severity) + " " + severity.getDisplayName()
                    + ": " + entry.getValue(), getSeverityColor(severity)));
            }
        }
        writer.println();

        for (Finding finding : findings) {
            printFinding(writer, finding);
        }
    }

    private void printFinding(PrintWriter writer, Finding finding) {
        String color = getSeverityColor(finding.getSeverity());
        writer.println(colorize(getSeverityIcon(finding.getSeverity()) + " "
            + "[" + finding.getSeverity().getDisplayName().toUpperCase() + "] " + finding.getCategory(), color));
        if (finding.getLocation() != null) {
            writer.println("  Location: " + colorize(finding.getLocation(), ANSI_BOLD));
        }
        if (finding.getEvidence() != null) {
            writer.println("  Evidence: " + finding.getEvidence());
        }
        if (finding.getRemediation() != null) {
            writer.println("  " + colorize("Remediation:", ANSI_GREEN) + " " + finding.getRemediation());
        }
        writer.println("  " + colorize("Reported by " + finding.getRole() + " #" + finding.getWorkerId()
            + ", ID: " + finding.getId(), ANSI_GRAY));
        writer.println();
    }

    private void printSummary(PrintWriter writer, ScanReport report) {
        printSection(writer, "Summary");
        String scoreColor = report.getRiskScore() >= 75 ? ANSI_GREEN
            : report.getRiskScore() >= 50 ? ANSI_YELLOW : ANSI_RED;
        writer.println("Risk score: " + colorize(report.getRiskScore() + "/100", scoreColor)
            + " (grade " + colorize(report.getGrade(), ANSI_BOLD) + ")");
        writer.println("Total issues found: " + colorize(String.valueOf(report.getFindings().size()),
            report.hasFindings() ? ANSI_RED : ANSI_GREEN));
        if (report.getCriticalAndHighCount() > 0) {
            writer.println(colorize("Critical/High issues: " + report.getCriticalAndHighCount(), ANSI_RED));
        }
        writer.println("Events recorded: " + report.getEventCount());
    }

    private void printHeader(PrintWriter writer, String title) {
        writer.println(colorize(ANSI_BOLD + "=".repeat(60), ANSI_BLUE));
        writer.println(colorize(ANSI_BOLD + title, ANSI_BLUE));
        writer.println(colorize(ANSI_BOLD + "=".repeat(60), ANSI_BLUE));
        writer.println();
    }

    private void printSection(PrintWriter writer, String title) {
        writer.println();
        writer.println(colorize(ANSI_BOLD + title, ANSI_BLUE));
        writer.println(colorize("-".repeat(60), ANSI_BLUE));
    }

    private void printSuccess(PrintWriter writer, String message) {
        writer.println(colorize("✓ ", ANSI_GREEN) + message);
        writer.println();
    }

    private String getSeverityIcon(Severity severity) {
        return switch (severity) {
            case CRITICAL -> "🔴";
            case HIGH -> "🟠";
            case MEDIUM -> "🟡";
            case LOW -> "🔵";
            case INFO -> "ℹ️";
        };
    }

    private String getSeverityColor(Severity severity) {
        return switch (severity) {
            case CRITICAL, HIGH -> ANSI_RED;
            case MEDIUM -> ANSI_YELLOW;
            case LOW -> ANSI_BLUE;
            case INFO -> ANSI_GRAY;
        };
    }

    private String getStatusColor(ScanStatus status) {
        return switch (status) {
            case RUNNING -> ANSI_CYAN;
            case COMPLETED -> ANSI_GREEN;
            case STOPPED -> ANSI_YELLOW;
        };
    }

    private String colorize(String text, String colorCode) {
        if (!useColors) {
            return text;
        }
        return colorCode + text + ANSI_RESET;
    }

    private String formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        if (seconds < 60) {
            return seconds + "s";
        }
        long minutes = seconds / 60;
        long remainingSeconds = seconds % 60;
        return minutes + "m " + remainingSeconds + "s";
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.CONSOLE;
    }
}
