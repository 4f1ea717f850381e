package com.sentinel.cli;

import com.sentinel.core.model.ScanSnapshot;
import com.sentinel.core.model.ScanStatus;
import com.sentinel.core.model.WorkerSpec;
import com.sentinel.core.scan.OrchestratorConfig;
import com.sentinel.core.scan.ScanManager;
import com.sentinel.report.ReportFormat;
import com.sentinel.report.Reporter;
import com.sentinel.report.ReporterFactory;
import com.sentinel.report.ScanReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.FileWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Запуск скана в текущем процессе.
 *
 * <p>События печатаются по мере поступления (в режиме json - в stderr, чтобы stdout
 * содержал только отчет), после завершения выводится отчет. Ctrl-C останавливает скан.
 *
 * <p>Коды выхода: 0 - скан завершен, 1 - ошибка параметров, 2 - скан остановлен, 99 - непредвиденная ошибка.
 */
@Command(
    name = "run",
    description = "Run a scan locally and print its events and report",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(RunCommand.class);

    static final int EXIT_COMPLETED = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_STOPPED = 2;
    static final int EXIT_UNEXPECTED = 99;

    private static final long CLOSE_WAIT_MS = 5000;

    @Option(
        names = {"-t", "--target"},
        required = true,
        description = "Target descriptor passed to every worker (usually a URL)"
    )
    private String target;

    @Option(
        names = {"-w", "--worker"},
        required = true,
        description = "Worker as role=command, repeatable (e.g. xss=\"python3 agents/xss.py\")"
    )
    private List<String> workers;

    @Option(
        names = {"-e", "--env"},
        description = "Extra environment variable for every worker, as KEY=VALUE"
    )
    private Map<String, String> environment = new LinkedHashMap<>();

    @Option(
        names = {"-f", "--format"},
        description = "Report format: console, json (default: console)"
    )
    private String format;

    @Option(
        names = {"-nc", "--no-color"},
        description = "Disable colored output"
    )
    private boolean noColor;

    @Option(
        names = {"-o", "--output"},
        description = "Output file for the report (optional, defaults to stdout)"
    )
    private String outputFile;

    @Option(
        names = {"--max-line-bytes"},
        description = "Longest accepted worker output line in bytes (default: 32 MiB)"
    )
    private Integer maxLineBytes;

    @Option(
        names = {"--working-dir"},
        description = "Working directory for worker processes"
    )
    private Path workingDirectory;

    @Override
    public Integer call() {
        PrintWriter out = new PrintWriter(System.out, true);

        List<WorkerSpec> specs;
        try {
            specs = WorkerOptionParser.parseAll(workers, environment);
        } catch (IllegalArgumentException e) {
            out.println("ERROR: " + e.getMessage());
            return EXIT_INVALID;
        }
        ReportFormat reportFormat = parseFormat(format);

        OrchestratorConfig.Builder config = OrchestratorConfig.builder().workingDirectory(workingDirectory);
        if (maxLineBytes != null && maxLineBytes > 0) {
            config.maxLineBytes(maxLineBytes);
        }

        PrintWriter eventWriter = reportFormat == ReportFormat.JSON ? new PrintWriter(System.err, true) : out;
        ConsoleEventPrinter printer = new ConsoleEventPrinter(eventWriter, !noColor && reportFormat == ReportFormat.CONSOLE);

        try (ScanManager manager = new ScanManager(config.build())) {
            String scanId;
            try {
                scanId = manager.startScan(target, specs);
            } catch (IllegalArgumentException e) {
                out.println("ERROR: " + e.getMessage());
                return EXIT_INVALID;
            }
            manager.join(scanId, printer);

            CountDownLatch reported = new CountDownLatch(1);
            Thread stopHook = new Thread(() -> {
                if (manager.stopScan(scanId)) {
                    try {
                        reported.await(CLOSE_WAIT_MS, TimeUnit.MILLISECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            }, "scan-stop-hook");
            Runtime.getRuntime().addShutdownHook(stopHook);

            try {
                ScanSnapshot snapshot = awaitTerminal(manager, scanId);
                if (!printer.awaitClosed(CLOSE_WAIT_MS)) {
                    logger.warn("Event stream of scan {} did not close in time", scanId);
                }
                writeReport(ScanReport.from(snapshot), reportFormat, out);
                return snapshot.status() == ScanStatus.COMPLETED ? EXIT_COMPLETED : EXIT_STOPPED;
            } finally {
                reported.countDown();
                removeHook(stopHook);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            out.println("ERROR: Interrupted while waiting for the scan");
            return EXIT_STOPPED;
        } catch (Exception e) {
            logger.error("Scan run failed", e);
            out.println("ERROR: Unexpected error occurred: " + e.getMessage());
            return EXIT_UNEXPECTED;
        }
    }

    private static ScanSnapshot awaitTerminal(ScanManager manager, String scanId) throws InterruptedException {
        while (true) {
            Optional<ScanSnapshot> snapshot = manager.awaitScan(scanId, Duration.ofSeconds(1));
            if (snapshot.isEmpty()) {
                throw new IllegalStateException("Scan " + scanId + " disappeared from the registry");
            }
            if (snapshot.get().status().isTerminal()) {
                return snapshot.get();
            }
        }
    }

    private void writeReport(ScanReport report, ReportFormat reportFormat, PrintWriter out) throws Exception {
        Reporter reporter = ReporterFactory.createReporter(reportFormat, !noColor);
        if (outputFile != null) {
            try (PrintWriter fileWriter = new PrintWriter(new FileWriter(outputFile, StandardCharsets.UTF_8))) {
                reporter.generate(report, fileWriter);
                out.println("Report written to: " + outputFile);
            }
        } else {
            out.println();
            reporter.generate(report, out);
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down and the hook is running
            logger.debug("Shutdown in progress, stop hook stays registered");
        }
    }

    static ReportFormat parseFormat(String format) {
        if (format == null || format.equalsIgnoreCase("console")) {
            return ReportFormat.CONSOLE;
        } else if (format.equalsIgnoreCase("json")) {
            return ReportFormat.JSON;
        } else {
            return ReportFormat.CONSOLE;
        }
    }
}
