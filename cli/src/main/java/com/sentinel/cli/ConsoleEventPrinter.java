package com.sentinel.cli;

import com.sentinel.core.broadcast.EventSink;
import com.sentinel.core.model.EventKind;
import com.sentinel.core.model.EventRecord;
import com.sentinel.core.model.Finding;

import java.io.PrintWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Печатает события скана по одной строке на событие.
 * Закрытие канала сервером (после терминального события) отпускает {@link #awaitClosed(long)}.
 */
public class ConsoleEventPrinter implements EventSink {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_GRAY = "\u001B[90m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";

    private static final DateTimeFormatter TIME_FORMAT =
        DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneId.systemDefault());

    private final PrintWriter writer;
    private final boolean useColors;
    private final CountDownLatch closed = new CountDownLatch(1);

    public ConsoleEventPrinter(PrintWriter writer, boolean useColors) {
        this.writer = writer;
        this.useColors = useColors;
    }

    @Override
    public void send(EventRecord event) {
        synchronized (writer) {
            writer.println(format(event));
            writer.flush();
        }
    }

    @Override
    public void close() {
        closed.countDown();
    }

    public boolean awaitClosed(long timeoutMs) throws InterruptedException {
        return closed.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    String format(EventRecord event) {
        String time = TIME_FORMAT.format(Instant.ofEpochMilli((long) (event.timestamp() * 1000)));
        String source = event.workerId() == 0 ? event.role() : "#" + event.workerId() + " " + event.role();
        return colorize(time, ANSI_GRAY) + " "
            + String.format("%-16s", source) + " "
            + colorize(String.format("%-16s", event.type()), colorFor(event)) + " "
            + describe(event);
    }

    static String describe(EventRecord event) {
        Map<String, Object> data = event.data();
        return switch (event.kind()) {
            case LOG -> {
                String level = event.dataString("level");
                String message = event.dataString("message");
                String text = (level != null ? level + " " : "") + (message != null ? message : "");
                String reason = event.dataString("reason");
                if (reason != null) {
                    text += " (" + reason + (data.get("exitCode") != null ? ", exit " + data.get("exitCode") : "") + ")";
                }
                yield text.trim();
            }
            case ERROR -> {
                String message = event.dataString("message");
                yield message != null ? message : String.valueOf(data);
            }
            case FINDING -> Finding.fromEvent(event)
                .map(f -> "[" + f.getSeverity().name() + "] " + f.getCategory()
                    + (f.getLocation() != null ? " at " + f.getLocation() : ""))
                .orElse("finding");
            case STARTED -> "started";
            case SCREENSHOT -> "screenshot";
            case OVERSIZED -> "line dropped, " + data.get("lengthBytes") + " bytes";
            case COMPLETE -> "finished";
            case SCAN_COMPLETE -> "scan complete: " + data.get("totalFindings") + " finding(s), "
                + data.get("completedWorkers") + "/" + data.get("totalWorkers") + " worker(s)";
            case SCAN_STOPPED -> "scan stopped (" + data.get("reason") + "): "
                + data.get("completedWorkers") + "/" + data.get("totalWorkers") + " worker(s)";
            default -> data.isEmpty() ? "" : String.valueOf(data);
        };
    }

    private static String colorFor(EventRecord event) {
        EventKind kind = event.kind();
        return switch (kind) {
            case ERROR, OVERSIZED -> ANSI_RED;
            case FINDING -> ANSI_YELLOW;
            case COMPLETE, SCAN_COMPLETE -> ANSI_GREEN;
            case SCAN_STOPPED -> ANSI_BOLD;
            case LOG -> "ERROR".equalsIgnoreCase(event.dataString("level")) ? ANSI_RED : ANSI_GRAY;
            default -> ANSI_CYAN;
        };
    }

    private String colorize(String text, String color) {
        return useColors ? color + text + ANSI_RESET : text;
    }
}
