package com.sentinel.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * Подписка на скан веб-приложения: печатает историю событий и живой поток
 * до закрытия канала сервером.
 *
 * <p>Коды выхода: 0 - канал закрыт после завершения скана, 1 - скан неизвестен
 * или соединение не установлено, 2 - соединение оборвано.
 */
@Command(
    name = "watch",
    description = "Stream the events of a scan hosted by the web application",
    mixinStandardHelpOptions = true
)
public class WatchCommand implements Callable<Integer> {

    private static final long CONNECT_TIMEOUT_MS = 10000;

    @Parameters(index = "0", description = "Scan identifier")
    private String scanId;

    @Option(
        names = {"-u", "--url"},
        description = "WebSocket base URL of the web application (default: ws://localhost:8080)",
        defaultValue = "ws://localhost:8080"
    )
    private String url;

    @Option(
        names = {"-nc", "--no-color"},
        description = "Disable colored output"
    )
    private boolean noColor;

    @Override
    public Integer call() {
        PrintWriter out = new PrintWriter(System.out, true);

        URI uri;
        try {
            uri = scanUri(url, scanId);
        } catch (URISyntaxException e) {
            out.println("ERROR: Invalid URL: " + e.getMessage());
            return 1;
        }

        ScanFeedClient client = new ScanFeedClient(uri, new ObjectMapper(), new ConsoleEventPrinter(out, !noColor));
        try {
            if (!client.connectBlocking(CONNECT_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                out.println("ERROR: Could not connect to " + uri);
                return 1;
            }
            client.awaitClosed();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            client.close();
            return 2;
        }

        return switch (client.getCloseCode()) {
            case ScanFeedClient.CLOSE_NORMAL -> 0;
            case ScanFeedClient.CLOSE_POLICY_VIOLATION -> {
                out.println("ERROR: Unknown scan " + scanId);
                yield 1;
            }
            default -> {
                out.println("Connection closed: " + client.getCloseReason());
                yield 2;
            }
        };
    }

    static URI scanUri(String baseUrl, String scanId) throws URISyntaxException {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return new URI(base + "/ws/" + scanId);
    }
}
