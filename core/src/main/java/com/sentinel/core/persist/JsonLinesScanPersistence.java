package com.sentinel.core.persist;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sentinel.core.model.EventRecord;
import com.sentinel.core.model.Finding;
import com.sentinel.core.model.ScanSnapshot;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Хранение скана в файловой системе в формате JSON Lines.
 *
 * <p>Структура каталога:
 * <pre>
 * {base}/{scanId}/events.jsonl    - все события по порядку
 * {base}/{scanId}/findings.jsonl  - извлеченные уязвимости
 * {base}/{scanId}/status.json     - итоговый снимок состояния
 * </pre>
 */
public final class JsonLinesScanPersistence implements ScanPersistence {

    public static final String EVENTS_FILE = "events.jsonl";
    public static final String FINDINGS_FILE = "findings.jsonl";
    public static final String STATUS_FILE = "status.json";

    private final Path baseDirectory;
    private final ObjectMapper objectMapper;

    public JsonLinesScanPersistence(Path baseDirectory) {
        this.baseDirectory = baseDirectory;
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }

    public Path scanDirectory(String scanId) {
        return baseDirectory.resolve(scanId);
    }

    @Override
    public void appendEvent(EventRecord event) throws IOException {
        appendLine(event.scanId(), EVENTS_FILE, objectMapper.writeValueAsString(event));
    }

    @Override
    public void appendFinding(String scanId, Finding finding) throws IOException {
        appendLine(scanId, FINDINGS_FILE, objectMapper.writeValueAsString(finding));
    }

    @Override
    public void writeStatus(ScanSnapshot snapshot) throws IOException {
        Path directory = Files.createDirectories(scanDirectory(snapshot.scanId()));
        Path temp = directory.resolve(STATUS_FILE + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
        Files.move(temp, directory.resolve(STATUS_FILE), StandardCopyOption.REPLACE_EXISTING);
    }

    private void appendLine(String scanId, String fileName, String json) throws IOException {
        Path directory = Files.createDirectories(scanDirectory(scanId));
        Files.writeString(directory.resolve(fileName), json + "\n", StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }
}
