package com.sentinel.core.persist;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinel.core.model.EventKind;
import com.sentinel.core.model.EventRecord;
import com.sentinel.core.model.Finding;
import com.sentinel.core.model.ScanSnapshot;
import com.sentinel.core.model.ScanStatus;
import com.sentinel.core.model.Severity;
import com.sentinel.core.model.WorkerIdentity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonLinesScanPersistenceTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testAppendsEventsAndFindingsAsJsonLines() throws Exception {
        JsonLinesScanPersistence persistence = new JsonLinesScanPersistence(tempDir);
        WorkerIdentity worker = new WorkerIdentity("scan-9", 1, "sqli");

        persistence.appendEvent(EventRecord.synthetic(EventKind.STARTED, worker, Map.of()));
        persistence.appendEvent(EventRecord.synthetic(EventKind.COMPLETE, worker, Map.of("ok", true)));
        persistence.appendFinding("scan-9", new Finding("SQL Injection", Severity.CRITICAL, "/login", "error-based",
            null, 1, "sqli", Map.of("cwe", "CWE-89")));

        List<String> events = Files.readAllLines(tempDir.resolve("scan-9").resolve(JsonLinesScanPersistence.EVENTS_FILE));
        assertEquals(2, events.size());
        assertEquals("agent.started", mapper.readTree(events.get(0)).get("type").asText());
        assertEquals("agent.complete", mapper.readTree(events.get(1)).get("type").asText());

        List<String> findings = Files.readAllLines(tempDir.resolve("scan-9").resolve(JsonLinesScanPersistence.FINDINGS_FILE));
        assertEquals(1, findings.size());
        JsonNode finding = mapper.readTree(findings.get(0));
        assertEquals("CRITICAL", finding.get("severity").asText());
        assertEquals("/login", finding.get("location").asText());
    }

    @Test
    void testWritesStatusSnapshot() throws Exception {
        JsonLinesScanPersistence persistence = new JsonLinesScanPersistence(tempDir);
        ScanSnapshot snapshot = new ScanSnapshot("scan-9", "https://target.example", ScanStatus.COMPLETED,
            2, 2, 10, List.of(), List.of(), Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-01T00:05:00Z"));

        persistence.writeStatus(snapshot);

        JsonNode status = mapper.readTree(tempDir.resolve("scan-9").resolve(JsonLinesScanPersistence.STATUS_FILE).toFile());
        assertEquals("COMPLETED", status.get("status").asText());
        assertEquals(2, status.get("totalWorkerCount").asInt());
        assertEquals("2024-01-01T00:05:00Z", status.get("endedAt").asText());
        assertFalse(Files.exists(tempDir.resolve("scan-9").resolve(JsonLinesScanPersistence.STATUS_FILE + ".tmp")));
    }
}
