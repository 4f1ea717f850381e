package com.sentinel.cli;

import com.sentinel.core.model.WorkerRole;
import com.sentinel.core.model.WorkerSpec;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkerOptionParserTest {

    @Test
    void testParseRoleAndCommand() {
        WorkerSpec spec = WorkerOptionParser.parse("xss=python3  agents/xss.py --fast", Map.of("MODE", "safe"));

        assertEquals(WorkerRole.XSS, spec.role());
        assertEquals(List.of("python3", "agents/xss.py", "--fast"), spec.command());
        assertEquals(Map.of("MODE", "safe"), spec.environment());
    }

    @Test
    void testCommandMayContainEquals() {
        WorkerSpec spec = WorkerOptionParser.parse("headers_tls=./check.sh --mode=strict", Map.of());

        assertEquals(WorkerRole.HEADERS_TLS, spec.role());
        assertEquals(List.of("./check.sh", "--mode=strict"), spec.command());
    }

    @Test
    void testRejectsMalformedOptions() {
        assertThrows(IllegalArgumentException.class, () -> WorkerOptionParser.parse("spider", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> WorkerOptionParser.parse("=./spider.sh", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> WorkerOptionParser.parse("spider=  ", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> WorkerOptionParser.parse("wizard=./w.sh", Map.of()));
    }

    @Test
    void testParseAllKeepsOrder() {
        List<WorkerSpec> specs = WorkerOptionParser.parseAll(
            List.of("cors=./cors.sh", "spider=./spider.sh"), Map.of());

        assertEquals(WorkerRole.CORS, specs.get(0).role());
        assertEquals(WorkerRole.SPIDER, specs.get(1).role());
    }
}
