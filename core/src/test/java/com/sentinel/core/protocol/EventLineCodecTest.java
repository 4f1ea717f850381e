package com.sentinel.core.protocol;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinel.core.model.EventKind;
import com.sentinel.core.model.EventRecord;
import com.sentinel.core.model.WorkerIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventLineCodecTest {

    private static final WorkerIdentity WORKER = new WorkerIdentity("scan-42", 2, "cors");

    private EventLineCodec codec;

    @BeforeEach
    void setUp() {
        codec = new EventLineCodec(new ObjectMapper(), 4096);
    }

    private static RawLine line(String text) {
        return RawLine.of(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testDecodesValidRecord() {
        EventRecord event = codec.decode(line(
            "{\"type\":\"agent.log\",\"data\":{\"message\":\"probing\",\"level\":\"INFO\"},\"timestamp\":1700000000.5}"),
            WORKER);

        assertEquals("agent.log", event.type());
        assertEquals(EventKind.LOG, event.kind());
        assertEquals("probing", event.dataString("message"));
        assertEquals(1700000000.5, event.timestamp());
        assertEquals(2, event.workerId());
        assertEquals("scan-42", event.scanId());
        assertTrue(event.sizeBytes() > 0);
    }

    @Test
    void testIdentityIsTakenFromContextNotFromLine() {
        EventRecord event = codec.decode(line(
            "{\"type\":\"vulnerability.found\",\"agentId\":7,\"workerId\":7,\"role\":\"spider\",\"scanId\":\"other-scan\",\"data\":{}}"),
            WORKER);

        assertEquals(2, event.workerId());
        assertEquals("cors", event.role());
        assertEquals("scan-42", event.scanId());
    }

    @Test
    void testMissingTimestampIsBackfilled() {
        double before = EventRecord.nowSeconds();
        EventRecord event = codec.decode(line("{\"type\":\"agent.started\"}"), WORKER);

        assertTrue(event.timestamp() >= before);
        assertTrue(event.data().isEmpty());
    }

    @Test
    void testUnknownTypeIsKeptVerbatim() {
        EventRecord event = codec.decode(line("{\"type\":\"network.request\",\"data\":{\"url\":\"/api\"}}"), WORKER);

        assertEquals("network.request", event.type());
        assertEquals(EventKind.OTHER, event.kind());
    }

    @Test
    void testNonObjectDataIsWrapped() {
        EventRecord event = codec.decode(line("{\"type\":\"agent.thought\",\"data\":\"thinking\"}"), WORKER);

        assertEquals(Map.of("value", "thinking"), event.data());
    }

    @Test
    void testGarbledLineYieldsOneSyntheticLogEvent() {
        EventRecord event = codec.decode(line("Traceback (most recent call last): {oops"), WORKER);

        assertEquals(EventKind.LOG, event.kind());
        assertEquals(Boolean.TRUE, event.data().get("malformed"));
        assertEquals("Traceback (most recent call last): {oops", event.dataString("message"));
        assertEquals(2, event.workerId());
    }

    @Test
    void testRecordWithoutTypeIsMalformed() {
        EventRecord event = codec.decode(line("{\"data\":{\"x\":1}}"), WORKER);

        assertEquals(EventKind.LOG, event.kind());
        assertEquals(Boolean.TRUE, event.data().get("malformed"));
    }

    @Test
    void testJsonArrayIsMalformed() {
        EventRecord event = codec.decode(line("[1,2,3]"), WORKER);

        assertEquals(Boolean.TRUE, event.data().get("malformed"));
    }

    @Test
    void testOversizedLineYieldsOversizedEvent() {
        EventRecord event = codec.decode(RawLine.oversized(10_000_000), WORKER);

        assertEquals(EventKind.OVERSIZED, event.kind());
        assertEquals(10_000_000L, ((Number) event.data().get("lengthBytes")).longValue());
        assertEquals(4096, ((Number) event.data().get("limitBytes")).intValue());
        assertEquals("scan-42", event.scanId());
    }

    @Test
    void testEncodeUsesWireShape() throws Exception {
        EventRecord event = new EventRecord("agent.complete", 2, "cors", "scan-42", Map.of("ok", true), 12.5, 99);

        String json = codec.encode(event);

        assertEquals("{\"type\":\"agent.complete\",\"workerId\":2,\"role\":\"cors\",\"scanId\":\"scan-42\","
            + "\"data\":{\"ok\":true},\"timestamp\":12.5}", json);
    }

    @Test
    void testLongStringUnderLineCeilingIsDecoded() {
        EventLineCodec large = new EventLineCodec(new ObjectMapper(), 32 * 1024 * 1024);
        String image = "A".repeat(21_000_000);

        EventRecord event = large.decode(line("{\"type\":\"agent.screenshot\",\"data\":{\"image\":\"" + image + "\"}}"),
            WORKER);

        assertEquals(EventKind.SCREENSHOT, event.kind());
        assertEquals(image.length(), event.dataString("image").length());
        assertNull(event.data().get("malformed"));
    }

    @Test
    void testSharedMapperIsNotReconfigured() throws Exception {
        ObjectMapper shared = new ObjectMapper();
        new EventLineCodec(shared, 64 * 1024 * 1024);

        assertEquals("{\"a\":1}", shared.readTree("{\"a\":1} trailing").toString());
    }

    @Test
    void testSecondRecordOnSameLineIsNotDropped() {
        String text = "{\"type\":\"agent.started\"}{\"type\":\"vulnerability.found\",\"data\":{\"severity\":\"critical\"}}";

        EventRecord event = codec.decode(line(text), WORKER);

        assertEquals(EventKind.LOG, event.kind());
        assertEquals(Boolean.TRUE, event.data().get("malformed"));
        assertEquals(text, event.dataString("message"));
    }

    @Test
    void testTrailingGarbageIsMalformed() {
        EventRecord event = codec.decode(line("{\"type\":\"x\"} garbage"), WORKER);

        assertEquals(EventKind.LOG, event.kind());
        assertEquals(Boolean.TRUE, event.data().get("malformed"));
    }

    @Test
    void testTruncatedMalformedTextIsFlagged() {
        String text = "x".repeat(EventLineCodec.MAX_MALFORMED_TEXT_CHARS + 10);
        EventLineCodec wide = new EventLineCodec(new ObjectMapper(), 1024 * 1024);

        EventRecord event = wide.decode(line(text), WORKER);

        assertEquals(EventLineCodec.MAX_MALFORMED_TEXT_CHARS, event.dataString("message").length());
        assertEquals(Boolean.TRUE, event.data().get("truncated"));
        assertEquals((long) text.length(), ((Number) event.data().get("lengthBytes")).longValue());
    }

    @Test
    void testShortMalformedTextIsNotFlagged() {
        EventRecord event = codec.decode(line("not json"), WORKER);

        assertEquals(Boolean.FALSE, event.data().get("truncated"));
        assertEquals(8L, ((Number) event.data().get("lengthBytes")).longValue());
    }
}
