package com.sentinel.core.protocol;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class BoundedLineReaderTest {

    private static BoundedLineReader reader(String content, int maxLineBytes) {
        return new BoundedLineReader(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)), maxLineBytes);
    }

    @Test
    void testSplitsLinesAndStripsCarriageReturn() throws IOException {
        BoundedLineReader reader = reader("first\r\nsecond\n\nlast", 64);

        assertEquals("first", reader.readLine().text());
        assertEquals("second", reader.readLine().text());
        assertTrue(reader.readLine().isBlank());
        assertEquals("last", reader.readLine().text());
        assertNull(reader.readLine());
        assertNull(reader.readLine());
    }

    @Test
    void testOversizedLineIsDiscardedAndMeasured() throws IOException {
        String longLine = "x".repeat(50_000);
        BoundedLineReader reader = reader(longLine + "\n{\"type\":\"agent.log\"}\n", 1024);

        RawLine oversized = reader.readLine();
        assertTrue(oversized.oversized());
        assertEquals(50_000, oversized.length());
        assertEquals(0, oversized.bytes().length);

        RawLine next = reader.readLine();
        assertFalse(next.oversized());
        assertEquals("{\"type\":\"agent.log\"}", next.text());
    }

    @Test
    void testLineExactlyAtCeilingIsKept() throws IOException {
        BoundedLineReader reader = reader("abcd\n", 4);

        RawLine line = reader.readLine();
        assertFalse(line.oversized());
        assertEquals("abcd", line.text());
    }

    @Test
    void testRejectsNonPositiveCeiling() {
        assertThrows(IllegalArgumentException.class, () -> reader("", 0));
    }

    @Test
    void testRawLinesCompareByContent() {
        RawLine first = RawLine.of("abc".getBytes(StandardCharsets.UTF_8));
        RawLine second = RawLine.of("abc".getBytes(StandardCharsets.UTF_8));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, RawLine.of("abd".getBytes(StandardCharsets.UTF_8)));
        assertNotEquals(RawLine.oversized(3), RawLine.of(new byte[0]));
    }
}
