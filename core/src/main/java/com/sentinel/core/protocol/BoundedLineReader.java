package com.sentinel.core.protocol;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Splits a byte stream into newline-terminated lines with a hard per-line ceiling.
 *
 * <p>Bytes beyond the ceiling are consumed and counted but not buffered, so a worker that
 * writes a gigabyte without a newline costs at most {@code maxLineBytes} of heap.
 * A trailing {@code \r} is stripped. A final line without terminator is returned at EOF.
 *
 * <p>Not thread-safe: one reader per stream.
 */
public final class BoundedLineReader {

    private static final int CHUNK_SIZE = 8192;

    private final InputStream in;
    private final int maxLineBytes;
    private final byte[] chunk = new byte[CHUNK_SIZE];
    private int chunkPos;
    private int chunkLen;
    private boolean eof;

    public BoundedLineReader(InputStream in, int maxLineBytes) {
        this.in = Objects.requireNonNull(in, "in cannot be null");
        if (maxLineBytes <= 0) {
            throw new IllegalArgumentException("maxLineBytes must be positive: " + maxLineBytes);
        }
        this.maxLineBytes = maxLineBytes;
    }

    /**
     * Read the next line.
     *
     * @return the line, or {@code null} at end of stream
     * @throws IOException if the underlying stream fails
     */
    public RawLine readLine() throws IOException {
        if (eof && chunkPos >= chunkLen) {
            return null;
        }

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        long length = 0;
        boolean sawAny = false;

        while (true) {
            if (chunkPos >= chunkLen) {
                if (!fill()) {
                    if (!sawAny) {
                        return null;
                    }
                    return finish(buffer, length);
                }
            }
            sawAny = true;

            int start = chunkPos;
            int newline = -1;
            for (int i = chunkPos; i < chunkLen; i++) {
                if (chunk[i] == '\n') {
                    newline = i;
                    break;
                }
            }

            int end = newline >= 0 ? newline : chunkLen;
            int count = end - start;
            if (length + count <= maxLineBytes) {
                buffer.write(chunk, start, count);
            } else if (length < maxLineBytes) {
                // keep nothing once the ceiling is crossed
                buffer.reset();
            }
            length += count;
            chunkPos = newline >= 0 ? newline + 1 : chunkLen;

            if (newline >= 0) {
                return finish(buffer, length);
            }
        }
    }

    private RawLine finish(ByteArrayOutputStream buffer, long length) {
        if (length > maxLineBytes) {
            return RawLine.oversized(length);
        }
        byte[] bytes = buffer.toByteArray();
        if (bytes.length > 0 && bytes[bytes.length - 1] == '\r') {
            byte[] trimmed = new byte[bytes.length - 1];
            System.arraycopy(bytes, 0, trimmed, 0, trimmed.length);
            return new RawLine(trimmed, length, false);
        }
        return new RawLine(bytes, length, false);
    }

    private boolean fill() throws IOException {
        if (eof) {
            return false;
        }
        int n = in.read(chunk, 0, chunk.length);
        if (n < 0) {
            eof = true;
            chunkPos = 0;
            chunkLen = 0;
            return false;
        }
        chunkPos = 0;
        chunkLen = n;
        return true;
    }
}
