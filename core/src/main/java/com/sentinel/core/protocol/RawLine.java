package com.sentinel.core.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One line read from a worker's standard output, without its terminator.
 *
 * <p>Equality compares line content, not array identity.
 */
public final class RawLine {

    private final byte[] bytes;
    private final long length;
    private final boolean oversized;

    /**
     * @param bytes line content; empty when the line was oversized
     * @param length full length of the line in bytes, including any discarded part
     * @param oversized whether the line exceeded the configured ceiling
     */
    public RawLine(byte[] bytes, long length, boolean oversized) {
        this.bytes = Objects.requireNonNull(bytes, "Bytes cannot be null");
        this.length = length;
        this.oversized = oversized;
    }

    public static RawLine of(byte[] bytes) {
        return new RawLine(bytes, bytes.length, false);
    }

    public static RawLine oversized(long length) {
        return new RawLine(new byte[0], length, true);
    }

    public byte[] bytes() {
        return bytes;
    }

    public long length() {
        return length;
    }

    public boolean oversized() {
        return oversized;
    }

    public boolean isBlank() {
        if (oversized) {
            return false;
        }
        for (byte b : bytes) {
            if (!Character.isWhitespace(b)) {
                return false;
            }
        }
        return true;
    }

    public String text() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RawLine)) {
            return false;
        }
        RawLine other = (RawLine) o;
        return length == other.length && oversized == other.oversized && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(length, oversized) + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return oversized ? "RawLine[oversized, " + length + " bytes]" : "RawLine[" + length + " bytes]";
    }
}
