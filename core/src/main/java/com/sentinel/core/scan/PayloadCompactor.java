package com.sentinel.core.scan;

import com.sentinel.core.model.EventRecord;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces long string values of an event payload with a size marker.
 * Keys, nesting and short values are kept so the event stays readable.
 */
final class PayloadCompactor {
    static final int MAX_KEPT_STRING_CHARS = 1024;

    private PayloadCompactor() {
    }

    /**
     * @return compacted copy; its {@code sizeBytes} is reduced by the bytes that were removed
     */
    static EventRecord compact(EventRecord event) {
        long[] removed = new long[1];
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) compactValue(event.data(), removed);
        if (removed[0] == 0) {
            return event;
        }
        long remaining = Math.max(0, event.sizeBytes() - removed[0]);
        return new EventRecord(event.type(), event.workerId(), event.role(), event.scanId(),
            data, event.timestamp(), remaining);
    }

    static String marker(long bytes) {
        return "[compacted " + bytes + " bytes]";
    }

    private static Object compactValue(Object value, long[] removed) {
        if (value instanceof String) {
            String text = (String) value;
            if (text.length() <= MAX_KEPT_STRING_CHARS) {
                return text;
            }
            long bytes = text.getBytes(StandardCharsets.UTF_8).length;
            removed[0] += bytes;
            return marker(bytes);
        }
        if (value instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) value;
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), compactValue(v, removed)));
            return copy;
        }
        if (value instanceof List) {
            List<?> list = (List<?>) value;
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(compactValue(item, removed));
            }
            return copy;
        }
        return value;
    }
}
