package com.sentinel.core.model;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Типы событий, которые ядро распознает по тегу {@code type}.
 * Все прочие теги относятся к {@link #OTHER} и хранятся как есть.
 */
public enum EventKind {
    STARTED("agent.started"),
    LOG("agent.log"),
    ERROR("agent.error"),
    SCREENSHOT("agent.screenshot"),
    FINDING("vulnerability.found"),
    COMPLETE("agent.complete"),
    OVERSIZED("protocol.oversized"),
    SCAN_COMPLETE("scan.complete"),
    SCAN_STOPPED("scan.stopped"),
    OTHER(null);

    private static final Map<String, EventKind> BY_TAG = Arrays.stream(values())
        .filter(kind -> kind.tag != null)
        .collect(Collectors.toUnmodifiableMap(EventKind::getTag, Function.identity()));

    private final String tag;

    EventKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public boolean isTerminal() {
        return this == SCAN_COMPLETE || this == SCAN_STOPPED;
    }

    public static EventKind fromTag(String tag) {
        if (tag == null) {
            return OTHER;
        }
        return BY_TAG.getOrDefault(tag, OTHER);
    }
}
