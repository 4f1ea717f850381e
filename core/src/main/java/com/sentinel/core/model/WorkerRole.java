package com.sentinel.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of worker roles. The orchestrator only needs a role's tag and phase,
 * never its detection logic.
 */
public enum WorkerRole {
    SPIDER("spider", ScanPhase.MAPPING),
    EXPOSURE("exposure", ScanPhase.PARALLEL),
    HEADERS_TLS("headers_tls", ScanPhase.PARALLEL),
    CORS("cors", ScanPhase.PARALLEL),
    PORTSCAN("portscan", ScanPhase.PARALLEL),
    AUTH_ABUSE("auth_abuse", ScanPhase.PARALLEL),
    SQLI("sqli", ScanPhase.PARALLEL),
    XSS("xss", ScanPhase.PARALLEL),
    CUSTOM("custom", ScanPhase.PARALLEL),
    LLM_ANALYSIS("llm_analysis", ScanPhase.RATE_LIMITED),
    RED_TEAM("red_team", ScanPhase.RATE_LIMITED);

    private static final Map<String, WorkerRole> BY_TAG = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(WorkerRole::getTag, Function.identity()));

    private final String tag;
    private final ScanPhase phase;

    WorkerRole(String tag, ScanPhase phase) {
        this.tag = tag;
        this.phase = phase;
    }

    public String getTag() {
        return tag;
    }

    public ScanPhase getPhase() {
        return phase;
    }

    /**
     * Resolve a role from its wire tag.
     *
     * @param tag role tag, case-insensitive
     * @return the role
     * @throws IllegalArgumentException if the tag is unknown
     */
    public static WorkerRole fromTag(String tag) {
        if (tag == null) {
            throw new IllegalArgumentException("Worker role tag cannot be null");
        }
        WorkerRole role = BY_TAG.get(tag.trim().toLowerCase(Locale.ROOT));
        if (role == null) {
            throw new IllegalArgumentException("Unknown worker role: '" + tag + "'");
        }
        return role;
    }
}
