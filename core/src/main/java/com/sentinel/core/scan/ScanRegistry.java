package com.sentinel.core.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide map from scan identifier to {@link ScanState}.
 *
 * <p>Scans are inserted once at creation and looked up concurrently by the read path
 * and the orchestrator. Only terminal scans can be evicted.
 */
public final class ScanRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ScanRegistry.class);

    private final Map<String, ScanState> scans = new ConcurrentHashMap<>();

    /**
     * Register a newly created scan.
     *
     * @throws IllegalStateException if a scan with the same identifier is already registered
     */
    public ScanState register(ScanState state) {
        ScanState existing = scans.putIfAbsent(state.getScanId(), state);
        if (existing != null) {
            throw new IllegalStateException("Scan already registered: " + state.getScanId());
        }
        return state;
    }

    /**
     * Get a scan by its identifier.
     */
    public Optional<ScanState> get(String scanId) {
        if (scanId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(scans.get(scanId));
    }

    /**
     * Remove a terminal scan.
     *
     * @return {@code true} if the scan was removed, {@code false} if unknown or still running
     */
    public boolean evict(String scanId) {
        boolean[] removed = new boolean[1];
        scans.computeIfPresent(scanId, (id, state) -> {
            if (state.isTerminal()) {
                removed[0] = true;
                return null;
            }
            return state;
        });
        if (removed[0]) {
            logger.debug("Evicted scan {}", scanId);
        }
        return removed[0];
    }

    /**
     * Get all registered scans.
     */
    public List<ScanState> getAll() {
        return new ArrayList<>(scans.values());
    }

    /**
     * Get scans that have not reached a terminal status yet.
     */
    public List<ScanState> getRunning() {
        List<ScanState> running = new ArrayList<>();
        for (ScanState state : scans.values()) {
            if (!state.isTerminal()) {
                running.add(state);
            }
        }
        return running;
    }

    public int size() {
        return scans.size();
    }
}
