package com.sentinel.core.scan;

import com.sentinel.core.model.ScanPhase;
import com.sentinel.core.model.WorkerSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Workers of one scan grouped into phases.
 *
 * <p>Phases run in declaration order of {@link ScanPhase}; within a phase workers keep
 * the order in which they were requested.
 */
public final class ScanPlan {
    private final Map<ScanPhase, List<WorkerSpec>> phases;
    private final int size;

    private ScanPlan(Map<ScanPhase, List<WorkerSpec>> phases, int size) {
        this.phases = phases;
        this.size = size;
    }

    /**
     * Проверяет и группирует спецификации воркеров.
     *
     * @param specs запрошенные воркеры
     * @return план скана
     * @throws IllegalArgumentException если список пуст или в фазе разведки больше одного воркера
     */
    public static ScanPlan of(List<WorkerSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            throw new IllegalArgumentException("At least one worker is required");
        }
        Map<ScanPhase, List<WorkerSpec>> grouped = new EnumMap<>(ScanPhase.class);
        for (ScanPhase phase : ScanPhase.values()) {
            grouped.put(phase, new ArrayList<>());
        }
        for (WorkerSpec spec : specs) {
            if (spec == null) {
                throw new IllegalArgumentException("Worker spec cannot be null");
            }
            grouped.get(spec.role().getPhase()).add(spec);
        }
        if (grouped.get(ScanPhase.MAPPING).size() > 1) {
            throw new IllegalArgumentException("At most one mapping worker is allowed, got "
                + grouped.get(ScanPhase.MAPPING).size());
        }
        grouped.replaceAll((phase, list) -> Collections.unmodifiableList(list));
        return new ScanPlan(grouped, specs.size());
    }

    public List<WorkerSpec> workersIn(ScanPhase phase) {
        return phases.get(phase);
    }

    /**
     * All workers in execution order.
     */
    public List<WorkerSpec> ordered() {
        List<WorkerSpec> all = new ArrayList<>(size);
        for (ScanPhase phase : ScanPhase.values()) {
            all.addAll(phases.get(phase));
        }
        return all;
    }

    public int size() {
        return size;
    }
}
