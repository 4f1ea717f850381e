package com.sentinel.core.model;

/**
 * Фазы скана в порядке выполнения.
 * Фаза N+1 стартует только после выхода всех воркеров фазы N.
 */
public enum ScanPhase {
    /** Картирование поверхности атаки: не более одного воркера. */
    MAPPING(false),

    /** Быстрые воркеры без общего лимита: стартуют одновременно. */
    PARALLEL(true),

    /** Воркеры с общим внешним лимитом запросов: строго по одному. */
    RATE_LIMITED(false);

    private final boolean concurrent;

    ScanPhase(boolean concurrent) {
        this.concurrent = concurrent;
    }

    public boolean isConcurrent() {
        return concurrent;
    }
}
