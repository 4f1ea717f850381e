package com.sentinel.core.model;

/**
 * Статус скана. Переходы монотонны: RUNNING → COMPLETED или RUNNING → STOPPED.
 */
public enum ScanStatus {
    RUNNING,
    COMPLETED,
    STOPPED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
