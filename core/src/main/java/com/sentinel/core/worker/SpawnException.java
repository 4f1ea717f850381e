package com.sentinel.core.worker;

/**
 * Thrown when a worker process cannot be started: empty command, missing executable,
 * invalid environment or working directory.
 */
public class SpawnException extends Exception {

    private final int workerId;

    public SpawnException(int workerId, String message) {
        super(message);
        this.workerId = workerId;
    }

    public SpawnException(int workerId, String message, Throwable cause) {
        super(message, cause);
        this.workerId = workerId;
    }

    public int getWorkerId() {
        return workerId;
    }
}
