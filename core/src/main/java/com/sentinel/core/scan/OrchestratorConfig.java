package com.sentinel.core.scan;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Limits and tuning of the orchestration core.
 */
public final class OrchestratorConfig {
    public static final int DEFAULT_MAX_LINE_BYTES = 32 * 1024 * 1024;
    public static final long DEFAULT_MAX_RETAINED_PAYLOAD_BYTES = 64L * 1024 * 1024;
    public static final int DEFAULT_COMPACTION_THRESHOLD_BYTES = 64 * 1024;
    public static final int DEFAULT_SUBSCRIBER_BACKLOG = 4096;
    public static final int DEFAULT_STDERR_TAIL_LINES = 20;
    public static final int DEFAULT_PERSISTENCE_QUEUE_CAPACITY = 10_000;
    public static final long DEFAULT_SUBSCRIBER_BACKLOG_BYTES = DEFAULT_MAX_RETAINED_PAYLOAD_BYTES;
    public static final long DEFAULT_PERSISTENCE_QUEUE_BYTES = DEFAULT_MAX_RETAINED_PAYLOAD_BYTES;

    private final int maxLineBytes;
    private final long maxRetainedPayloadBytes;
    private final int compactionThresholdBytes;
    private final int subscriberBacklog;
    private final long subscriberBacklogBytes;
    private final int stderrTailLines;
    private final int persistenceQueueCapacity;
    private final long persistenceQueueBytes;
    private final Duration shutdownTimeout;
    private final Path workingDirectory;

    private OrchestratorConfig(Builder builder) {
        this.maxLineBytes = positive(builder.maxLineBytes, "maxLineBytes");
        this.maxRetainedPayloadBytes = positive(builder.maxRetainedPayloadBytes, "maxRetainedPayloadBytes");
        this.compactionThresholdBytes = positive(builder.compactionThresholdBytes, "compactionThresholdBytes");
        this.subscriberBacklog = positive(builder.subscriberBacklog, "subscriberBacklog");
        this.subscriberBacklogBytes = positive(builder.subscriberBacklogBytes, "subscriberBacklogBytes");
        this.stderrTailLines = Math.max(0, builder.stderrTailLines);
        this.persistenceQueueCapacity = positive(builder.persistenceQueueCapacity, "persistenceQueueCapacity");
        this.persistenceQueueBytes = positive(builder.persistenceQueueBytes, "persistenceQueueBytes");
        this.shutdownTimeout = builder.shutdownTimeout != null ? builder.shutdownTimeout : Duration.ofSeconds(10);
        this.workingDirectory = builder.workingDirectory;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static OrchestratorConfig defaults() {
        return builder().build();
    }

    private static int positive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
        return value;
    }

    private static long positive(long value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
        return value;
    }

    public int getMaxLineBytes() {
        return maxLineBytes;
    }

    public long getMaxRetainedPayloadBytes() {
        return maxRetainedPayloadBytes;
    }

    public int getCompactionThresholdBytes() {
        return compactionThresholdBytes;
    }

    public int getSubscriberBacklog() {
        return subscriberBacklog;
    }

    /**
     * Raw line bytes a subscriber may have undelivered before it is dropped.
     */
    public long getSubscriberBacklogBytes() {
        return subscriberBacklogBytes;
    }

    public int getStderrTailLines() {
        return stderrTailLines;
    }

    public int getPersistenceQueueCapacity() {
        return persistenceQueueCapacity;
    }

    /**
     * Raw line bytes of events waiting in the persistence queue; writes beyond it are dropped.
     */
    public long getPersistenceQueueBytes() {
        return persistenceQueueBytes;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    public static class Builder {
        private int maxLineBytes = DEFAULT_MAX_LINE_BYTES;
        private long maxRetainedPayloadBytes = DEFAULT_MAX_RETAINED_PAYLOAD_BYTES;
        private int compactionThresholdBytes = DEFAULT_COMPACTION_THRESHOLD_BYTES;
        private int subscriberBacklog = DEFAULT_SUBSCRIBER_BACKLOG;
        private long subscriberBacklogBytes = DEFAULT_SUBSCRIBER_BACKLOG_BYTES;
        private int stderrTailLines = DEFAULT_STDERR_TAIL_LINES;
        private int persistenceQueueCapacity = DEFAULT_PERSISTENCE_QUEUE_CAPACITY;
        private long persistenceQueueBytes = DEFAULT_PERSISTENCE_QUEUE_BYTES;
        private Duration shutdownTimeout;
        private Path workingDirectory;

        public Builder maxLineBytes(int maxLineBytes) {
            this.maxLineBytes = maxLineBytes;
            return this;
        }

        public Builder maxRetainedPayloadBytes(long maxRetainedPayloadBytes) {
            this.maxRetainedPayloadBytes = maxRetainedPayloadBytes;
            return this;
        }

        public Builder compactionThresholdBytes(int compactionThresholdBytes) {
            this.compactionThresholdBytes = compactionThresholdBytes;
            return this;
        }

        public Builder subscriberBacklog(int subscriberBacklog) {
            this.subscriberBacklog = subscriberBacklog;
            return this;
        }

        public Builder subscriberBacklogBytes(long subscriberBacklogBytes) {
            this.subscriberBacklogBytes = subscriberBacklogBytes;
            return this;
        }

        public Builder stderrTailLines(int stderrTailLines) {
            this.stderrTailLines = stderrTailLines;
            return this;
        }

        public Builder persistenceQueueCapacity(int persistenceQueueCapacity) {
            this.persistenceQueueCapacity = persistenceQueueCapacity;
            return this;
        }

        public Builder persistenceQueueBytes(long persistenceQueueBytes) {
            this.persistenceQueueBytes = persistenceQueueBytes;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public OrchestratorConfig build() {
            return new OrchestratorConfig(this);
        }
    }
}
