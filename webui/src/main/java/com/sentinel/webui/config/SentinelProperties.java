package com.sentinel.webui.config;

import com.sentinel.core.scan.OrchestratorConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Настройки приложения с префиксом {@code sentinel}.
 */
@ConfigurationProperties(prefix = "sentinel")
public class SentinelProperties {

    private final Workers workers = new Workers();
    private final Limits limits = new Limits();
    private final Persistence persistence = new Persistence();
    private final Cors cors = new Cors();

    public Workers getWorkers() {
        return workers;
    }

    public Limits getLimits() {
        return limits;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public Cors getCors() {
        return cors;
    }

    /**
     * Шаблоны команд воркеров по тегу роли. Ключи с подчеркиванием в YAML записываются
     * в скобках: {@code "[headers_tls]": python3 agents/headers_tls.py}.
     */
    public static class Workers {
        private Map<String, String> commands = new LinkedHashMap<>();
        private Map<String, String> environment = new LinkedHashMap<>();
        private List<String> defaultAgents = new ArrayList<>(
            List.of("spider", "exposure", "headers_tls", "cors", "portscan"));
        private String workingDirectory;

        public Map<String, String> getCommands() {
            return commands;
        }

        public void setCommands(Map<String, String> commands) {
            this.commands = commands;
        }

        public Map<String, String> getEnvironment() {
            return environment;
        }

        public void setEnvironment(Map<String, String> environment) {
            this.environment = environment;
        }

        public List<String> getDefaultAgents() {
            return defaultAgents;
        }

        public void setDefaultAgents(List<String> defaultAgents) {
            this.defaultAgents = defaultAgents;
        }

        public String getWorkingDirectory() {
            return workingDirectory;
        }

        public void setWorkingDirectory(String workingDirectory) {
            this.workingDirectory = workingDirectory;
        }
    }

    public static class Limits {
        private int maxLineBytes = OrchestratorConfig.DEFAULT_MAX_LINE_BYTES;
        private long maxRetainedPayloadBytes = OrchestratorConfig.DEFAULT_MAX_RETAINED_PAYLOAD_BYTES;
        private int compactionThresholdBytes = OrchestratorConfig.DEFAULT_COMPACTION_THRESHOLD_BYTES;
        private int subscriberBacklog = OrchestratorConfig.DEFAULT_SUBSCRIBER_BACKLOG;
        private long subscriberBacklogBytes = OrchestratorConfig.DEFAULT_SUBSCRIBER_BACKLOG_BYTES;
        private long persistenceQueueBytes = OrchestratorConfig.DEFAULT_PERSISTENCE_QUEUE_BYTES;
        private int stderrTailLines = OrchestratorConfig.DEFAULT_STDERR_TAIL_LINES;

        public int getMaxLineBytes() {
            return maxLineBytes;
        }

        public void setMaxLineBytes(int maxLineBytes) {
            this.maxLineBytes = maxLineBytes;
        }

        public long getMaxRetainedPayloadBytes() {
            return maxRetainedPayloadBytes;
        }

        public void setMaxRetainedPayloadBytes(long maxRetainedPayloadBytes) {
            this.maxRetainedPayloadBytes = maxRetainedPayloadBytes;
        }

        public int getCompactionThresholdBytes() {
            return compactionThresholdBytes;
        }

        public void setCompactionThresholdBytes(int compactionThresholdBytes) {
            this.compactionThresholdBytes = compactionThresholdBytes;
        }

        public int getSubscriberBacklog() {
            return subscriberBacklog;
        }

        public void setSubscriberBacklog(int subscriberBacklog) {
            this.subscriberBacklog = subscriberBacklog;
        }

        public long getSubscriberBacklogBytes() {
            return subscriberBacklogBytes;
        }

        public void setSubscriberBacklogBytes(long subscriberBacklogBytes) {
            this.subscriberBacklogBytes = subscriberBacklogBytes;
        }

        public long getPersistenceQueueBytes() {
            return persistenceQueueBytes;
        }

        public void setPersistenceQueueBytes(long persistenceQueueBytes) {
            this.persistenceQueueBytes = persistenceQueueBytes;
        }

        public int getStderrTailLines() {
            return stderrTailLines;
        }

        public void setStderrTailLines(int stderrTailLines) {
            this.stderrTailLines = stderrTailLines;
        }
    }

    public static class Persistence {
        // empty means events are kept in memory only
        private String directory;

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }

    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of(
            "http://localhost:3000",
            "http://localhost:8080",
            "http://127.0.0.1:3000",
            "http://127.0.0.1:8080"));

        public List<String> getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }
    }
}
