package com.sentinel.webui.config;

import com.sentinel.core.persist.JsonLinesScanPersistence;
import com.sentinel.core.persist.ScanPersistence;
import com.sentinel.core.scan.OrchestratorConfig;
import com.sentinel.core.scan.ScanManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Сборка ядра оркестрации из настроек приложения.
 */
@Configuration
public class OrchestratorConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(OrchestratorConfiguration.class);

    @Bean
    public OrchestratorConfig orchestratorConfig(SentinelProperties properties) {
        SentinelProperties.Limits limits = properties.getLimits();
        String workingDirectory = properties.getWorkers().getWorkingDirectory();
        return OrchestratorConfig.builder()
            .maxLineBytes(limits.getMaxLineBytes())
            .maxRetainedPayloadBytes(limits.getMaxRetainedPayloadBytes())
            .compactionThresholdBytes(limits.getCompactionThresholdBytes())
            .subscriberBacklog(limits.getSubscriberBacklog())
            .subscriberBacklogBytes(limits.getSubscriberBacklogBytes())
            .persistenceQueueBytes(limits.getPersistenceQueueBytes())
            .stderrTailLines(limits.getStderrTailLines())
            .workingDirectory(workingDirectory != null && !workingDirectory.isBlank() ? Path.of(workingDirectory) : null)
            .build();
    }

    @Bean
    public ScanPersistence scanPersistence(SentinelProperties properties) {
        String directory = properties.getPersistence().getDirectory();
        if (directory == null || directory.isBlank()) {
            logger.info("Scan persistence disabled, scans are kept in memory only");
            return ScanPersistence.noOp();
        }
        logger.info("Mirroring scans to {}", directory);
        return new JsonLinesScanPersistence(Path.of(directory));
    }

    /**
     * Менеджер сканов; при остановке приложения останавливает идущие сканы.
     */
    @Bean(destroyMethod = "shutdown")
    public ScanManager scanManager(OrchestratorConfig orchestratorConfig, ScanPersistence scanPersistence) {
        return new ScanManager(orchestratorConfig, scanPersistence);
    }
}
