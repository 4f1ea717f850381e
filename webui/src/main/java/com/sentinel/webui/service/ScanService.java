package com.sentinel.webui.service;

import com.sentinel.core.model.EventRecord;
import com.sentinel.core.model.ScanSnapshot;
import com.sentinel.core.model.ScanStatus;
import com.sentinel.core.model.WorkerRole;
import com.sentinel.core.model.WorkerSpec;
import com.sentinel.core.scan.ScanManager;
import com.sentinel.report.ScanReport;
import com.sentinel.webui.config.SentinelProperties;
import com.sentinel.webui.model.StartScanRequest;
import com.sentinel.webui.model.StartScanResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Сервис сканов веб-приложения: переводит теги ролей в команды воркеров
 * по настроенным шаблонам и делегирует {@link ScanManager}.
 */
@Service
public class ScanService {
    private static final Logger logger = LoggerFactory.getLogger(ScanService.class);

    private final ScanManager scanManager;
    private final SentinelProperties properties;

    public ScanService(ScanManager scanManager, SentinelProperties properties) {
        this.scanManager = scanManager;
        this.properties = properties;
    }

    /**
     * Запуск нового скана.
     *
     * @throws IllegalArgumentException если цель пуста, роль неизвестна или для нее не настроена команда
     */
    public StartScanResponse startScan(StartScanRequest request) {
        if (request == null || request.targetUrl() == null || request.targetUrl().isBlank()) {
            throw new IllegalArgumentException("target_url is required");
        }
        List<String> agents = request.agents().isEmpty()
            ? properties.getWorkers().getDefaultAgents()
            : request.agents();

        List<WorkerSpec> specs = new ArrayList<>();
        List<String> spawned = new ArrayList<>();
        for (String tag : agents) {
            WorkerRole role = WorkerRole.fromTag(tag);
            specs.add(new WorkerSpec(role, resolveCommand(role), properties.getWorkers().getEnvironment()));
            spawned.add(role.getTag());
        }

        String scanId = scanManager.startScan(request.targetUrl().trim(), specs);
        logger.info("Scan {} started for {} with agents {}", scanId, request.targetUrl(), spawned);
        return new StartScanResponse(scanId, ScanStatus.RUNNING, spawned);
    }

    List<String> resolveCommand(WorkerRole role) {
        String template = lookupTemplate(role.getTag());
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("No command configured for agent '" + role.getTag() + "'");
        }
        return Arrays.asList(template.trim().split("\\s+"));
    }

    private String lookupTemplate(String tag) {
        Map<String, String> commands = properties.getWorkers().getCommands();
        String template = commands.get(tag);
        if (template == null) {
            // keys written without brackets lose their underscores during binding
            template = commands.get(tag.replace("_", ""));
        }
        if (template == null) {
            template = commands.get(tag.replace('_', '-'));
        }
        return template;
    }

    public Optional<ScanSnapshot> getScan(String scanId) {
        return scanManager.getScanState(scanId);
    }

    public List<ScanSnapshot> listScans() {
        return scanManager.listScans();
    }

    public boolean stopScan(String scanId) {
        boolean known = scanManager.stopScan(scanId);
        if (known) {
            logger.info("Stop requested for scan {}", scanId);
        }
        return known;
    }

    public Optional<ScanReport> getReport(String scanId) {
        return scanManager.getScanState(scanId).map(ScanReport::from);
    }

    public Optional<List<EventRecord>> getEvents(String scanId) {
        return scanManager.events(scanId);
    }
}
