package com.sentinel.webui.controller;

import com.sentinel.core.model.EventRecord;
import com.sentinel.core.model.ScanStatus;
import com.sentinel.report.JsonReporter;
import com.sentinel.webui.model.ScanStatusResponse;
import com.sentinel.webui.model.StartScanRequest;
import com.sentinel.webui.model.StartScanResponse;
import com.sentinel.webui.service.ScanService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Контроллер управления сканами.
 */
@RestController
@RequestMapping("/api/scans")
public class ScanController {
    private static final Logger logger = LoggerFactory.getLogger(ScanController.class);

    private final ScanService scanService;
    private final JsonReporter jsonReporter = new JsonReporter();

    public ScanController(ScanService scanService) {
        this.scanService = scanService;
    }

    /**
     * Запуск нового скана.
     * POST /api/scans/start
     */
    @PostMapping("/start")
    public ResponseEntity<StartScanResponse> startScan(@RequestBody StartScanRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(scanService.startScan(request));
    }

    /**
     * Список всех сканов.
     * GET /api/scans
     */
    @GetMapping
    public List<ScanStatusResponse> listScans() {
        return scanService.listScans().stream()
                .map(ScanStatusResponse::from)
                .toList();
    }

    /**
     * Состояние скана.
     * GET /api/scans/{scanId}
     */
    @GetMapping("/{scanId}")
    public ResponseEntity<ScanStatusResponse> getScan(@PathVariable("scanId") String scanId) {
        return scanService.getScan(scanId)
                .map(snapshot -> ResponseEntity.ok(ScanStatusResponse.from(snapshot)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Остановка скана. Не ждет завершения процессов воркеров.
     * POST /api/scans/{scanId}/stop
     */
    @PostMapping("/{scanId}/stop")
    public ResponseEntity<Map<String, Object>> stopScan(@PathVariable("scanId") String scanId) {
        if (!scanService.stopScan(scanId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("scan_id", scanId, "status", ScanStatus.STOPPED));
    }

    /**
     * Отчет по скану с оценкой риска.
     * GET /api/scans/{scanId}/report
     */
    @GetMapping("/{scanId}/report")
    public ResponseEntity<Map<String, Object>> getReport(@PathVariable("scanId") String scanId) {
        return scanService.getReport(scanId)
                .map(report -> ResponseEntity.ok(jsonReporter.toDocument(report)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Сохраненный журнал событий скана.
     * GET /api/scans/{scanId}/events
     */
    @GetMapping("/{scanId}/events")
    public ResponseEntity<List<EventRecord>> getEvents(@PathVariable("scanId") String scanId) {
        return scanService.getEvents(scanId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        logger.warn("Rejected scan request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
