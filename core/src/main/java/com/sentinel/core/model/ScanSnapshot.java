package com.sentinel.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Снимок состояния скана на момент запроса. Собирается под той же блокировкой,
 * что и изменения состояния, поэтому счетчики, находки и статус согласованы между собой.
 *
 * @param scanId идентификатор скана
 * @param targetDescriptor цель сканирования
 * @param status текущий статус
 * @param completedWorkerCount число завершившихся воркеров
 * @param totalWorkerCount число запланированных воркеров
 * @param eventCount число сохраненных событий
 * @param findings находки в порядке поступления
 * @param workers реестр воркеров по возрастанию идентификатора
 * @param startedAt время создания скана
 * @param endedAt время перехода в терминальный статус, {@code null} пока скан идет
 */
public record ScanSnapshot(
    String scanId,
    String targetDescriptor,
    ScanStatus status,
    int completedWorkerCount,
    int totalWorkerCount,
    int eventCount,
    List<Finding> findings,
    List<WorkerSnapshot> workers,
    Instant startedAt,
    Instant endedAt
) {
    public ScanSnapshot {
        findings = List.copyOf(findings);
        workers = List.copyOf(workers);
    }

    public int findingCount() {
        return findings.size();
    }
}
