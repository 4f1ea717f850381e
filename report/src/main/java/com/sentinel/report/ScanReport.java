package com.sentinel.report;

import com.sentinel.core.model.Finding;
import com.sentinel.core.model.ScanSnapshot;
import com.sentinel.core.model.ScanStatus;
import com.sentinel.core.model.Severity;
import com.sentinel.core.model.WorkerSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Итоговый отчет по скану, построенный из снимка состояния.
 *
 * <p>Оценка риска: {@code max(0, 100 - сумма весов находок)}, веса берутся из
 * {@link Severity#getRiskWeight()}. Оценка переводится в буквенную категорию A-F.
 * Отчет можно строить и по идущему скану: он отражает состояние на момент снимка.
 *
 * @see Reporter
 */
public final class ScanReport {
    private final String scanId;
    private final String targetDescriptor;
    private final ScanStatus status;
    private final Instant startedAt;
    private final Instant endedAt;
    private final Instant generatedAt;
    private final int completedWorkerCount;
    private final int totalWorkerCount;
    private final int eventCount;
    private final List<Finding> findings;
    private final List<WorkerSnapshot> workers;
    private final Map<Severity, Integer> severityCounts;
    private final int riskScore;
    private final String grade;

    private ScanReport(ScanSnapshot snapshot) {
        this.scanId = snapshot.scanId();
        this.targetDescriptor = snapshot.targetDescriptor();
        this.status = snapshot.status();
        this.startedAt = snapshot.startedAt();
        this.endedAt = snapshot.endedAt();
        this.generatedAt = Instant.now();
        this.completedWorkerCount = snapshot.completedWorkerCount();
        this.totalWorkerCount = snapshot.totalWorkerCount();
        this.eventCount = snapshot.eventCount();
        this.findings = snapshot.findings().stream()
            .sorted(Comparator.comparingInt((Finding f) -> f.getSeverity().getPriority()).reversed())
            .toList();
        this.workers = snapshot.workers();

        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0);
        }
        for (Finding finding : findings) {
            counts.merge(finding.getSeverity(), 1, Integer::sum);
        }
        this.severityCounts = Collections.unmodifiableMap(counts);
        this.riskScore = calculateRiskScore(findings);
        this.grade = gradeFor(riskScore);
    }

    /**
     * Строит отчет из снимка состояния скана.
     *
     * @param snapshot снимок скана
     * @return отчет
     * @throws NullPointerException если {@code snapshot} равен null
     */
    public static ScanReport from(ScanSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "Snapshot cannot be null");
        return new ScanReport(snapshot);
    }

    static int calculateRiskScore(List<Finding> findings) {
        int penalty = 0;
        for (Finding finding : findings) {
            penalty += finding.getSeverity().getRiskWeight();
        }
        return Math.max(0, 100 - penalty);
    }

    static String gradeFor(int score) {
        if (score >= 90) {
            return "A";
        } else if (score >= 75) {
            return "B";
        } else if (score >= 50) {
            return "C";
        } else if (score >= 25) {
            return "D";
        }
        return "F";
    }

    public String getScanId() {
        return scanId;
    }

    public String getTargetDescriptor() {
        return targetDescriptor;
    }

    public ScanStatus getStatus() {
        return status;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    /**
     * Длительность скана; для идущего скана - до момента построения отчета.
     */
    public Duration getDuration() {
        return Duration.between(startedAt, endedAt != null ? endedAt : generatedAt);
    }

    public int getCompletedWorkerCount() {
        return completedWorkerCount;
    }

    public int getTotalWorkerCount() {
        return totalWorkerCount;
    }

    public int getEventCount() {
        return eventCount;
    }

    /**
     * Находки, отсортированные от самой серьезной.
     */
    public List<Finding> getFindings() {
        return findings;
    }

    public List<WorkerSnapshot> getWorkers() {
        return workers;
    }

    public Map<Severity, Integer> getSeverityCounts() {
        return severityCounts;
    }

    public int getCriticalAndHighCount() {
        return severityCounts.get(Severity.CRITICAL) + severityCounts.get(Severity.HIGH);
    }

    public int getRiskScore() {
        return riskScore;
    }

    public String getGrade() {
        return grade;
    }

    public boolean hasFindings() {
        return !findings.isEmpty();
    }
}
