package com.sentinel.webui.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sentinel.core.model.Finding;
import com.sentinel.core.model.ScanSnapshot;
import com.sentinel.core.model.ScanStatus;
import com.sentinel.core.model.WorkerSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Состояние скана для фронтенда.
 */
public record ScanStatusResponse(
    @JsonProperty("scan_id") String scanId,
    ScanStatus status,
    @JsonProperty("target_url") String targetUrl,
    List<Finding> findings,
    @JsonProperty("agents_complete") int agentsComplete,
    @JsonProperty("total_agents") int totalAgents,
    @JsonProperty("event_count") int eventCount,
    List<WorkerSnapshot> workers,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("ended_at") Instant endedAt
) {
    public static ScanStatusResponse from(ScanSnapshot snapshot) {
        return new ScanStatusResponse(
            snapshot.scanId(),
            snapshot.status(),
            snapshot.targetDescriptor(),
            snapshot.findings(),
            snapshot.completedWorkerCount(),
            snapshot.totalWorkerCount(),
            snapshot.eventCount(),
            snapshot.workers(),
            snapshot.startedAt(),
            snapshot.endedAt()
        );
    }
}
