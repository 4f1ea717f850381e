package com.sentinel.webui.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sentinel.core.model.ScanStatus;

import java.util.List;

public record StartScanResponse(
    @JsonProperty("scan_id") String scanId,
    ScanStatus status,
    @JsonProperty("agents_spawned") List<String> agentsSpawned
) {}
