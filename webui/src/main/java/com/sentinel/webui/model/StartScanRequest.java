package com.sentinel.webui.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Запрос на запуск скана.
 *
 * @param targetUrl цель сканирования
 * @param agents теги ролей воркеров; пустой список означает набор по умолчанию
 */
public record StartScanRequest(
    @JsonProperty("target_url") String targetUrl,
    List<String> agents
) {
    public StartScanRequest {
        agents = agents != null ? List.copyOf(agents) : List.of();
    }
}
