package com.sentinel.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Описание одного планируемого воркера: роль, команда запуска и дополнительное окружение.
 *
 * @param role роль воркера, определяет фазу
 * @param command argv процесса
 * @param environment дополнительные переменные окружения (идентификаторы скана их перекрывают)
 */
public record WorkerSpec(
    WorkerRole role,
    List<String> command,
    Map<String, String> environment
) {
    public WorkerSpec {
        Objects.requireNonNull(role, "Role cannot be null");
        command = command != null ? List.copyOf(command) : List.of();
        environment = environment != null ? Map.copyOf(environment) : Map.of();
    }

    public static WorkerSpec of(WorkerRole role, String... command) {
        return new WorkerSpec(role, List.of(command), Map.of());
    }
}
