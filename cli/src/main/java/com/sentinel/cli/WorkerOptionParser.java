package com.sentinel.cli;

import com.sentinel.core.model.WorkerRole;
import com.sentinel.core.model.WorkerSpec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Разбор опций {@code --worker role=command}.
 */
final class WorkerOptionParser {

    private WorkerOptionParser() {
    }

    /**
     * @param value строка вида {@code xss=python3 agents/xss.py --fast}
     * @throws IllegalArgumentException если роль неизвестна или команда пуста
     */
    static WorkerSpec parse(String value, Map<String, String> environment) {
        if (value == null) {
            throw new IllegalArgumentException("Worker option cannot be null");
        }
        int eq = value.indexOf('=');
        if (eq <= 0) {
            throw new IllegalArgumentException("Expected role=command, got '" + value + "'");
        }
        WorkerRole role = WorkerRole.fromTag(value.substring(0, eq));
        String command = value.substring(eq + 1).trim();
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Empty command for worker '" + role.getTag() + "'");
        }
        return new WorkerSpec(role, Arrays.asList(command.split("\\s+")), environment);
    }

    static List<WorkerSpec> parseAll(List<String> values, Map<String, String> environment) {
        List<WorkerSpec> specs = new ArrayList<>();
        for (String value : values) {
            specs.add(parse(value, environment));
        }
        return specs;
    }
}
