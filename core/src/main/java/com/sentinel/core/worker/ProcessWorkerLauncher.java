package com.sentinel.core.worker;

import com.sentinel.core.model.WorkerIdentity;
import com.sentinel.core.model.WorkerSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Default launcher backed by {@link ProcessBuilder}.
 *
 * <p>The worker receives its identity through environment variables; the identity values
 * always override anything with the same name in the worker's configured environment.
 */
public final class ProcessWorkerLauncher implements WorkerLauncher {
    private static final Logger logger = LoggerFactory.getLogger(ProcessWorkerLauncher.class);

    public static final String ENV_AGENT_ID = "AGENT_ID";
    public static final String ENV_AGENT_ROLE = "AGENT_ROLE";
    public static final String ENV_TARGET_URL = "TARGET_URL";
    public static final String ENV_SCAN_ID = "SCAN_ID";

    private final int maxLineBytes;
    private final int stderrTailLines;
    private final Path workingDirectory;

    public ProcessWorkerLauncher(int maxLineBytes, int stderrTailLines, Path workingDirectory) {
        this.maxLineBytes = maxLineBytes;
        this.stderrTailLines = stderrTailLines;
        this.workingDirectory = workingDirectory;
    }

    public ProcessWorkerLauncher(int maxLineBytes, int stderrTailLines) {
        this(maxLineBytes, stderrTailLines, null);
    }

    @Override
    public WorkerProcessHandle launch(WorkerIdentity identity, WorkerSpec spec, String targetDescriptor)
            throws SpawnException {
        if (spec.command().isEmpty() || spec.command().get(0).isBlank()) {
            throw new SpawnException(identity.workerId(),
                "No command configured for role '" + identity.role() + "'");
        }

        ProcessBuilder builder = new ProcessBuilder(spec.command());
        builder.environment().putAll(buildEnvironment(identity, spec, targetDescriptor));
        if (workingDirectory != null) {
            File dir = workingDirectory.toFile();
            if (!dir.isDirectory()) {
                throw new SpawnException(identity.workerId(), "Working directory does not exist: " + dir);
            }
            builder.directory(dir);
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException | IllegalArgumentException | SecurityException e) {
            throw new SpawnException(identity.workerId(),
                "Failed to start '" + spec.command().get(0) + "': " + e.getMessage(), e);
        }

        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            logger.debug("Could not close stdin of worker {}: {}", identity.workerId(), e.getMessage());
        }

        logger.info("Spawned worker {} ({}) for scan {} as pid {}",
            identity.workerId(), identity.role(), identity.scanId(), process.pid());
        return WorkerProcessHandle.start(identity, process, maxLineBytes, stderrTailLines);
    }

    /**
     * Окружение процесса воркера: дополнительные переменные спецификации плюс идентичность.
     */
    static Map<String, String> buildEnvironment(WorkerIdentity identity, WorkerSpec spec, String targetDescriptor) {
        Map<String, String> env = new HashMap<>(spec.environment());
        env.put(ENV_AGENT_ID, String.valueOf(identity.workerId()));
        env.put(ENV_AGENT_ROLE, identity.role());
        env.put(ENV_TARGET_URL, targetDescriptor != null ? targetDescriptor : "");
        env.put(ENV_SCAN_ID, identity.scanId());
        return env;
    }
}
