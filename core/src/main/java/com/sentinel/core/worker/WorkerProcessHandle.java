package com.sentinel.core.worker;

import com.sentinel.core.model.WorkerIdentity;
import com.sentinel.core.protocol.BoundedLineReader;
import com.sentinel.core.protocol.RawLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Дескриптор одного запущенного процесса воркера.
 *
 * <p>Единственный владелец stdout и stderr процесса:
 * <ul>
 *   <li>stdout читается только через {@link #streamLines()}, ровно один раз</li>
 *   <li>stderr вычитывается отдельным демон-потоком, пишется в лог и хранится хвостом
 *       последних строк для диагностики падений</li>
 *   <li>{@link #kill()} идемпотентен и может вызываться из любого потока</li>
 *   <li>{@link #close()} освобождает потоки ввода-вывода на любом пути выхода</li>
 * </ul>
 */
public final class WorkerProcessHandle implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(WorkerProcessHandle.class);

    private final WorkerIdentity identity;
    private final Process process;
    private final int maxLineBytes;
    private final int stderrTailLines;
    private final Deque<String> stderrTail = new ArrayDeque<>();
    private final AtomicBoolean streamed = new AtomicBoolean();
    private final AtomicBoolean killed = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private Thread stderrDrainer;

    private WorkerProcessHandle(WorkerIdentity identity, Process process, int maxLineBytes, int stderrTailLines) {
        this.identity = identity;
        this.process = process;
        this.maxLineBytes = maxLineBytes;
        this.stderrTailLines = Math.max(0, stderrTailLines);
    }

    /**
     * Оборачивает уже запущенный процесс и начинает вычитывать его stderr.
     */
    public static WorkerProcessHandle start(WorkerIdentity identity, Process process,
                                            int maxLineBytes, int stderrTailLines) {
        WorkerProcessHandle handle = new WorkerProcessHandle(identity, process, maxLineBytes, stderrTailLines);
        handle.startStderrDrainer();
        return handle;
    }

    private void startStderrDrainer() {
        stderrDrainer = new Thread(this::drainStderr,
            "worker-" + identity.scanId() + "-" + identity.workerId() + "-stderr");
        stderrDrainer.setDaemon(true);
        stderrDrainer.start();
    }

    private void drainStderr() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                logger.warn("[scan {} worker {} {}] stderr: {}",
                    identity.scanId(), identity.workerId(), identity.role(), line);
                rememberStderr(line);
            }
        } catch (IOException e) {
            // the stream is closed under us after a kill or close()
            logger.debug("stderr of worker {} closed: {}", identity.workerId(), e.getMessage());
        }
    }

    private void rememberStderr(String line) {
        if (stderrTailLines == 0) {
            return;
        }
        synchronized (stderrTail) {
            if (stderrTail.size() == stderrTailLines) {
                stderrTail.removeFirst();
            }
            stderrTail.addLast(line);
        }
    }

    /**
     * Ленивая последовательность строк stdout до EOF процесса.
     *
     * <p>Ошибка чтения после {@link #kill()} или {@link #close()} трактуется как EOF.
     * Закрытие возвращенного потока закрывает stdout процесса; stderr дочитывается до выхода.
     *
     * @return поток строк
     * @throws IllegalStateException при повторном вызове
     */
    public Stream<RawLine> streamLines() {
        if (!streamed.compareAndSet(false, true)) {
            throw new IllegalStateException("stdout of worker " + identity.workerId() + " is already being read");
        }
        BoundedLineReader reader = new BoundedLineReader(process.getInputStream(), maxLineBytes);
        Spliterator<RawLine> spliterator = new Spliterators.AbstractSpliterator<>(
                Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL) {
            @Override
            public boolean tryAdvance(Consumer<? super RawLine> action) {
                RawLine line;
                try {
                    line = reader.readLine();
                } catch (IOException e) {
                    if (killed.get() || closed.get()) {
                        return false;
                    }
                    throw new UncheckedIOException(e);
                }
                if (line == null) {
                    return false;
                }
                action.accept(line);
                return true;
            }
        };
        return StreamSupport.stream(spliterator, false).onClose(() -> closeQuietly(process.getInputStream()));
    }

    /**
     * Best-effort immediate termination of the process and its descendants. Idempotent.
     * Does not wait: callers still observe EOF on stdout before treating the worker as gone.
     */
    public void kill() {
        if (!killed.compareAndSet(false, true)) {
            return;
        }
        if (process.isAlive()) {
            logger.info("Killing worker {} ({}) of scan {}", identity.workerId(), identity.role(), identity.scanId());
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }
    }

    /**
     * Blocks until the process terminates.
     *
     * @return exit code
     * @throws InterruptedException if the calling thread is interrupted
     */
    public int waitFor() throws InterruptedException {
        int exitCode = process.waitFor();
        // let the drainer flush the last stderr lines into the tail
        if (stderrDrainer != null) {
            stderrDrainer.join(TimeUnit.SECONDS.toMillis(1));
        }
        return exitCode;
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public boolean isKilled() {
        return killed.get();
    }

    public long pid() {
        return process.pid();
    }

    public WorkerIdentity getIdentity() {
        return identity;
    }

    public List<String> getStderrTail() {
        synchronized (stderrTail) {
            return new ArrayList<>(stderrTail);
        }
    }

    /**
     * Releases the process I/O handles. A process still running at this point
     * (the reading task was cancelled mid-read) is killed.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (process.isAlive()) {
            kill();
        }
        closeQuietly(process.getInputStream());
        closeQuietly(process.getErrorStream());
    }

    private void closeQuietly(InputStream stream) {
        try {
            stream.close();
        } catch (IOException e) {
            logger.debug("Failed to close stream of worker {}: {}", identity.workerId(), e.getMessage());
        }
    }
}
