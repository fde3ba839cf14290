package in.tradewell.infrastructure.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

/**
 * Worker running as a child OS process.
 */
final class ProcessWorkerHandle implements WorkerHandle {
    private static final Logger log = LoggerFactory.getLogger(ProcessWorkerHandle.class);

    private final String name;
    private final ProcessBuilder builder;
    private volatile Process process;

    ProcessWorkerHandle(String name, ProcessBuilder builder) {
        this.name = name;
        this.builder = builder;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public synchronized void start() {
        if (process != null) {
            throw new IllegalStateException("Worker already started: " + name);
        }
        try {
            process = builder.start();
            log.info("[{}] Started worker process pid={}", name, process.pid());
        } catch (IOException e) {
            throw new WorkerLaunchException(name, "Failed to start process: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean join(Duration timeout) throws InterruptedException {
        Process p = process;
        if (p == null) {
            return true;
        }
        boolean exited = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (exited) {
            log.debug("[{}] Process exited with status {}", name, p.exitValue());
        }
        return exited;
    }

    @Override
    public void terminate() {
        Process p = process;
        if (p == null) {
            return;
        }
        p.descendants().forEach(ProcessHandle::destroyForcibly);
        p.destroyForcibly();
        log.info("[{}] Sent kill to pid={}", name, p.pid());
    }

    @Override
    public boolean isStarted() {
        return process != null;
    }

    @Override
    public boolean isAlive() {
        Process p = process;
        return p != null && p.isAlive();
    }

    @Override
    public OptionalInt exitCode() {
        Process p = process;
        if (p == null || p.isAlive()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(p.exitValue());
    }

    ProcessBuilder builder() {
        return builder;
    }
}
