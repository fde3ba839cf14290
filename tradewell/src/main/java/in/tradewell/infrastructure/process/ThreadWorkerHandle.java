package in.tradewell.infrastructure.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.OptionalInt;

/**
 * Worker running on a dedicated thread of this JVM. Terminating it
 * interrupts the thread.
 */
final class ThreadWorkerHandle implements WorkerHandle {
    private static final Logger log = LoggerFactory.getLogger(ThreadWorkerHandle.class);

    /**
     * Body of the worker; thrown exceptions count as exit status 1.
     */
    interface WorkerBody {
        void run() throws Exception;
    }

    private final String name;
    private final Thread thread;
    private volatile boolean started = false;
    private volatile Integer exitCode;

    ThreadWorkerHandle(String name, WorkerBody body) {
        this.name = name;
        this.thread = new Thread(() -> {
            try {
                body.run();
                exitCode = 0;
            } catch (InterruptedException e) {
                log.info("[{}] Worker interrupted", name);
                exitCode = 130;
            } catch (Exception e) {
                log.error("[{}] Worker failed: {}", name, e.getMessage(), e);
                exitCode = 1;
            }
        }, "worker-" + name);
        this.thread.setDaemon(true);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Worker already started: " + name);
        }
        started = true;
        thread.start();
        log.info("[{}] Started worker thread", name);
    }

    @Override
    public boolean join(Duration timeout) throws InterruptedException {
        if (!started) {
            return true;
        }
        thread.join(Math.max(1, timeout.toMillis()));
        return !thread.isAlive();
    }

    @Override
    public void terminate() {
        if (started && thread.isAlive()) {
            thread.interrupt();
            log.info("[{}] Interrupted worker thread", name);
        }
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    @Override
    public boolean isAlive() {
        return thread.isAlive();
    }

    @Override
    public OptionalInt exitCode() {
        Integer code = exitCode;
        return code == null || thread.isAlive() ? OptionalInt.empty() : OptionalInt.of(code);
    }
}
