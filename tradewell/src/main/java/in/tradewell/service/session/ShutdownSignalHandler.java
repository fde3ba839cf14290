package in.tradewell.service.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * JVM shutdown hook turning SIGINT / SIGTERM into a cancellation of the run.
 *
 * The hook cancels the token and then holds the JVM until the orchestrator
 * reports it is done (or the grace period runs out), so that started workers
 * get terminated before the process exits.
 */
public final class ShutdownSignalHandler {
    private static final Logger log = LoggerFactory.getLogger(ShutdownSignalHandler.class);

    private final CancellationToken token;
    private final Duration grace;
    private final CountDownLatch done = new CountDownLatch(1);
    private final Thread hook;

    public ShutdownSignalHandler(CancellationToken token, Duration grace) {
        this.token = token;
        this.grace = grace;
        this.hook = new Thread(this::onSignal, "session-shutdown-hook");
    }

    public void install() {
        Runtime.getRuntime().addShutdownHook(hook);
    }

    /**
     * Called by the main thread once the run has returned.
     */
    public void markDone() {
        done.countDown();
    }

    void onSignal() {
        if (done.getCount() == 0) {
            return;
        }
        log.info("Shutdown signal received, stopping session");
        token.cancel("shutdown signal");
        try {
            if (!done.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Session did not stop within {}", grace);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the session to stop");
        }
    }
}
