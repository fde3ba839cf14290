package in.tradewell.service.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Single cancellation context of a run.
 *
 * Cancelled once, from any thread (typically the JVM shutdown hook). Every
 * blocking step of the orchestrator either sleeps through {@link #sleep} or
 * polls {@link #isCancelled()} between short waits.
 */
public final class CancellationToken {
    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private volatile String reason;

    public void cancel(String why) {
        synchronized (this) {
            if (reason != null) {
                return;
            }
            reason = why;
        }
        log.info("Cancellation requested: {}", why);
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * @return the reason given to {@link #cancel}, or null
     */
    public String reason() {
        return reason;
    }

    /**
     * Sleep for {@code duration} unless cancelled first.
     *
     * @return true if the full duration elapsed, false if cancelled or the
     *         calling thread was interrupted
     */
    public boolean sleep(Duration duration) {
        if (duration.isNegative() || duration.isZero()) {
            return !isCancelled();
        }
        try {
            return !cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel("thread interrupted");
            return false;
        }
    }
}
