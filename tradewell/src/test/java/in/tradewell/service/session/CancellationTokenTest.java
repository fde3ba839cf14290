package in.tradewell.service.session;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void sleep_fullDurationWhenNotCancelled() {
        CancellationToken token = new CancellationToken();

        assertTrue(token.sleep(Duration.ofMillis(20)));
        assertFalse(token.isCancelled());
    }

    @Test
    void sleep_returnsEarlyOnCancel() {
        CancellationToken token = new CancellationToken();
        new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            token.cancel("test");
        }).start();

        long startedAt = System.nanoTime();
        assertFalse(token.sleep(Duration.ofSeconds(30)));
        assertTrue(Duration.ofNanos(System.nanoTime() - startedAt).compareTo(Duration.ofSeconds(10)) < 0);
    }

    @Test
    void cancel_isIdempotentAndKeepsFirstReason() {
        CancellationToken token = new CancellationToken();

        token.cancel("first");
        token.cancel("second");

        assertTrue(token.isCancelled());
        assertEquals("first", token.reason());
        assertFalse(token.sleep(Duration.ofMillis(10)));
    }

    @Test
    void sleep_interruptedThreadCancels() {
        CancellationToken token = new CancellationToken();
        Thread.currentThread().interrupt();

        assertFalse(token.sleep(Duration.ofSeconds(5)));
        assertTrue(token.isCancelled());
        assertTrue(Thread.interrupted());
    }
}
