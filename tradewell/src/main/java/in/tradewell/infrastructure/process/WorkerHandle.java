package in.tradewell.infrastructure.process;

import java.time.Duration;
import java.util.OptionalInt;

/**
 * Handle on one spawned worker, independent of how the worker is hosted.
 *
 * Owned by the orchestrator only.
 */
public interface WorkerHandle {

    String name();

    /**
     * Launch the worker. Calling it twice is an error.
     */
    void start();

    /**
     * Wait up to {@code timeout} for the worker to exit.
     *
     * @return true if the worker has exited (or was never started)
     */
    boolean join(Duration timeout) throws InterruptedException;

    /**
     * Stop the worker immediately, without drain.
     */
    void terminate();

    boolean isStarted();

    boolean isAlive();

    /**
     * Exit status once the worker has exited.
     */
    OptionalInt exitCode();
}
