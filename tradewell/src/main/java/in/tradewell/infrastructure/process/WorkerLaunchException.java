package in.tradewell.infrastructure.process;

/**
 * A worker could not be prepared or started.
 */
public class WorkerLaunchException extends RuntimeException {

    public WorkerLaunchException(String workerName, String message, Throwable cause) {
        super(String.format("[%s] %s", workerName, message), cause);
    }
}
