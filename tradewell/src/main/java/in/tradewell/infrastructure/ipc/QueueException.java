package in.tradewell.infrastructure.ipc;

/**
 * A queue could not be created, written or read.
 */
public class QueueException extends RuntimeException {

    private final String queueName;

    public QueueException(String queueName, String message, Throwable cause) {
        super(String.format("[%s] %s", queueName, message), cause);
        this.queueName = queueName;
    }

    public String getQueueName() {
        return queueName;
    }
}
