package in.tradewell.infrastructure.ipc;

/**
 * Creates queues on the orchestrator side and reopens them on the worker side.
 */
public interface QueueFactory {

    MessageQueue create(String name);

    MessageQueue open(QueueRef ref);
}
