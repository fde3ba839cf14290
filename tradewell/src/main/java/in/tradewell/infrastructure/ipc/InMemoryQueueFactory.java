package in.tradewell.infrastructure.ipc;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps in-memory queues by name so that thread-hosted workers can reopen
 * the instance the orchestrator created.
 */
public final class InMemoryQueueFactory implements QueueFactory {

    private final Map<String, InMemoryQueue> queues = new ConcurrentHashMap<>();

    @Override
    public MessageQueue create(String name) {
        InMemoryQueue queue = new InMemoryQueue(name);
        if (queues.putIfAbsent(name, queue) != null) {
            throw new IllegalStateException("Queue already exists: " + name);
        }
        return queue;
    }

    @Override
    public MessageQueue open(QueueRef ref) {
        InMemoryQueue queue = queues.get(ref.name());
        if (queue == null) {
            throw new IllegalArgumentException("Unknown queue: " + ref.name());
        }
        return queue;
    }
}
