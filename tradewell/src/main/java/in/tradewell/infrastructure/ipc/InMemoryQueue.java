package in.tradewell.infrastructure.ipc;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Queue for workers hosted as threads of the same JVM.
 */
public final class InMemoryQueue implements MessageQueue {

    private final QueueRef ref;
    private final BlockingQueue<JsonNode> messages = new LinkedBlockingQueue<>();

    InMemoryQueue(String name) {
        this.ref = new QueueRef(name, "mem:" + name);
    }

    @Override
    public QueueRef ref() {
        return ref;
    }

    @Override
    public void send(JsonNode message) {
        messages.add(message);
    }

    @Override
    public JsonNode receive() throws InterruptedException {
        return messages.take();
    }

    @Override
    public Optional<JsonNode> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(messages.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public int size() {
        return messages.size();
    }

    @Override
    public void close() {
        // nothing to release
    }
}
