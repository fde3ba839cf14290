package in.tradewell.infrastructure.ipc;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Optional;

/**
 * One-directional FIFO message channel between workers.
 *
 * Each queue has exactly one writer and one reader. Payloads are opaque JSON
 * documents; their schema belongs to the workers.
 */
public interface MessageQueue extends AutoCloseable {

    /**
     * Reference other processes use to reopen this queue.
     */
    QueueRef ref();

    void send(JsonNode message);

    /**
     * Block until a message is available.
     */
    JsonNode receive() throws InterruptedException;

    /**
     * Wait at most {@code timeout} for a message.
     */
    Optional<JsonNode> poll(Duration timeout) throws InterruptedException;

    @Override
    void close();
}
