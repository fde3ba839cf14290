package in.tradewell.infrastructure.ipc;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Serializable handle to a queue: its logical name and where it lives
 * (a journal file path, or {@code mem:<name>} for in-memory queues).
 */
public record QueueRef(
    @JsonProperty("name") String name,
    @JsonProperty("address") String address
) {
}
