package in.tradewell.domain.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.UUID;

/**
 * Identifier of one orchestrator run. Handed to every spawned worker so that
 * their logs and messages can be correlated.
 */
public record SessionRunId(String value) {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public SessionRunId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Run id must not be blank");
        }
    }

    public static SessionRunId generate() {
        return new SessionRunId(UUID.randomUUID().toString());
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
