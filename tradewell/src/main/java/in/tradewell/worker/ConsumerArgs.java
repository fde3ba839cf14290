package in.tradewell.worker;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.tradewell.config.TradingPlan;
import in.tradewell.domain.session.Bar;
import in.tradewell.domain.session.SessionRunId;
import in.tradewell.infrastructure.ipc.QueueRef;

import java.util.List;
import java.util.Map;

/**
 * Arguments of one symbol consumer.
 *
 * @param queue           the shard queue this consumer is the only reader of
 * @param assignedSymbols symbols owned by the shard, empty for an idle shard
 * @param warmUp          warm-up history keyed by symbol
 */
public record ConsumerArgs(
    @JsonProperty("shard") int shard,
    @JsonProperty("queue") QueueRef queue,
    @JsonProperty("assignedSymbols") List<String> assignedSymbols,
    @JsonProperty("warmUp") Map<String, List<Bar>> warmUp,
    @JsonProperty("runId") SessionRunId runId,
    @JsonProperty("plan") TradingPlan plan
) implements WorkerArgs {

    public ConsumerArgs {
        assignedSymbols = assignedSymbols == null ? List.of() : List.copyOf(assignedSymbols);
        warmUp = warmUp == null ? Map.of() : warmUp;
    }

    public boolean isIdle() {
        return assignedSymbols.isEmpty();
    }
}
