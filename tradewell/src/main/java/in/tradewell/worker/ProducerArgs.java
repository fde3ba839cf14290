package in.tradewell.worker;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.tradewell.config.TradingPlan;
import in.tradewell.domain.session.SessionRunId;
import in.tradewell.infrastructure.ipc.QueueRef;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Arguments of the data producer, the only writer of every shard queue and
 * of the scanner feed.
 *
 * {@code windowClose} is null when the run bypassed the market schedule on a
 * day without a session.
 */
public record ProducerArgs(
    @JsonProperty("runId") SessionRunId runId,
    @JsonProperty("shardQueues") List<QueueRef> shardQueues,
    @JsonProperty("symbols") List<String> symbols,
    @JsonProperty("symbolToShard") Map<String, Integer> symbolToShard,
    @JsonProperty("windowClose") Instant windowClose,
    @JsonProperty("plan") TradingPlan plan,
    @JsonProperty("scannerFeedQueue") QueueRef scannerFeedQueue,
    @JsonProperty("workerCount") int workerCount
) implements WorkerArgs {
}
