package in.tradewell.worker;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.tradewell.config.TradingPlan;
import in.tradewell.infrastructure.ipc.QueueRef;

import java.time.Instant;

/**
 * Arguments of the signal scanner. Window bounds are null when the run
 * bypassed the market schedule on a day without a session.
 */
public record ScannerArgs(
    @JsonProperty("plan") TradingPlan plan,
    @JsonProperty("windowOpen") Instant windowOpen,
    @JsonProperty("windowClose") Instant windowClose,
    @JsonProperty("scannerFeedQueue") QueueRef scannerFeedQueue
) implements WorkerArgs {
}
