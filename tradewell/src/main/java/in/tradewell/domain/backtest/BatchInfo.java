package in.tradewell.domain.backtest;

import java.time.Instant;

/**
 * One recorded historical batch that can be replayed.
 */
public record BatchInfo(String batchId, Instant recordedAt, int symbolCount) {
}
