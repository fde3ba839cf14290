package in.tradewell.application.port.output;

import in.tradewell.domain.backtest.BatchInfo;

import java.util.List;

/**
 * Port to the backtest engine that replays recorded batches.
 */
public interface BacktestPort {

    List<BatchInfo> listBatches();

    /**
     * Replay one batch.
     *
     * @param debugSymbols symbols to focus on, empty for all
     * @param strict       stricter validation of the replayed data
     */
    void replay(String batchId, List<String> debugSymbols, boolean strict);
}
