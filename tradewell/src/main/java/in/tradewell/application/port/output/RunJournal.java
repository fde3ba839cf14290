package in.tradewell.application.port.output;

import in.tradewell.domain.session.SessionRunId;

/**
 * Port recording the start and end of orchestrator runs.
 */
public interface RunJournal {

    void recordStart(SessionRunId runId, int workerCount, int universeSize, boolean scannersOnly);

    void recordEnd(SessionRunId runId, String reason);
}
