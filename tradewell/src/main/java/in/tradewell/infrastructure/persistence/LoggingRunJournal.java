package in.tradewell.infrastructure.persistence;

import in.tradewell.application.port.output.RunJournal;
import in.tradewell.domain.session.SessionRunId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RunJournal used when no database is configured: start and end go to the log.
 */
public final class LoggingRunJournal implements RunJournal {
    private static final Logger log = LoggerFactory.getLogger(LoggingRunJournal.class);

    @Override
    public void recordStart(SessionRunId runId, int workerCount, int universeSize, boolean scannersOnly) {
        log.info("Run {} started: workers={}, universe={}, scannersOnly={}",
            runId, workerCount, universeSize, scannersOnly);
    }

    @Override
    public void recordEnd(SessionRunId runId, String reason) {
        log.info("Run {} ended: {}", runId, reason);
    }
}
