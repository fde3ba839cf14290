package in.tradewell.service.session;

import in.tradewell.domain.session.SessionRunId;

/**
 * Result of one orchestrator run.
 *
 * @param reason gate reason for {@link RunStatus#NOT_STARTED}, otherwise the
 *               end reason recorded in the run journal
 */
public record RunOutcome(SessionRunId runId, RunStatus status, String reason) {
}
