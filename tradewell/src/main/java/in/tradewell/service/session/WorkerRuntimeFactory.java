package in.tradewell.service.session;

import in.tradewell.domain.session.SessionRunId;

@FunctionalInterface
public interface WorkerRuntimeFactory {

    WorkerRuntime create(SessionRunId runId);
}
