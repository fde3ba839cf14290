package in.tradewell.infrastructure.process;

import in.tradewell.worker.WorkerSpec;

/**
 * Creates (but does not start) worker handles.
 */
public interface WorkerLauncher {

    WorkerHandle spawn(WorkerSpec spec);
}
