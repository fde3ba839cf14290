package in.tradewell.service.session;

import in.tradewell.infrastructure.ipc.QueueFactory;
import in.tradewell.infrastructure.process.WorkerLauncher;

/**
 * Launcher and queue factory used by one run. Both must agree on how workers
 * reach their queues.
 */
public record WorkerRuntime(WorkerLauncher launcher, QueueFactory queues) {
}
