package in.tradewell.infrastructure.process;

import in.tradewell.infrastructure.ipc.QueueFactory;
import in.tradewell.worker.WorkerContext;
import in.tradewell.worker.WorkerProvider;
import in.tradewell.worker.WorkerSpec;

/**
 * Hosts workers as threads of the orchestrator JVM.
 *
 * No crash isolation: meant for local development and tests. Queues must
 * come from a factory that can hand the same instance to both sides, such as
 * {@link in.tradewell.infrastructure.ipc.InMemoryQueueFactory}.
 */
public final class ThreadWorkerLauncher implements WorkerLauncher {

    private final WorkerProvider provider;
    private final QueueFactory queues;

    public ThreadWorkerLauncher(WorkerProvider provider, QueueFactory queues) {
        this.provider = provider;
        this.queues = queues;
    }

    @Override
    public WorkerHandle spawn(WorkerSpec spec) {
        WorkerContext context = new WorkerContext(spec.name(), queues);
        return new ThreadWorkerHandle(spec.name(), () -> spec.role().run(provider, spec.args(), context));
    }
}
