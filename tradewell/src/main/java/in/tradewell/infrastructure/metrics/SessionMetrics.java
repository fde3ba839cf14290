package in.tradewell.infrastructure.metrics;

import in.tradewell.domain.session.GateReason;
import in.tradewell.domain.session.SymbolAssignment;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

/**
 * Prometheus metrics of the session orchestrator.
 *
 * Key Metrics:
 * - session_gate_decisions_total{reason} - Gate outcomes
 * - session_worker_count - Workers chosen for the current run
 * - session_universe_size - Instruments in the finalized universe
 * - session_shard_symbols{shard} - Symbols owned by each shard
 * - session_workers_started_total{role} - Workers launched
 * - session_workers_terminated_total{role} - Workers force-stopped on shutdown
 */
public class SessionMetrics {

    private final CollectorRegistry registry;

    private final Counter gateDecisions;
    private final Gauge workerCount;
    private final Gauge universeSize;
    private final Gauge shardSymbols;
    private final Counter workersStarted;
    private final Counter workersTerminated;

    public SessionMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public SessionMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.gateDecisions = Counter.build()
            .name("session_gate_decisions_total")
            .help("Session gate outcomes")
            .labelNames("reason")
            .register(registry);

        this.workerCount = Gauge.build()
            .name("session_worker_count")
            .help("Number of consumer workers in the current run")
            .register(registry);

        this.universeSize = Gauge.build()
            .name("session_universe_size")
            .help("Number of instruments in the finalized universe")
            .register(registry);

        this.shardSymbols = Gauge.build()
            .name("session_shard_symbols")
            .help("Number of symbols owned by each shard")
            .labelNames("shard")
            .register(registry);

        this.workersStarted = Counter.build()
            .name("session_workers_started_total")
            .help("Workers launched")
            .labelNames("role")
            .register(registry);

        this.workersTerminated = Counter.build()
            .name("session_workers_terminated_total")
            .help("Workers force-stopped during shutdown")
            .labelNames("role")
            .register(registry);
    }

    public void recordGateDecision(GateReason reason) {
        gateDecisions.labels(reason.name()).inc();
    }

    public void recordAssignment(int universe, SymbolAssignment assignment) {
        universeSize.set(universe);
        workerCount.set(assignment.workerCount());
        shardSymbols.clear();
        for (int shard = 0; shard < assignment.workerCount(); shard++) {
            shardSymbols.labels(String.valueOf(shard)).set(assignment.symbolsFor(shard).size());
        }
    }

    public void recordWorkerStarted(String role) {
        workersStarted.labels(role).inc();
    }

    public void recordWorkerTerminated(String role) {
        workersTerminated.labels(role).inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
