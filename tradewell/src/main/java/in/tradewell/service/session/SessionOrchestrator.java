package in.tradewell.service.session;

import in.tradewell.application.port.output.RunJournal;
import in.tradewell.config.SessionConfig;
import in.tradewell.config.TradingPlan;
import in.tradewell.domain.session.GateDecision;
import in.tradewell.domain.session.SessionRunId;
import in.tradewell.domain.session.SymbolAssignment;
import in.tradewell.infrastructure.metrics.SessionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Runs one trading session: gate, universe, sharding, topology, wait, shutdown.
 *
 * Single-threaded. It blocks only in the gate's wait for the open and in the
 * joins of the topology, and both observe the {@link CancellationToken}.
 */
public final class SessionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SessionOrchestrator.class);

    static final String REASON_COMPLETED = "completed";
    static final String REASON_INTERRUPTED = "interrupted";

    private final SessionConfig config;
    private final TradingPlan plan;
    private final SessionGate gate;
    private final UniverseAssembler universeAssembler;
    private final WorkerCountEstimator workerCountEstimator;
    private final SymbolPartitioner partitioner;
    private final WorkerRuntimeFactory runtimes;
    private final ShutdownCoordinator shutdownCoordinator;
    private final RunJournal journal;
    private final SessionMetrics metrics;
    private final Clock clock;

    public SessionOrchestrator(SessionConfig config,
                               TradingPlan plan,
                               SessionGate gate,
                               UniverseAssembler universeAssembler,
                               WorkerCountEstimator workerCountEstimator,
                               SymbolPartitioner partitioner,
                               WorkerRuntimeFactory runtimes,
                               RunJournal journal,
                               SessionMetrics metrics,
                               Clock clock) {
        this.config = config;
        this.plan = plan;
        this.gate = gate;
        this.universeAssembler = universeAssembler;
        this.workerCountEstimator = workerCountEstimator;
        this.partitioner = partitioner;
        this.runtimes = runtimes;
        this.shutdownCoordinator = new ShutdownCoordinator(metrics);
        this.journal = journal;
        this.metrics = metrics;
        this.clock = clock;
    }

    public RunOutcome run(CancellationToken token) {
        SessionRunId runId = SessionRunId.generate();
        log.info("Session run {} starting", runId);

        GateDecision decision = gate.evaluate(clock.instant(), config.bypassMarketSchedule(), token);
        metrics.recordGateDecision(decision.reason());
        if (!decision.proceed()) {
            log.info("Run {} not started: {}", runId, decision.reason());
            return new RunOutcome(runId, RunStatus.NOT_STARTED, decision.reason().name());
        }

        UniverseSnapshot snapshot = universeAssembler.assemble(
            plan.scanTargets(), config.skipExisting(), config.warmUpMaxSymbols());
        int workerCount = workerCountEstimator.estimateForHost(config.configuredWorkerCount(), config.cpuFactor());
        SymbolAssignment assignment = partitioner.assign(snapshot.universe(), workerCount);
        metrics.recordAssignment(snapshot.universe().size(), assignment);

        if (token.isCancelled()) {
            log.info("Run {} cancelled before any worker started", runId);
            return new RunOutcome(runId, RunStatus.NOT_STARTED, REASON_INTERRUPTED);
        }

        journal.recordStart(runId, workerCount, snapshot.universe().size(), config.scannersOnly());

        TopologyRequest request = new TopologyRequest(
            runId,
            snapshot.universe(),
            assignment,
            decision.window(),
            plan,
            snapshot.warmUp(),
            config.scannersOnly());

        WorkerRuntime runtime = runtimes.create(runId);
        ProcessTopology topology = null;
        try {
            topology = ProcessTopology.build(request, runtime.launcher(), runtime.queues());
            topology.start();
            for (ProcessTopology.Member member : topology.startedWorkers()) {
                metrics.recordWorkerStarted(member.role().label());
            }

            if (topology.awaitCompletion(token)) {
                recordEnd(runId, REASON_COMPLETED);
                return new RunOutcome(runId, RunStatus.COMPLETED, REASON_COMPLETED);
            }

            log.info("Run {} interrupted ({}), terminating workers", runId, token.reason());
            shutdownCoordinator.shutdown(topology);
            recordEnd(runId, REASON_INTERRUPTED);
            return new RunOutcome(runId, RunStatus.INTERRUPTED, REASON_INTERRUPTED);
        } catch (RuntimeException e) {
            log.error("Run {} failed: {}", runId, e.getMessage(), e);
            if (topology != null) {
                shutdownCoordinator.shutdown(topology);
            }
            recordEnd(runId, String.valueOf(e.getMessage()));
            throw e;
        } finally {
            if (topology != null) {
                topology.closeQueues();
            }
            log.info("Session run {} done", runId);
        }
    }

    private void recordEnd(SessionRunId runId, String reason) {
        try {
            journal.recordEnd(runId, reason);
        } catch (RuntimeException e) {
            log.error("Failed to record end of run {} ({}): {}", runId, reason, e.getMessage(), e);
        }
    }
}
