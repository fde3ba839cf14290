package in.tradewell.service.session;

import in.tradewell.infrastructure.metrics.SessionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forcefully stops every started worker of a topology.
 *
 * No drain and no ordering guarantee: there is no checkpoint to resume from,
 * so an immediate stop is all that is needed. Individual failures are logged
 * and never stop the remaining terminations.
 */
public final class ShutdownCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ShutdownCoordinator.class);

    private final SessionMetrics metrics;

    public ShutdownCoordinator(SessionMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * @return number of workers that were terminated without error
     */
    public int shutdown(ProcessTopology topology) {
        log.info("Terminating {} workers of run {}", topology.startedWorkers().size(), topology.runId());
        int terminated = 0;
        for (ProcessTopology.Member member : topology.startedWorkers()) {
            try {
                member.handle().terminate();
                metrics.recordWorkerTerminated(member.role().label());
                terminated++;
                log.info("[{}] Terminated", member.name());
            } catch (RuntimeException e) {
                log.error("[{}] Failed to terminate: {}", member.name(), e.getMessage(), e);
            }
        }
        log.info("Shutdown of run {} done ({} terminated)", topology.runId(), terminated);
        return terminated;
    }
}
