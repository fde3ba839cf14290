package in.tradewell.service.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks how many consumer workers a session runs.
 *
 * An operator-configured count always wins. Otherwise the count scales with
 * the CPUs of the host, normalized by the current load average and
 * multiplied by the configured factor:
 * <pre>
 * workers = ceil(cpuCount / min(loadAverage, 1.0) * procFactor)
 * </pre>
 * The load average is the system-wide value, so unrelated activity on the
 * host counts too.
 */
public final class WorkerCountEstimator {
    private static final Logger log = LoggerFactory.getLogger(WorkerCountEstimator.class);

    private final HostLoad hostLoad;

    public WorkerCountEstimator(HostLoad hostLoad) {
        this.hostLoad = hostLoad;
    }

    /**
     * Estimate from the live host figures.
     */
    public int estimateForHost(int configuredCount, double procFactor) {
        int cpus = hostLoad.cpuCount();
        double load = hostLoad.loadAverage();
        int workers = estimate(configuredCount, cpus, load, procFactor);
        log.info("Worker count {} (configured={}, cpus={}, load={}, factor={})",
            workers, configuredCount, cpus, load, procFactor);
        return workers;
    }

    /**
     * @return worker count, always >= 1
     */
    public static int estimate(int configuredCount, int cpuCount, double loadAverage, double procFactor) {
        if (configuredCount > 0) {
            return configuredCount;
        }
        double load = loadAverage > 0 && !Double.isNaN(loadAverage) ? loadAverage : 1.0;
        double divisor = Math.min(load, 1.0);

        double raw = cpuCount > 0
            ? cpuCount / divisor * procFactor
            : procFactor / divisor;

        long rounded = (long) Math.ceil(raw);
        if (rounded < 1) {
            return 1;
        }
        return (int) Math.min(rounded, Integer.MAX_VALUE);
    }
}
