package in.tradewell.service.session;

import java.lang.management.ManagementFactory;

/**
 * CPU count and load average of the host.
 */
public interface HostLoad {

    /**
     * Number of CPUs, non-positive when unknown.
     */
    int cpuCount();

    /**
     * One-minute system load average, non-positive when unknown.
     */
    double loadAverage();

    static HostLoad system() {
        return new HostLoad() {
            @Override
            public int cpuCount() {
                return Runtime.getRuntime().availableProcessors();
            }

            @Override
            public double loadAverage() {
                return ManagementFactory.getOperatingSystemMXBean().getSystemLoadAverage();
            }
        };
    }
}
