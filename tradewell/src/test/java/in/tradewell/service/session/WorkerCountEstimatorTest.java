package in.tradewell.service.session;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkerCountEstimatorTest {

    @Mock
    private HostLoad hostLoad;

    @Test
    void estimate_configuredCountWins() {
        assertEquals(3, WorkerCountEstimator.estimate(3, 64, 0.01, 4.0));
        assertEquals(1, WorkerCountEstimator.estimate(1, 8, 0.5, 1.0));
    }

    @Test
    void estimate_loadAboveOneDoesNotShrinkThePool() {
        assertEquals(8, WorkerCountEstimator.estimate(0, 8, 2.0, 1.0));
        assertEquals(8, WorkerCountEstimator.estimate(0, 8, 1.0, 1.0));
    }

    @Test
    void estimate_lowLoadScalesUp() {
        // 8 cpus / 0.5 load
        assertEquals(16, WorkerCountEstimator.estimate(0, 8, 0.5, 1.0));
    }

    @Test
    void estimate_appliesProcFactorAndRoundsUp() {
        assertEquals(2, WorkerCountEstimator.estimate(0, 4, 1.0, 0.5));
        assertEquals(2, WorkerCountEstimator.estimate(0, 3, 1.0, 0.5));
        assertEquals(12, WorkerCountEstimator.estimate(0, 4, 1.5, 3.0));
    }

    @Test
    void estimate_unknownLoadTreatedAsOne() {
        assertEquals(8, WorkerCountEstimator.estimate(0, 8, -1.0, 1.0));
        assertEquals(8, WorkerCountEstimator.estimate(0, 8, Double.NaN, 1.0));
    }

    @Test
    void estimate_neverBelowOne() {
        assertEquals(1, WorkerCountEstimator.estimate(0, 0, -1.0, 0.1));
        assertEquals(1, WorkerCountEstimator.estimate(0, 1, 1.0, 0.01));
        assertEquals(1, WorkerCountEstimator.estimate(-5, 0, 0.0, 0.5));
    }

    @Test
    void estimateForHost_readsHostFigures() {
        when(hostLoad.cpuCount()).thenReturn(4);
        when(hostLoad.loadAverage()).thenReturn(0.25);

        WorkerCountEstimator estimator = new WorkerCountEstimator(hostLoad);

        assertEquals(16, estimator.estimateForHost(0, 1.0));
    }

    @Test
    void estimate_withoutCpuCountScalesProcFactorByLoad() {
        // 2.0 / 0.5
        assertEquals(4, WorkerCountEstimator.estimate(0, 0, 0.5, 2.0));
        assertEquals(3, WorkerCountEstimator.estimate(0, 0, 1.0, 2.5));
        assertEquals(3, WorkerCountEstimator.estimate(0, -1, 4.0, 3.0));
    }

    @Test
    void estimate_neverDecreasesAsCpuCountGrows() {
        for (double load : new double[] {0.1, 0.5, 1.0, 3.0}) {
            int previous = WorkerCountEstimator.estimate(0, 1, load, 0.75);
            for (int cpus = 2; cpus <= 128; cpus++) {
                int current = WorkerCountEstimator.estimate(0, cpus, load, 0.75);
                assertTrue(current >= previous,
                    "load " + load + ": " + cpus + " cpus gave " + current + " < " + previous);
                previous = current;
            }
        }
    }
}
