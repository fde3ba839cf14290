package in.tradewell.bootstrap;

import in.tradewell.config.ConfigurationException;
import in.tradewell.config.TradingPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Refuses to start a session whose trading plan cannot do anything.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    private StartupConfigValidator() {}

    /**
     * @throws ConfigurationException if the plan defines no scanner or no strategy
     */
    public static void validate(TradingPlan plan) {
        log.info("Running startup config validation...");

        if (!plan.hasScanners()) {
            throw new ConfigurationException("❌ INVALID CONFIG: trading plan defines no scanners");
        }
        log.info("✓ {} scanners configured: {}", plan.scanners().size(), plan.scanners().keySet());

        if (!plan.hasStrategies()) {
            throw new ConfigurationException("❌ INVALID CONFIG: trading plan defines no strategies");
        }
        log.info("✓ {} strategies configured: {}", plan.strategies().size(), plan.strategies().keySet());

        if (plan.scanTargets().isEmpty()) {
            log.warn("⚠ Trading plan has no scan targets, universe will hold open positions only");
        }
        if (plan.testScanners()) {
            log.warn("⚠ Scanners-only mode: producer and consumers will not run");
        }
        log.info("✅ Startup config validation passed");
    }
}
