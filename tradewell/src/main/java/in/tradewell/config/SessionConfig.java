package in.tradewell.config;

import in.tradewell.util.Env;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * Immutable session settings, built once at startup and passed to every
 * component that needs them.
 *
 * Values come from the environment ({@link Env}); the trading plan may
 * override the bypass flag, the worker count, the CPU factor and the warm-up
 * limit via {@link #withPlan(TradingPlan)}.
 */
public record SessionConfig(
    String planFolder,
    String planFilename,
    ZoneId marketZone,
    boolean bypassMarketSchedule,
    Duration marketCoolDown,
    int configuredWorkerCount,
    double cpuFactor,
    int warmUpMaxSymbols,
    boolean skipExisting,
    boolean scannersOnly,
    WorkerMode workerMode,
    Path runDirectory,
    List<String> workerJvmOptions,
    int metricsPort,
    String buildLabel,
    String tradeBuyWindow
) {
    public SessionConfig {
        Objects.requireNonNull(marketZone, "marketZone");
        Objects.requireNonNull(marketCoolDown, "marketCoolDown");
        Objects.requireNonNull(workerMode, "workerMode");
        Objects.requireNonNull(runDirectory, "runDirectory");
        workerJvmOptions = workerJvmOptions == null ? List.of() : List.copyOf(workerJvmOptions);
        if (cpuFactor <= 0) {
            throw new ConfigurationException("CPU factor must be positive, got " + cpuFactor);
        }
        if (warmUpMaxSymbols < 1) {
            throw new ConfigurationException("Warm-up symbol limit must be positive, got " + warmUpMaxSymbols);
        }
    }

    public static SessionConfig fromEnvironment() {
        return new SessionConfig(
            Env.get("TRADEPLAN_DIR", "."),
            Env.get("TRADEPLAN_FILENAME", "tradeplan.json"),
            parseZone(Env.get("MARKET_TIMEZONE", "America/New_York")),
            Env.getBool("BYPASS_MARKET_SCHEDULE", false),
            Duration.ofMinutes(Env.getInt("MARKET_COOL_DOWN_MINUTES", 0)),
            Env.getInt("NUM_CONSUMERS", 0),
            Env.getDouble("CPU_FACTOR", 1.0),
            Env.getInt("WARM_UP_MAX_SYMBOLS", 500),
            false,
            false,
            WorkerMode.parse(Env.get("WORKER_MODE", "PROCESS")),
            Paths.get(Env.get("RUN_DIR", "runs")).toAbsolutePath(),
            Env.getList("WORKER_JVM_OPTS"),
            Env.getInt("METRICS_PORT", 0),
            Env.get("BUILD_LABEL", defaultBuildLabel()),
            Env.get("TRADE_BUY_WINDOW", "120"));
    }

    static ZoneId parseZone(String value) {
        try {
            return ZoneId.of(value.trim());
        } catch (DateTimeException e) {
            throw new ConfigurationException("Unknown MARKET_TIMEZONE: " + value, e);
        }
    }

    /**
     * Merge the plan's run settings into this configuration.
     */
    public SessionConfig withPlan(TradingPlan plan) {
        return new SessionConfig(
            planFolder,
            planFilename,
            marketZone,
            bypassMarketSchedule || plan.bypassMarketSchedule(),
            marketCoolDown,
            plan.workerCount() > 0 ? plan.workerCount() : configuredWorkerCount,
            plan.cpuFactor() != null ? plan.cpuFactor() : cpuFactor,
            plan.warmUpMaxSymbols() != null ? plan.warmUpMaxSymbols() : warmUpMaxSymbols,
            plan.skipExisting(),
            plan.testScanners(),
            workerMode,
            runDirectory,
            workerJvmOptions,
            metricsPort,
            buildLabel,
            tradeBuyWindow);
    }

    private static String defaultBuildLabel() {
        String version = SessionConfig.class.getPackage().getImplementationVersion();
        return version != null ? version : "dev";
    }
}
