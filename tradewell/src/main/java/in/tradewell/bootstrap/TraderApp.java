package in.tradewell.bootstrap;

import com.zaxxer.hikari.HikariDataSource;
import in.tradewell.application.port.output.RunJournal;
import in.tradewell.config.AlpacaSettings;
import in.tradewell.config.ConfigurationException;
import in.tradewell.config.SessionConfig;
import in.tradewell.config.TradingPlan;
import in.tradewell.config.TradingPlanLoader;
import in.tradewell.config.WorkerMode;
import in.tradewell.infrastructure.broker.alpaca.AlpacaRestClient;
import in.tradewell.infrastructure.ipc.InMemoryQueueFactory;
import in.tradewell.infrastructure.ipc.JournalQueueFactory;
import in.tradewell.infrastructure.metrics.MetricsServer;
import in.tradewell.infrastructure.metrics.SessionMetrics;
import in.tradewell.infrastructure.persistence.DataSources;
import in.tradewell.infrastructure.persistence.LoggingRunJournal;
import in.tradewell.infrastructure.persistence.PostgresRunJournal;
import in.tradewell.infrastructure.process.ProcessWorkerLauncher;
import in.tradewell.infrastructure.process.RunDirectoryRetention;
import in.tradewell.infrastructure.process.ThreadWorkerLauncher;
import in.tradewell.service.session.CancellationToken;
import in.tradewell.service.session.HostLoad;
import in.tradewell.service.session.RunOutcome;
import in.tradewell.service.session.SessionGate;
import in.tradewell.service.session.SessionOrchestrator;
import in.tradewell.service.session.ShutdownSignalHandler;
import in.tradewell.service.session.SymbolPartitioner;
import in.tradewell.service.session.UniverseAssembler;
import in.tradewell.service.session.WorkerCountEstimator;
import in.tradewell.service.session.WorkerRuntime;
import in.tradewell.service.session.WorkerRuntimeFactory;
import in.tradewell.util.Env;
import in.tradewell.worker.WorkerMain;
import in.tradewell.worker.WorkerProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Entry point of the trading session orchestrator.
 *
 * Configuration errors are logged and end the process with status 0: nothing
 * was started, so there is nothing for a supervisor to restart.
 */
public final class TraderApp {
    private static final Logger log = LoggerFactory.getLogger(TraderApp.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);
    private static final int DEFAULT_RUN_RETENTION = 20;

    private TraderApp() {}

    public static void main(String[] args) {
        System.exit(run());
    }

    static int run() {
        SessionConfig config;
        TradingPlan plan;
        try {
            SessionConfig envConfig = SessionConfig.fromEnvironment();
            motd(envConfig);
            plan = TradingPlanLoader.load(envConfig.planFolder(), envConfig.planFilename());
            StartupConfigValidator.validate(plan);
            config = envConfig.withPlan(plan);
        } catch (ConfigurationException e) {
            log.error("❌ Configuration error, not starting: {}", e.getMessage());
            return 0;
        }
        log.info("Session config: {}", config);

        Optional<HikariDataSource> dataSource = Optional.empty();
        MetricsServer metricsServer = null;
        ShutdownSignalHandler signals = null;
        try {
            // ═══════════════════════════════════════════════════════════════
            // Run journal
            // ═══════════════════════════════════════════════════════════════
            RunJournal journal;
            try {
                dataSource = DataSources.fromEnvironment();
                journal = runJournal(dataSource, config);
            } catch (RuntimeException e) {
                log.error("❌ Run journal unavailable, not starting: {}", e.getMessage());
                return 1;
            }

            // ═══════════════════════════════════════════════════════════════
            // Metrics
            // ═══════════════════════════════════════════════════════════════
            SessionMetrics metrics = new SessionMetrics();
            if (config.metricsPort() > 0) {
                metricsServer = new MetricsServer("0.0.0.0", config.metricsPort(), metrics);
                metricsServer.start();
            }

            // ═══════════════════════════════════════════════════════════════
            // Broker and workers
            // ═══════════════════════════════════════════════════════════════
            AlpacaSettings alpacaSettings = AlpacaSettings.fromEnvironment();
            log.info("✓ Broker: {}", alpacaSettings);
            AlpacaRestClient alpaca = new AlpacaRestClient(alpacaSettings, config.marketZone());

            WorkerRuntimeFactory runtimes;
            try {
                runtimes = workerRuntimes(config);
            } catch (ConfigurationException e) {
                log.error("❌ Configuration error, not starting: {}", e.getMessage());
                return 0;
            }

            SessionOrchestrator orchestrator = new SessionOrchestrator(
                config,
                plan,
                new SessionGate(alpaca, config.marketZone(), config.marketCoolDown()),
                new UniverseAssembler(alpaca, alpaca),
                new WorkerCountEstimator(HostLoad.system()),
                new SymbolPartitioner(),
                runtimes,
                journal,
                metrics,
                Clock.systemUTC());

            CancellationToken token = new CancellationToken();
            signals = new ShutdownSignalHandler(token, SHUTDOWN_GRACE);
            signals.install();

            RunOutcome outcome = orchestrator.run(token);
            log.info("═══ Run {} finished: {} ({}) ═══", outcome.runId(), outcome.status(), outcome.reason());
            return 0;
        } catch (RuntimeException e) {
            log.error("❌ Session failed", e);
            return 1;
        } finally {
            if (metricsServer != null) {
                metricsServer.close();
            }
            dataSource.ifPresent(HikariDataSource::close);
            // released last: the shutdown hook holds the JVM until here
            if (signals != null) {
                signals.markDone();
            }
        }
    }

    private static RunJournal runJournal(Optional<HikariDataSource> dataSource, SessionConfig config) {
        if (dataSource.isEmpty()) {
            log.info("✓ DB_URL not set, run journal goes to the log");
            return new LoggingRunJournal();
        }
        PostgresRunJournal postgres = new PostgresRunJournal(dataSource.get(), config.buildLabel());
        postgres.migrate();
        log.info("✓ Postgres run journal ready");
        return postgres;
    }

    static WorkerRuntimeFactory workerRuntimes(SessionConfig config) {
        if (config.workerMode() == WorkerMode.THREAD) {
            WorkerProvider provider = WorkerMain.loadProvider()
                .orElseThrow(() -> new ConfigurationException(
                    "WORKER_MODE=THREAD but no " + WorkerProvider.class.getName() + " is registered"));
            log.warn("⚠ Workers run as threads of this JVM, no crash isolation");
            return runId -> {
                InMemoryQueueFactory queues = new InMemoryQueueFactory();
                return new WorkerRuntime(new ThreadWorkerLauncher(provider, queues), queues);
            };
        }
        RunDirectoryRetention retention =
            new RunDirectoryRetention(config.runDirectory(), Env.getInt("RUN_RETENTION", DEFAULT_RUN_RETENTION));
        return runId -> {
            retention.prune();
            Path runDir = config.runDirectory().resolve(runId.value());
            log.info("Run directory: {}", runDir);
            return new WorkerRuntime(
                new ProcessWorkerLauncher(runDir, config.workerJvmOptions()),
                new JournalQueueFactory(runDir.resolve(WorkerMain.QUEUE_DIRECTORY)));
        };
    }

    private static void motd(SessionConfig config) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Tradewell session orchestrator {} ===", config.buildLabel());
        log.info("TRADE_BUY_WINDOW: {} minutes", config.tradeBuyWindow());
        log.info("DSN: {}", DataSources.redact(Env.get("DB_URL", null)));
        log.info("═══════════════════════════════════════════════════════════════");
    }
}
