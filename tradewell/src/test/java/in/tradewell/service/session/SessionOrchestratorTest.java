package in.tradewell.service.session;

import in.tradewell.application.port.output.HistoryPort;
import in.tradewell.application.port.output.MarketCalendarPort;
import in.tradewell.application.port.output.PositionPort;
import in.tradewell.application.port.output.RunJournal;
import in.tradewell.config.SessionConfig;
import in.tradewell.domain.session.Bar;
import in.tradewell.domain.session.SessionCalendar;
import in.tradewell.domain.session.SessionRunId;
import in.tradewell.infrastructure.ipc.InMemoryQueueFactory;
import in.tradewell.infrastructure.metrics.SessionMetrics;
import in.tradewell.worker.WorkerRole;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionOrchestratorTest {

    private static final Instant NOW = Instant.parse("2024-03-04T15:00:00Z");
    private static final LocalDate DAY = LocalDate.of(2024, 3, 4);
    private static final List<String> TARGETS = List.of("AAPL", "MSFT", "NVDA");

    @Mock
    private MarketCalendarPort calendar;
    @Mock
    private PositionPort positions;
    @Mock
    private HistoryPort history;
    @Mock
    private RunJournal journal;
    @Mock
    private HostLoad hostLoad;

    private FakeWorkerLauncher launcher;
    private int runtimesCreated;
    private CollectorRegistry registry;

    @BeforeEach
    void setUp() {
        runtimesCreated = 0;
        registry = new CollectorRegistry();
    }

    private SessionOrchestrator orchestrator(SessionConfig config, boolean exitOnStart) {
        launcher = new FakeWorkerLauncher(exitOnStart);
        WorkerRuntimeFactory runtimes = runId -> {
            runtimesCreated++;
            return new WorkerRuntime(launcher, new InMemoryQueueFactory());
        };
        return new SessionOrchestrator(
            config,
            SessionFixtures.plan(TARGETS, config.scannersOnly()),
            new SessionGate(calendar, SessionFixtures.NEW_YORK, Duration.ZERO),
            new UniverseAssembler(positions, history),
            new WorkerCountEstimator(hostLoad),
            new SymbolPartitioner(new Random(5)),
            runtimes,
            journal,
            new SessionMetrics(registry),
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void marketOpenWithHistory() {
        when(calendar.getSessionCalendar(DAY)).thenReturn(Optional.of(new SessionCalendar(DAY,
            Instant.parse("2024-03-04T14:30:00Z"), Instant.parse("2024-03-04T21:00:00Z"))));
        when(positions.listOpenPositions()).thenReturn(List.of());
        Map<String, List<Bar>> warmed = new LinkedHashMap<>();
        TARGETS.forEach(s -> warmed.put(s, List.of()));
        when(history.warmUp(anyList(), anyInt())).thenReturn(warmed);
    }

    @Test
    void run_gateRefusalStartsNothing() {
        when(calendar.getSessionCalendar(DAY)).thenReturn(Optional.empty());

        RunOutcome outcome = orchestrator(SessionFixtures.config(false, 2, false), true).run(new CancellationToken());

        assertEquals(RunStatus.NOT_STARTED, outcome.status());
        assertEquals("NO_SESSION", outcome.reason());
        assertEquals(0, runtimesCreated);
        verifyNoInteractions(positions, history, journal);
    }

    @Test
    void run_completesWhenAllWorkersExit() {
        marketOpenWithHistory();

        RunOutcome outcome = orchestrator(SessionFixtures.config(false, 2, false), true).run(new CancellationToken());

        assertEquals(RunStatus.COMPLETED, outcome.status());
        assertEquals(1, runtimesCreated);
        assertEquals(2, launcher.specsOf(WorkerRole.CONSUMER).size());
        assertEquals(1, launcher.specsOf(WorkerRole.PRODUCER).size());
        assertEquals(1, launcher.specsOf(WorkerRole.SCANNER).size());
        launcher.specs.forEach(spec -> assertEquals(outcome.runId(), spec.runId()));
        verify(journal).recordStart(outcome.runId(), 2, 3, false);
        verify(journal).recordEnd(outcome.runId(), "completed");
        launcher.handles.values().forEach(h -> assertEquals(0, h.terminateCalls()));
        assertEquals(3.0, registry.getSampleValue("session_universe_size"));
    }

    @Test
    void run_interruptTerminatesAllFourWorkersOnce() {
        marketOpenWithHistory();
        SessionOrchestrator orchestrator = orchestrator(SessionFixtures.config(false, 2, false), false);
        CancellationToken token = new CancellationToken();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        scheduler.schedule(() -> token.cancel("SIGINT"), 300, TimeUnit.MILLISECONDS);

        try {
            RunOutcome outcome = assertDoesNotThrow(() -> orchestrator.run(token));

            assertEquals(RunStatus.INTERRUPTED, outcome.status());
            assertEquals(4, launcher.handles.size());
            launcher.handles.values().forEach(h -> assertEquals(1, h.terminateCalls(), h.name()));
            verify(journal).recordEnd(outcome.runId(), "interrupted");
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void run_scannersOnlyLaunchesScannerAlone() {
        marketOpenWithHistory();

        RunOutcome outcome = orchestrator(SessionFixtures.config(false, 3, true), true).run(new CancellationToken());

        assertEquals(RunStatus.COMPLETED, outcome.status());
        assertEquals(1, launcher.specs.size());
        assertEquals(WorkerRole.SCANNER, launcher.specs.get(0).role());
        verify(journal).recordStart(outcome.runId(), 3, 3, true);
    }

    @Test
    void run_cancelledBeforeTopologyStartsNothing() {
        marketOpenWithHistory();
        CancellationToken token = new CancellationToken();
        token.cancel("SIGTERM");

        // bypass never waits, so the cancellation is only seen before the topology is built
        RunOutcome outcome = orchestrator(SessionFixtures.config(true, 2, false), true).run(token);

        assertEquals(RunStatus.NOT_STARTED, outcome.status());
        assertEquals(0, runtimesCreated);
        verifyNoInteractions(journal);
    }

    @Test
    void run_launchFailureRecordsEndAndRethrows() {
        marketOpenWithHistory();
        SessionOrchestrator orchestrator = orchestrator(SessionFixtures.config(false, 2, false), false);
        launcher.failOnSpawn("scanner");

        IllegalStateException error = assertThrows(IllegalStateException.class,
            () -> orchestrator.run(new CancellationToken()));

        assertEquals("cannot spawn scanner", error.getMessage());
        verify(journal).recordEnd(any(SessionRunId.class), eq("cannot spawn scanner"));
        launcher.handles.values().forEach(h -> assertFalse(h.isStarted()));
    }

    @Test
    void run_journalFailureDoesNotHideOutcome() {
        marketOpenWithHistory();
        doThrow(new IllegalStateException("db down")).when(journal).recordEnd(any(), anyString());

        RunOutcome outcome = orchestrator(SessionFixtures.config(false, 1, false), true).run(new CancellationToken());

        assertEquals(RunStatus.COMPLETED, outcome.status());
    }
}
