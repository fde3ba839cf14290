package in.tradewell.infrastructure.process;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import in.tradewell.config.TradingPlan;
import in.tradewell.domain.session.SessionRunId;
import in.tradewell.infrastructure.ipc.QueueRef;
import in.tradewell.worker.ScannerArgs;
import in.tradewell.worker.WorkerJson;
import in.tradewell.worker.WorkerRole;
import in.tradewell.worker.WorkerSpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ProcessWorkerLauncherTest {

    @TempDir
    Path runDir;

    private static WorkerSpec scannerSpec(SessionRunId runId) {
        TradingPlan plan = new TradingPlan(false, true, false, 0, null, null, List.of("AAPL"),
            Map.of("momentum", JsonNodeFactory.instance.objectNode()), Map.of());
        ScannerArgs args = new ScannerArgs(plan, Instant.parse("2024-03-04T14:30:00Z"),
            Instant.parse("2024-03-04T21:00:00Z"), new QueueRef("scanner-feed", "/tmp/scanner-feed.ndjson"));
        return new WorkerSpec(runId, "scanner", WorkerRole.SCANNER, args);
    }

    @Test
    void spawn_writesArgsFileAndBuildsCommand() throws Exception {
        ProcessWorkerLauncher launcher = new ProcessWorkerLauncher(runDir, List.of("-Xmx256m"), "/opt/jdk/bin/java", "app.jar");
        SessionRunId runId = new SessionRunId("run-1");

        ProcessWorkerHandle handle = (ProcessWorkerHandle) launcher.spawn(scannerSpec(runId));

        Path argsFile = runDir.resolve("scanner.args.json");
        assertTrue(Files.isRegularFile(argsFile));
        ScannerArgs written = WorkerJson.MAPPER.readValue(Files.readString(argsFile), ScannerArgs.class);
        assertEquals("scanner-feed", written.scannerFeedQueue().name());
        assertEquals(Instant.parse("2024-03-04T14:30:00Z"), written.windowOpen());

        assertEquals(List.of(
            "/opt/jdk/bin/java", "-Xmx256m",
            "-Dtradewell.runId=run-1", "-Dtradewell.worker=scanner",
            "-cp", "app.jar",
            "in.tradewell.worker.WorkerMain", "scanner", argsFile.toString()),
            handle.builder().command());
        assertFalse(handle.isStarted());
        assertTrue(handle.join(Duration.ofMillis(1)), "never started counts as exited");
    }

    @Test
    void terminate_killsRunningProcess() throws Exception {
        assumeTrue(Files.isExecutable(Path.of("/bin/sleep")));
        ProcessWorkerHandle handle = new ProcessWorkerHandle("sleeper", new ProcessBuilder("/bin/sleep", "30"));

        handle.start();
        assertTrue(handle.isAlive());
        assertFalse(handle.join(Duration.ofMillis(50)));

        handle.terminate();

        assertTrue(handle.join(Duration.ofSeconds(10)));
        assertFalse(handle.isAlive());
        assertTrue(handle.exitCode().isPresent());
        assertThrows(IllegalStateException.class, handle::start);
    }
}
