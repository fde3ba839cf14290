package in.tradewell.infrastructure.process;

import in.tradewell.worker.WorkerJson;
import in.tradewell.worker.WorkerMain;
import in.tradewell.worker.WorkerSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Launches every worker as a separate JVM running {@link WorkerMain}.
 *
 * For each worker the launcher writes {@code <name>.args.json} into the run
 * directory and redirects the child's stdout and stderr to {@code <name>.log}.
 * The child inherits this JVM's class path.
 */
public final class ProcessWorkerLauncher implements WorkerLauncher {
    private static final Logger log = LoggerFactory.getLogger(ProcessWorkerLauncher.class);

    private final Path runDirectory;
    private final List<String> jvmOptions;
    private final String javaBinary;
    private final String classPath;

    public ProcessWorkerLauncher(Path runDirectory, List<String> jvmOptions) {
        this(runDirectory, jvmOptions, defaultJavaBinary(), System.getProperty("java.class.path"));
    }

    ProcessWorkerLauncher(Path runDirectory, List<String> jvmOptions, String javaBinary, String classPath) {
        this.runDirectory = runDirectory;
        this.jvmOptions = List.copyOf(jvmOptions);
        this.javaBinary = javaBinary;
        this.classPath = classPath;
    }

    @Override
    public WorkerHandle spawn(WorkerSpec spec) {
        try {
            Files.createDirectories(runDirectory);
            Path argsFile = runDirectory.resolve(spec.name() + ".args.json");
            Files.writeString(argsFile, WorkerJson.MAPPER.writeValueAsString(spec.args()));

            List<String> command = new ArrayList<>();
            command.add(javaBinary);
            command.addAll(jvmOptions);
            command.add("-Dtradewell.runId=" + spec.runId());
            command.add("-Dtradewell.worker=" + spec.name());
            command.add("-cp");
            command.add(classPath);
            command.add(WorkerMain.class.getName());
            command.add(spec.role().label());
            command.add(argsFile.toString());

            Path logFile = runDirectory.resolve(spec.name() + ".log");
            ProcessBuilder builder = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));

            log.debug("[{}] Prepared worker process: {}", spec.name(), String.join(" ", command));
            return new ProcessWorkerHandle(spec.name(), builder);
        } catch (IOException e) {
            throw new WorkerLaunchException(spec.name(), "Failed to prepare worker: " + e.getMessage(), e);
        }
    }

    private static String defaultJavaBinary() {
        return ProcessHandle.current().info().command()
            .orElse(Paths.get(System.getProperty("java.home"), "bin", "java").toString());
    }
}
