package in.tradewell.worker;

import in.tradewell.infrastructure.ipc.JournalQueueFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Iterator;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Entry point of every spawned worker process.
 *
 * Usage: {@code WorkerMain <producer|consumer|scanner> <argsFile>}. The args
 * file sits in the run directory next to the {@code queues} directory that
 * holds the journal queues.
 *
 * Exit status: 0 when the worker returned, 1 on bad usage, missing provider
 * or a worker failure.
 */
public final class WorkerMain {
    private static final Logger log = LoggerFactory.getLogger(WorkerMain.class);

    /** Sub-directory of the run directory holding the queue journals. */
    public static final String QUEUE_DIRECTORY = "queues";

    public static void main(String[] args) {
        System.exit(run(args, loadProvider()));
    }

    static int run(String[] args, Optional<WorkerProvider> provider) {
        if (args.length != 2) {
            log.error("Usage: WorkerMain <producer|consumer|scanner> <argsFile>");
            return 1;
        }
        WorkerRole role;
        try {
            role = WorkerRole.valueOf(args[0].toUpperCase());
        } catch (IllegalArgumentException e) {
            log.error("Unknown worker role: {}", args[0]);
            return 1;
        }
        if (provider.isEmpty()) {
            log.error("No {} registered, cannot run {}", WorkerProvider.class.getName(), role.label());
            return 1;
        }

        Path argsFile = Paths.get(args[1]).toAbsolutePath();
        String workerName = argsFile.getFileName().toString().replace(".args.json", "");
        try {
            WorkerArgs workerArgs = WorkerJson.MAPPER.readValue(Files.readString(argsFile), role.argsType());
            WorkerContext context = new WorkerContext(workerName,
                new JournalQueueFactory(argsFile.getParent().resolve(QUEUE_DIRECTORY)));

            log.info("[{}] Starting {} worker (pid {})", workerName, role.label(), ProcessHandle.current().pid());
            role.run(provider.get(), workerArgs, context);
            log.info("[{}] Worker finished", workerName);
            return 0;
        } catch (Exception e) {
            log.error("[{}] Worker failed: {}", workerName, e.getMessage(), e);
            return 1;
        }
    }

    public static Optional<WorkerProvider> loadProvider() {
        Iterator<WorkerProvider> providers = ServiceLoader.load(WorkerProvider.class).iterator();
        if (!providers.hasNext()) {
            return Optional.empty();
        }
        WorkerProvider provider = providers.next();
        if (providers.hasNext()) {
            log.warn("Several worker providers found, using {}", provider.getClass().getName());
        }
        return Optional.of(provider);
    }

    private WorkerMain() {}
}
