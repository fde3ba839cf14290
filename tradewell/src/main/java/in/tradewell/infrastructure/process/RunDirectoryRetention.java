package in.tradewell.infrastructure.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Keeps the newest run directories under {@code RUN_DIR} and deletes the
 * rest, queue journals, args files and worker logs included.
 *
 * Runs are ordered by directory modification time. A {@code keep} of zero or
 * less disables pruning.
 */
public final class RunDirectoryRetention {
    private static final Logger log = LoggerFactory.getLogger(RunDirectoryRetention.class);

    private final Path runRoot;
    private final int keep;

    public RunDirectoryRetention(Path runRoot, int keep) {
        this.runRoot = runRoot;
        this.keep = keep;
    }

    /**
     * @return number of run directories removed
     */
    public int prune() {
        if (keep <= 0 || !Files.isDirectory(runRoot)) {
            return 0;
        }

        List<Path> runs;
        try (Stream<Path> children = Files.list(runRoot)) {
            runs = children
                .filter(Files::isDirectory)
                .sorted(Comparator.comparing(RunDirectoryRetention::lastModified).reversed())
                .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            log.warn("Cannot list run directories under {}: {}", runRoot, e.getMessage());
            return 0;
        }
        if (runs.size() <= keep) {
            return 0;
        }

        int removed = 0;
        for (Path run : runs.subList(keep, runs.size())) {
            if (delete(run)) {
                removed++;
            }
        }
        log.info("Pruned {} old run directories under {} (keeping {})", removed, runRoot, keep);
        return removed;
    }

    private static boolean delete(Path run) {
        try (Stream<Path> tree = Files.walk(run)) {
            for (Path path : tree.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.deleteIfExists(path);
            }
            log.debug("Deleted run directory {}", run);
            return true;
        } catch (IOException e) {
            log.warn("Failed to delete run directory {}", run, e);
            return false;
        }
    }

    private static FileTime lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
