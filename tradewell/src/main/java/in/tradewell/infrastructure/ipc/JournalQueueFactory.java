package in.tradewell.infrastructure.ipc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Creates journal queues under one directory, one file per queue.
 */
public final class JournalQueueFactory implements QueueFactory {
    private static final Logger log = LoggerFactory.getLogger(JournalQueueFactory.class);

    private final Path directory;

    public JournalQueueFactory(Path directory) {
        this.directory = directory;
    }

    @Override
    public MessageQueue create(String name) {
        Path file = directory.resolve(name + ".ndjson");
        try {
            Files.createDirectories(directory);
            if (Files.exists(file)) {
                throw new IllegalStateException("Queue already exists: " + file);
            }
            Files.createFile(file);
        } catch (IOException e) {
            throw new QueueException(name, "Failed to create journal " + file, e);
        }
        log.debug("Created journal queue {} at {}", name, file);
        return new JournalQueue(name, file);
    }

    @Override
    public MessageQueue open(QueueRef ref) {
        Path file = Paths.get(ref.address());
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Journal not found for queue " + ref.name() + ": " + file);
        }
        return new JournalQueue(ref.name(), file);
    }
}
