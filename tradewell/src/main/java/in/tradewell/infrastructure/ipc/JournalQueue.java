package in.tradewell.infrastructure.ipc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Optional;

/**
 * Append-only file queue usable across process boundaries.
 *
 * Messages are stored as one JSON document per line. The writer appends and
 * forces each line; the reader tails the file from its own offset and only
 * hands out complete lines. One writer and one reader per file.
 *
 * File layout:
 * <pre>
 * {"type":"bar","symbol":"AAPL",...}\n
 * {"type":"eod"}\n
 * </pre>
 */
public final class JournalQueue implements MessageQueue {
    private static final Logger log = LoggerFactory.getLogger(JournalQueue.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final byte NEWLINE = '\n';
    private static final long TAIL_POLL_MS = 10;

    private final QueueRef ref;
    private final Path path;

    private final Object writeLock = new Object();
    private FileChannel writeChannel;

    private final Object readLock = new Object();
    private FileChannel readChannel;
    private long readOffset;
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private final ByteBuffer readBuffer = ByteBuffer.allocate(8192);

    private volatile boolean closed = false;

    JournalQueue(String name, Path path) {
        this.ref = new QueueRef(name, path.toAbsolutePath().toString());
        this.path = path.toAbsolutePath();
    }

    @Override
    public QueueRef ref() {
        return ref;
    }

    @Override
    public void send(JsonNode message) {
        ensureOpen();
        synchronized (writeLock) {
            try {
                if (writeChannel == null) {
                    writeChannel = FileChannel.open(path,
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
                }
                byte[] json = MAPPER.writeValueAsBytes(message);
                ByteBuffer line = ByteBuffer.allocate(json.length + 1);
                line.put(json).put(NEWLINE).flip();
                while (line.hasRemaining()) {
                    writeChannel.write(line);
                }
                writeChannel.force(false);
            } catch (IOException e) {
                throw new QueueException(ref.name(), "Failed to append to " + path, e);
            }
        }
    }

    @Override
    public JsonNode receive() throws InterruptedException {
        while (true) {
            Optional<JsonNode> message = poll(Duration.ofSeconds(1));
            if (message.isPresent()) {
                return message.get();
            }
        }
    }

    @Override
    public Optional<JsonNode> poll(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            ensureOpen();
            Optional<JsonNode> message = tryRead();
            if (message.isPresent()) {
                return message;
            }
            if (System.nanoTime() >= deadline) {
                return Optional.empty();
            }
            Thread.sleep(TAIL_POLL_MS);
        }
    }

    private Optional<JsonNode> tryRead() {
        synchronized (readLock) {
            try {
                if (readChannel == null) {
                    readChannel = FileChannel.open(path, StandardOpenOption.READ);
                }
                while (true) {
                    Optional<JsonNode> line = takeLine();
                    if (line.isPresent()) {
                        return line;
                    }
                    readBuffer.clear();
                    int read = readChannel.read(readBuffer, readOffset);
                    if (read <= 0) {
                        return Optional.empty();
                    }
                    readOffset += read;
                    pending.write(readBuffer.array(), 0, read);
                }
            } catch (IOException e) {
                throw new QueueException(ref.name(), "Failed to read " + path, e);
            }
        }
    }

    private Optional<JsonNode> takeLine() throws IOException {
        byte[] buffered = pending.toByteArray();
        for (int i = 0; i < buffered.length; i++) {
            if (buffered[i] == NEWLINE) {
                JsonNode message = MAPPER.readTree(buffered, 0, i);
                pending.reset();
                pending.write(buffered, i + 1, buffered.length - i - 1);
                return Optional.of(message);
            }
        }
        return Optional.empty();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Queue closed: " + ref.name());
        }
    }

    @Override
    public void close() {
        closed = true;
        synchronized (writeLock) {
            closeQuietly(writeChannel);
            writeChannel = null;
        }
        synchronized (readLock) {
            closeQuietly(readChannel);
            readChannel = null;
        }
    }

    private void closeQuietly(FileChannel channel) {
        if (channel == null) return;
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("[{}] Failed to close journal channel: {}", ref.name(), e.getMessage());
        }
    }
}
