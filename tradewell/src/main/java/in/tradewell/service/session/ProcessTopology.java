package in.tradewell.service.session;

import in.tradewell.domain.session.Bar;
import in.tradewell.domain.session.SessionRunId;
import in.tradewell.domain.session.SymbolAssignment;
import in.tradewell.domain.session.TradingWindow;
import in.tradewell.infrastructure.ipc.MessageQueue;
import in.tradewell.infrastructure.ipc.QueueFactory;
import in.tradewell.infrastructure.ipc.QueueRef;
import in.tradewell.infrastructure.process.WorkerHandle;
import in.tradewell.infrastructure.process.WorkerLauncher;
import in.tradewell.worker.ConsumerArgs;
import in.tradewell.worker.ProducerArgs;
import in.tradewell.worker.ScannerArgs;
import in.tradewell.worker.WorkerArgs;
import in.tradewell.worker.WorkerRole;
import in.tradewell.worker.WorkerSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Producer, consumer pool and scanner of one session, wired by queues.
 *
 * <p>Every shard owns one queue written only by the producer and read only by
 * the consumer of that shard. One more queue carries the producer's feed to
 * the scanner. In scanners-only mode neither the producer nor any consumer is
 * created; the queues still are.
 *
 * <p>The topology never restarts a worker. A worker that dies is only seen as
 * an early return of its join.
 */
public final class ProcessTopology {
    private static final Logger log = LoggerFactory.getLogger(ProcessTopology.class);

    static final Duration JOIN_SLICE = Duration.ofMillis(250);
    static final String SCANNER_FEED = "scanner-feed";

    /**
     * One worker of the topology.
     */
    public record Member(WorkerRole role, WorkerHandle handle) {
        public String name() {
            return handle.name();
        }
    }

    private final SessionRunId runId;
    private final boolean scannersOnly;
    private final List<MessageQueue> shardQueues;
    private final MessageQueue scannerFeed;
    private final List<Member> consumers;
    private final Member producer;
    private final Member scanner;
    private final List<Member> started = new ArrayList<>();

    private ProcessTopology(SessionRunId runId, boolean scannersOnly, List<MessageQueue> shardQueues,
                            MessageQueue scannerFeed, List<Member> consumers, Member producer, Member scanner) {
        this.runId = runId;
        this.scannersOnly = scannersOnly;
        this.shardQueues = List.copyOf(shardQueues);
        this.scannerFeed = scannerFeed;
        this.consumers = List.copyOf(consumers);
        this.producer = producer;
        this.scanner = scanner;
    }

    /**
     * Create queues and worker handles, in dependency order. Nothing is started.
     */
    public static ProcessTopology build(TopologyRequest request, WorkerLauncher launcher, QueueFactory queues) {
        SymbolAssignment assignment = request.assignment();
        int workerCount = assignment.workerCount();
        List<MessageQueue> created = new ArrayList<>();
        try {
            List<MessageQueue> shardQueues = new ArrayList<>(workerCount);
            for (int shard = 0; shard < workerCount; shard++) {
                MessageQueue queue = queues.create(shardQueueName(shard));
                created.add(queue);
                shardQueues.add(queue);
            }
            MessageQueue scannerFeed = queues.create(SCANNER_FEED);
            created.add(scannerFeed);

            List<Member> consumers = new ArrayList<>();
            Member producer = null;
            if (request.scannersOnly()) {
                log.info("Scanners-only mode: no producer, no consumers");
            } else {
                for (int shard = 0; shard < workerCount; shard++) {
                    List<String> symbols = assignment.symbolsFor(shard);
                    ConsumerArgs args = new ConsumerArgs(
                        shard,
                        shardQueues.get(shard).ref(),
                        symbols,
                        warmUpFor(symbols, request.warmUp()),
                        request.runId(),
                        request.plan());
                    consumers.add(spawn(launcher, request.runId(), consumerName(shard), WorkerRole.CONSUMER, args));
                }

                List<QueueRef> shardRefs = new ArrayList<>(workerCount);
                for (MessageQueue queue : shardQueues) {
                    shardRefs.add(queue.ref());
                }
                ProducerArgs args = new ProducerArgs(
                    request.runId(),
                    shardRefs,
                    request.universe().asList(),
                    assignment.symbolToShard(),
                    request.window().map(TradingWindow::close).orElse(null),
                    request.plan(),
                    scannerFeed.ref(),
                    workerCount);
                producer = spawn(launcher, request.runId(), "producer", WorkerRole.PRODUCER, args);
            }

            ScannerArgs scannerArgs = new ScannerArgs(
                request.plan(),
                request.window().map(TradingWindow::open).orElse(null),
                request.window().map(TradingWindow::close).orElse(null),
                scannerFeed.ref());
            Member scanner = spawn(launcher, request.runId(), "scanner", WorkerRole.SCANNER, scannerArgs);

            log.info("Topology built for run {}: {} shard queues, {} consumers, producer={}, scanner=1",
                request.runId(), shardQueues.size(), consumers.size(), producer != null);
            return new ProcessTopology(request.runId(), request.scannersOnly(), shardQueues, scannerFeed,
                consumers, producer, scanner);
        } catch (RuntimeException e) {
            closeAll(created);
            throw e;
        }
    }

    /**
     * Launch the scanner, then (unless scanners-only) the producer and every consumer.
     */
    public void start() {
        if (!started.isEmpty()) {
            throw new IllegalStateException("Topology of run " + runId + " already started");
        }
        launch(scanner);
        if (!scannersOnly) {
            launch(producer);
            for (Member consumer : consumers) {
                launch(consumer);
            }
        }
        log.info("✅ Started {} workers for run {}", started.size(), runId);
    }

    /**
     * Wait for the producer, then the scanner, then each consumer.
     *
     * @return true once every worker has exited, false if the token was
     *         cancelled (or the calling thread interrupted) first
     */
    public boolean awaitCompletion(CancellationToken token) {
        for (Member member : joinOrder()) {
            if (!awaitExit(member, token)) {
                log.info("Stopped waiting for workers of run {} at {}", runId, member.name());
                return false;
            }
            log.info("Worker {} exited with status {}", member.name(),
                member.handle().exitCode().isPresent() ? member.handle().exitCode().getAsInt() : "unknown");
        }
        log.info("All workers of run {} exited", runId);
        return true;
    }

    /**
     * Workers that were started, in start order.
     */
    public List<Member> startedWorkers() {
        return Collections.unmodifiableList(started);
    }

    public List<Member> consumers() {
        return consumers;
    }

    public Optional<Member> producer() {
        return Optional.ofNullable(producer);
    }

    public Member scanner() {
        return scanner;
    }

    public List<MessageQueue> shardQueues() {
        return shardQueues;
    }

    public MessageQueue scannerFeed() {
        return scannerFeed;
    }

    public SessionRunId runId() {
        return runId;
    }

    public void closeQueues() {
        List<MessageQueue> all = new ArrayList<>(shardQueues);
        all.add(scannerFeed);
        closeAll(all);
    }

    static String shardQueueName(int shard) {
        return "shard-" + shard;
    }

    static String consumerName(int shard) {
        return "consumer-" + shard;
    }

    private List<Member> joinOrder() {
        List<Member> order = new ArrayList<>();
        if (producer != null) {
            order.add(producer);
        }
        order.add(scanner);
        order.addAll(consumers);
        return order;
    }

    private void launch(Member member) {
        member.handle().start();
        started.add(member);
        log.info("[{}] Started {} worker", member.name(), member.role().label());
    }

    private static boolean awaitExit(Member member, CancellationToken token) {
        try {
            while (!token.isCancelled()) {
                if (member.handle().join(JOIN_SLICE)) {
                    return true;
                }
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel("interrupted while waiting for " + member.name());
            return false;
        }
    }

    private static Member spawn(WorkerLauncher launcher, SessionRunId runId, String name,
                                WorkerRole role, WorkerArgs args) {
        return new Member(role, launcher.spawn(new WorkerSpec(runId, name, role, args)));
    }

    private static Map<String, List<Bar>> warmUpFor(List<String> symbols, Map<String, List<Bar>> warmUp) {
        Map<String, List<Bar>> subset = new LinkedHashMap<>();
        for (String symbol : symbols) {
            List<Bar> bars = warmUp.get(symbol);
            if (bars != null) {
                subset.put(symbol, bars);
            }
        }
        return subset;
    }

    private static void closeAll(List<MessageQueue> queues) {
        for (MessageQueue queue : queues) {
            try {
                queue.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close queue {}: {}", queue.ref().name(), e.getMessage());
            }
        }
    }
}
