package in.tradewell.service.session;

import in.tradewell.domain.session.InstrumentUniverse;
import in.tradewell.domain.session.SymbolAssignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Assigns every symbol to one worker shard.
 *
 * Single forward scan, one uniformly random shard per symbol, no rebalancing.
 * The default random source is a {@link SecureRandom} so the layout cannot be
 * predicted or replayed across runs.
 */
public final class SymbolPartitioner {
    private static final Logger log = LoggerFactory.getLogger(SymbolPartitioner.class);

    private final Random random;

    public SymbolPartitioner() {
        this(new SecureRandom());
    }

    public SymbolPartitioner(Random random) {
        this.random = random;
    }

    public SymbolAssignment assign(InstrumentUniverse symbols, int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, got " + workerCount);
        }

        List<List<String>> shards = new ArrayList<>(workerCount);
        for (int i = 0; i < workerCount; i++) {
            shards.add(new ArrayList<>());
        }
        Map<String, Integer> symbolToShard = new LinkedHashMap<>();

        for (String symbol : symbols) {
            int shard = random.nextInt(workerCount);
            symbolToShard.put(symbol, shard);
            shards.get(shard).add(symbol);
        }

        SymbolAssignment assignment = new SymbolAssignment(workerCount, symbolToShard, shards);
        log.info("Assigned {} symbols to {} shards ({} idle)",
            symbols.size(), workerCount, assignment.idleShardCount());
        if (log.isDebugEnabled()) {
            for (int shard = 0; shard < workerCount; shard++) {
                log.debug("shard {} -> {}", shard, assignment.symbolsFor(shard));
            }
        }
        return assignment;
    }
}
