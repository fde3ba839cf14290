package in.tradewell.domain.session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Symbol to worker shard mapping for one session.
 *
 * Every symbol of the universe maps to exactly one shard id in
 * {@code [0, workerCount)}. Shards may own no symbol at all; they are still
 * listed so that shard index, queue index and consumer index stay aligned.
 */
public final class SymbolAssignment {

    private final int workerCount;
    private final Map<String, Integer> symbolToShard;
    private final List<List<String>> shardToSymbols;

    public SymbolAssignment(int workerCount, Map<String, Integer> symbolToShard, List<List<String>> shardToSymbols) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, got " + workerCount);
        }
        if (shardToSymbols.size() != workerCount) {
            throw new IllegalArgumentException(
                "Expected " + workerCount + " shard lists, got " + shardToSymbols.size());
        }
        this.workerCount = workerCount;
        this.symbolToShard = Collections.unmodifiableMap(new LinkedHashMap<>(symbolToShard));
        List<List<String>> copy = new ArrayList<>(workerCount);
        for (List<String> shard : shardToSymbols) {
            copy.add(List.copyOf(shard));
        }
        this.shardToSymbols = Collections.unmodifiableList(copy);
    }

    public int workerCount() {
        return workerCount;
    }

    public int shardOf(String symbol) {
        Integer shard = symbolToShard.get(symbol);
        if (shard == null) {
            throw new IllegalArgumentException("Symbol not assigned: " + symbol);
        }
        return shard;
    }

    public List<String> symbolsFor(int shard) {
        if (shard < 0 || shard >= workerCount) {
            throw new IndexOutOfBoundsException("Shard " + shard + " outside [0, " + workerCount + ")");
        }
        return shardToSymbols.get(shard);
    }

    public Map<String, Integer> symbolToShard() {
        return symbolToShard;
    }

    public List<List<String>> shardToSymbols() {
        return shardToSymbols;
    }

    public int idleShardCount() {
        int idle = 0;
        for (List<String> shard : shardToSymbols) {
            if (shard.isEmpty()) idle++;
        }
        return idle;
    }
}
