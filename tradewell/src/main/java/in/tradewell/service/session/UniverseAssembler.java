package in.tradewell.service.session;

import in.tradewell.application.port.output.HistoryPort;
import in.tradewell.application.port.output.PositionPort;
import in.tradewell.domain.session.Bar;
import in.tradewell.domain.session.InstrumentUniverse;
import in.tradewell.domain.session.OpenPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the instrument universe of a session.
 *
 * Candidates are the symbols of open broker positions (unless skipped), then
 * the configured scan targets. The warm-up result decides the final set:
 * only symbols with history are traded.
 */
public final class UniverseAssembler {
    private static final Logger log = LoggerFactory.getLogger(UniverseAssembler.class);

    private final PositionPort positions;
    private final HistoryPort history;

    public UniverseAssembler(PositionPort positions, HistoryPort history) {
        this.positions = positions;
        this.history = history;
    }

    public UniverseSnapshot assemble(List<String> scanTargets, boolean skipExisting, int maxCount) {
        InstrumentUniverse.Builder candidates = InstrumentUniverse.builder();

        List<String> held = new ArrayList<>();
        if (skipExisting) {
            log.info("Skipping existing positions");
        } else {
            for (OpenPosition position : positions.listOpenPositions()) {
                held.add(position.symbol());
                candidates.add(position.symbol());
            }
            log.info("Found {} open positions", held.size());
        }
        candidates.addAll(scanTargets);

        InstrumentUniverse candidateSet = candidates.build();
        log.info("Warming up {} candidate symbols (limit {})", candidateSet.size(), maxCount);
        Map<String, List<Bar>> warmed = new LinkedHashMap<>(history.warmUp(candidateSet.asList(), maxCount));

        InstrumentUniverse universe = InstrumentUniverse.of(warmed.keySet());
        List<String> dropped = new ArrayList<>();
        for (String symbol : held) {
            String normalized = symbol.trim().toUpperCase();
            if (!universe.contains(normalized)) {
                dropped.add(normalized);
            }
        }
        if (!dropped.isEmpty()) {
            log.warn("Open positions without warm-up history, not watched this session: {}", dropped);
        }
        if (universe.isEmpty()) {
            log.warn("Universe is empty after warm-up, consumers will be idle");
        }
        log.info("Universe finalized with {} symbols", universe.size());
        return new UniverseSnapshot(universe, warmed, dropped);
    }
}
