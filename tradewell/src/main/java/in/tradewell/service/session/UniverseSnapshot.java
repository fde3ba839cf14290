package in.tradewell.service.session;

import in.tradewell.domain.session.Bar;
import in.tradewell.domain.session.InstrumentUniverse;

import java.util.List;
import java.util.Map;

/**
 * Finalized universe of a run together with the history it was warmed up with.
 *
 * @param droppedPositions open positions that did not survive warm-up and are
 *                         therefore not watched this session
 */
public record UniverseSnapshot(
    InstrumentUniverse universe,
    Map<String, List<Bar>> warmUp,
    List<String> droppedPositions
) {
    public UniverseSnapshot {
        warmUp = Map.copyOf(warmUp);
        droppedPositions = List.copyOf(droppedPositions);
    }
}
