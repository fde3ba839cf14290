package in.tradewell.service.session;

import in.tradewell.config.TradingPlan;
import in.tradewell.domain.session.Bar;
import in.tradewell.domain.session.InstrumentUniverse;
import in.tradewell.domain.session.SessionRunId;
import in.tradewell.domain.session.SymbolAssignment;
import in.tradewell.domain.session.TradingWindow;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Inputs of {@link ProcessTopology#build}.
 */
public record TopologyRequest(
    SessionRunId runId,
    InstrumentUniverse universe,
    SymbolAssignment assignment,
    Optional<TradingWindow> window,
    TradingPlan plan,
    Map<String, List<Bar>> warmUp,
    boolean scannersOnly
) {
    public TopologyRequest {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(universe, "universe");
        Objects.requireNonNull(assignment, "assignment");
        Objects.requireNonNull(plan, "plan");
        window = window == null ? Optional.empty() : window;
        warmUp = warmUp == null ? Map.of() : warmUp;
        if (assignment.symbolToShard().size() != universe.size()) {
            throw new IllegalArgumentException("Assignment covers " + assignment.symbolToShard().size()
                + " symbols but the universe has " + universe.size());
        }
    }
}
