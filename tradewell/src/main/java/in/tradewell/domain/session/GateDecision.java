package in.tradewell.domain.session;

import java.util.Optional;

/**
 * Outcome of the session gate.
 */
public record GateDecision(boolean proceed, Optional<TradingWindow> window, GateReason reason) {

    public static GateDecision proceed(TradingWindow window, GateReason reason) {
        return new GateDecision(true, Optional.ofNullable(window), reason);
    }

    public static GateDecision skip(TradingWindow window, GateReason reason) {
        return new GateDecision(false, Optional.ofNullable(window), reason);
    }
}
