package in.tradewell.domain.session;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Open and close of the current trading session.
 *
 * Built once per run from the market calendar and never changed afterwards.
 */
public record TradingWindow(Instant open, Instant close) {

    public TradingWindow {
        Objects.requireNonNull(open, "open");
        Objects.requireNonNull(close, "close");
        if (!open.isBefore(close)) {
            throw new IllegalArgumentException("Window open " + open + " must be before close " + close);
        }
    }

    /**
     * Time left until the session opens, negative once it has opened.
     */
    public Duration untilOpen(Instant now) {
        return Duration.between(now, open);
    }

    public boolean isOver(Instant now) {
        return !now.isBefore(close);
    }
}
