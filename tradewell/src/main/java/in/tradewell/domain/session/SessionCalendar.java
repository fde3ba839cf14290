package in.tradewell.domain.session;

import java.time.LocalDate;
import java.time.Instant;

/**
 * One entry of the exchange calendar: the session date with its open and close.
 */
public record SessionCalendar(LocalDate date, Instant open, Instant close) {

    public TradingWindow toWindow() {
        return new TradingWindow(open, close);
    }

    public boolean isAfter(LocalDate day) {
        return date.isAfter(day);
    }
}
