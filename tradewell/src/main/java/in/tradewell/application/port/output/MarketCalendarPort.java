package in.tradewell.application.port.output;

import in.tradewell.domain.session.SessionCalendar;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Port for the exchange trading calendar.
 */
public interface MarketCalendarPort {

    /**
     * Next trading session on or after {@code date}.
     *
     * @return the session, or empty if the calendar has no upcoming session
     */
    Optional<SessionCalendar> getSessionCalendar(LocalDate date);
}
