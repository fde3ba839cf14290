package in.tradewell.service.session;

import in.tradewell.application.port.output.MarketCalendarPort;
import in.tradewell.domain.session.GateDecision;
import in.tradewell.domain.session.GateReason;
import in.tradewell.domain.session.SessionCalendar;
import in.tradewell.domain.session.TradingWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Decides whether trading starts today, and waits for the market to open.
 *
 * This is the only long wait of the orchestrator: one coarse sleep until
 * open (plus cool-down and a small buffer), never a polling loop.
 */
public final class SessionGate {
    private static final Logger log = LoggerFactory.getLogger(SessionGate.class);

    static final Duration DEFAULT_BUFFER = Duration.ofSeconds(1);

    private final MarketCalendarPort calendar;
    private final ZoneId marketZone;
    private final Duration coolDown;
    private final Duration buffer;

    public SessionGate(MarketCalendarPort calendar, ZoneId marketZone, Duration coolDown) {
        this(calendar, marketZone, coolDown, DEFAULT_BUFFER);
    }

    public SessionGate(MarketCalendarPort calendar, ZoneId marketZone, Duration coolDown, Duration buffer) {
        this.calendar = calendar;
        this.marketZone = marketZone;
        this.coolDown = coolDown;
        this.buffer = buffer;
    }

    /**
     * @param now    current time
     * @param bypass operator override: proceed at once whatever the calendar says
     * @param token  cancels the wait for the open
     */
    public GateDecision evaluate(Instant now, boolean bypass, CancellationToken token) {
        LocalDate today = now.atZone(marketZone).toLocalDate();

        Optional<SessionCalendar> session;
        TradingWindow todayWindow;
        try {
            session = calendar.getSessionCalendar(today);
            // an entry with open at or after close is rejected here
            todayWindow = session
                .filter(s -> !s.isAfter(today))
                .map(SessionCalendar::toWindow)
                .orElse(null);
        } catch (RuntimeException e) {
            if (bypass) {
                log.warn("Calendar unusable ({}), bypassing market schedule anyway", e.getMessage());
                return GateDecision.proceed(null, GateReason.BYPASSED);
            }
            log.error("Calendar unusable, not trading today: {}", e.getMessage(), e);
            return GateDecision.skip(null, GateReason.CALENDAR_UNAVAILABLE);
        }

        if (bypass) {
            log.info("Market schedule bypassed, starting immediately (window {})",
                todayWindow != null ? todayWindow : "n/a");
            return GateDecision.proceed(todayWindow, GateReason.BYPASSED);
        }

        if (session.isEmpty()) {
            log.info("Calendar has no upcoming session, not trading today");
            return GateDecision.skip(null, GateReason.NO_SESSION);
        }
        if (todayWindow == null) {
            log.info("Market closed today, next session on {}", session.get().date());
            return GateDecision.skip(null, GateReason.MARKET_CLOSED_TODAY);
        }

        log.info("Markets open {} close {}, current time {}", todayWindow.open(), todayWindow.close(), now);
        if (todayWindow.isOver(now)) {
            log.info("Missed market open time, try again next trading day or bypass");
            return GateDecision.skip(todayWindow, GateReason.SESSION_OVER);
        }

        Duration wait = todayWindow.untilOpen(now).plus(coolDown);
        if (wait.isNegative() || wait.isZero()) {
            return GateDecision.proceed(todayWindow, GateReason.READY);
        }

        log.info("Waiting {} for market open (cool-down {})", wait, coolDown);
        if (!token.sleep(wait.plus(buffer))) {
            log.info("Wait for market open interrupted, not starting");
            return GateDecision.skip(todayWindow, GateReason.INTERRUPTED);
        }
        log.info("Market open, ready to start");
        return GateDecision.proceed(todayWindow, GateReason.READY);
    }
}
