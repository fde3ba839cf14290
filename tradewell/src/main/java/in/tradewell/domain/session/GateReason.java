package in.tradewell.domain.session;

/**
 * Why the session gate let the run proceed or not.
 */
public enum GateReason {
    READY,
    BYPASSED,
    MARKET_CLOSED_TODAY,
    NO_SESSION,
    SESSION_OVER,
    INTERRUPTED,
    CALENDAR_UNAVAILABLE
}
