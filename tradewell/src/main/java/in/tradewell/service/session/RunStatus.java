package in.tradewell.service.session;

public enum RunStatus {
    /** The session gate refused to start, or the run was cancelled before any worker started. */
    NOT_STARTED,
    COMPLETED,
    INTERRUPTED
}
