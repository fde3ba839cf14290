package in.tradewell.config;

/**
 * How workers are hosted.
 */
public enum WorkerMode {
    /** One OS process per worker (default). */
    PROCESS,
    /** One thread per worker inside the orchestrator JVM, for local development. */
    THREAD;

    public static WorkerMode parse(String value) {
        if (value == null || value.isBlank()) {
            return PROCESS;
        }
        try {
            return WorkerMode.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown WORKER_MODE: " + value);
        }
    }
}
