package in.tradewell.config;

/**
 * The trading plan or the session settings do not allow a run.
 *
 * Treated as "nothing to do": the application logs it and exits cleanly.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
