package in.tradewell.infrastructure.broker.alpaca;

/**
 * The broker REST API answered with an error or could not be reached.
 */
public class BrokerApiException extends RuntimeException {

    private final String endpoint;
    private final int statusCode;

    public BrokerApiException(String endpoint, int statusCode, String message) {
        super(String.format("[%s] HTTP %d: %s", endpoint, statusCode, message));
        this.endpoint = endpoint;
        this.statusCode = statusCode;
    }

    public BrokerApiException(String endpoint, String message, Throwable cause) {
        super(String.format("[%s] %s", endpoint, message), cause);
        this.endpoint = endpoint;
        this.statusCode = -1;
    }

    public String getEndpoint() {
        return endpoint;
    }

    /**
     * HTTP status, or -1 if no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
