package in.tradewell.config;

import in.tradewell.util.Env;

/**
 * Broker endpoint and credentials.
 *
 * Market data always comes from the data endpoint. Positions come from the
 * live or the paper trading endpoint depending on {@code TRADE_ENV}.
 */
public record AlpacaSettings(
    String tradingBaseUrl,
    String dataBaseUrl,
    String apiKeyId,
    String apiSecret,
    int warmUpLookbackDays
) {
    static final String PROD_BASE_URL = "https://api.alpaca.markets";
    static final String PAPER_BASE_URL = "https://paper-api.alpaca.markets";
    static final String DATA_BASE_URL = "https://data.alpaca.markets";

    public static AlpacaSettings fromEnvironment() {
        boolean prod = "PROD".equalsIgnoreCase(Env.get("TRADE_ENV", "PAPER"));
        String tradingUrl = prod
            ? Env.get("ALPACA_PROD_BASE_URL", PROD_BASE_URL)
            : Env.get("ALPACA_PAPER_BASE_URL", PAPER_BASE_URL);
        String keyId = prod
            ? Env.get("ALPACA_PROD_API_KEY_ID", "")
            : Env.get("ALPACA_PAPER_API_KEY_ID", "");
        String secret = prod
            ? Env.get("ALPACA_PROD_API_SECRET", "")
            : Env.get("ALPACA_PAPER_API_SECRET", "");
        return new AlpacaSettings(
            tradingUrl,
            Env.get("ALPACA_DATA_BASE_URL", DATA_BASE_URL),
            keyId,
            secret,
            Env.getInt("WARM_UP_LOOKBACK_DAYS", 5));
    }

    @Override
    public String toString() {
        return "AlpacaSettings[trading=" + tradingBaseUrl + ", data=" + dataBaseUrl
            + ", key=" + mask(apiKeyId) + "]";
    }

    private static String mask(String key) {
        if (key == null || key.length() < 8) return "***";
        return key.substring(0, 4) + "****" + key.substring(key.length() - 4);
    }
}
