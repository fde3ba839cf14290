package in.tradewell.domain.session;

import java.math.BigDecimal;

/**
 * Position currently held at the broker.
 */
public record OpenPosition(String symbol, BigDecimal quantity, String side) {

    public boolean isShort() {
        return "short".equalsIgnoreCase(side) || quantity.signum() < 0;
    }
}
