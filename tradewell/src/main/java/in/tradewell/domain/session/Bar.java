package in.tradewell.domain.session;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Historical OHLCV bar used to warm up instrument state.
 */
public record Bar(
        Instant timestamp,
        BigDecimal open,
        BigDecimal high,
        BigDecimal low,
        BigDecimal close,
        long volume) {
}
