package in.tradewell.application.port.output;

import in.tradewell.domain.session.Bar;

import java.util.List;
import java.util.Map;

/**
 * Port for historical bar warm-up.
 */
public interface HistoryPort {

    /**
     * Fetch recent history for up to {@code maxCount} of the given symbols.
     *
     * Symbols without usable history are left out of the result. The key set
     * of the returned map, in iteration order, is the set of instruments that
     * can be traded this session.
     */
    Map<String, List<Bar>> warmUp(List<String> symbols, int maxCount);
}
