package in.tradewell.application.port.output;

import in.tradewell.domain.session.OpenPosition;

import java.util.List;

/**
 * Port for positions currently open at the broker.
 */
public interface PositionPort {
    List<OpenPosition> listOpenPositions();
}
