package in.tradewell.bootstrap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import in.tradewell.config.ConfigurationException;
import in.tradewell.config.TradingPlan;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StartupConfigValidatorTest {

    private static final Map<String, JsonNode> ONE = Map.of("x", JsonNodeFactory.instance.objectNode());

    private static TradingPlan plan(Map<String, JsonNode> scanners, Map<String, JsonNode> strategies) {
        return new TradingPlan(false, false, false, 0, null, null, List.of("AAPL"), scanners, strategies);
    }

    @Test
    void validPlanPasses() {
        assertDoesNotThrow(() -> StartupConfigValidator.validate(plan(ONE, ONE)));
    }

    @Test
    void noScannersRejected() {
        ConfigurationException error = assertThrows(ConfigurationException.class,
            () -> StartupConfigValidator.validate(plan(Map.of(), ONE)));

        assertTrue(error.getMessage().contains("no scanners"));
    }

    @Test
    void noStrategiesRejected() {
        ConfigurationException error = assertThrows(ConfigurationException.class,
            () -> StartupConfigValidator.validate(plan(ONE, Map.of())));

        assertTrue(error.getMessage().contains("no strategies"));
    }
}
