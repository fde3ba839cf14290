package in.tradewell.domain.session;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InstrumentUniverseTest {

    @Test
    void builder_normalizesAndDeduplicates() {
        InstrumentUniverse universe = InstrumentUniverse.builder()
            .add(" aapl ")
            .addAll(Arrays.asList("MSFT", "AAPL", "", null, "nvda"))
            .build();

        assertEquals(List.of("AAPL", "MSFT", "NVDA"), universe.asList());
        assertThrows(UnsupportedOperationException.class, () -> universe.iterator().remove());
    }

    @Test
    void of_keepsFirstSeenOrder() {
        InstrumentUniverse universe = InstrumentUniverse.of(List.of("TSLA", "AAPL", "TSLA"));

        assertEquals(2, universe.size());
        assertEquals("TSLA", universe.iterator().next());
        assertTrue(universe.contains("AAPL"));
        assertFalse(universe.contains("aapl"));
    }
}
