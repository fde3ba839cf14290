package in.tradewell.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EnvTest {

    private static final String KEY = "TRADEWELL_ENV_TEST_KEY";

    @AfterEach
    void clear() {
        System.clearProperty(KEY);
    }

    @Test
    void fallsBackToSystemProperty() {
        System.setProperty(KEY, " 12 ");

        assertEquals(" 12 ", Env.get(KEY, "x"));
        assertEquals(12, Env.getInt(KEY, 0));
        assertEquals(12.0, Env.getDouble(KEY, 0.0));
    }

    @Test
    void defaultsWhenUnsetOrUnparsable() {
        assertEquals("x", Env.get(KEY, "x"));
        assertEquals(7, Env.getInt(KEY, 7));

        System.setProperty(KEY, "seven");
        assertEquals(7, Env.getInt(KEY, 7));
        assertEquals(1.5, Env.getDouble(KEY, 1.5));
    }

    @Test
    void booleansAndLists() {
        System.setProperty(KEY, "1");
        assertTrue(Env.getBool(KEY, false));

        System.setProperty(KEY, "  -Xmx512m   -XX:+UseZGC ");
        assertEquals(List.of("-Xmx512m", "-XX:+UseZGC"), Env.getList(KEY));
        assertFalse(Env.getBool(KEY, true));

        System.clearProperty(KEY);
        assertEquals(List.of(), Env.getList(KEY));
    }
}
