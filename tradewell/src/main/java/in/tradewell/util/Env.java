package in.tradewell.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Environment variable utilities.
 *
 * Values are read from the process environment first, then from JVM system
 * properties, so that {@code -DKEY=value} works for local runs. Unparsable
 * numbers fall back to the default with a warning.
 */
public final class Env {
    private static final Logger log = LoggerFactory.getLogger(Env.class);

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("{}={} is not an integer, using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public static double getDouble(String key, double defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.warn("{}={} is not a number, using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public static boolean getBool(String key, boolean defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    /**
     * Whitespace-separated list, empty when unset.
     */
    public static List<String> getList(String key) {
        String value = get(key, "");
        return value.isBlank() ? List.of() : List.of(value.trim().split("\\s+"));
    }

    private Env() {}
}
