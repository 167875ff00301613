package FSAConv;

import java.time.Duration;
import java.util.Properties;

/**
 * Settings of a {@link ConversionEngine}.
 *
 * @param maxDeterminizedStates largest DFA the determinizer may build
 * @param autoOptimize prune unreachable and dead states from NFA/DFA conversion results
 * @param cacheCapacity number of cached results kept, 0 disables caching
 * @param timeout wall-clock limit per operation, or null for none
 */
public record EngineConfig(int maxDeterminizedStates, boolean autoOptimize, int cacheCapacity, Duration timeout) {
    public static final String MAX_STATES = "fsaconv.maxStates";
    public static final String AUTO_OPTIMIZE = "fsaconv.autoOptimize";
    public static final String CACHE_CAPACITY = "fsaconv.cacheCapacity";
    public static final String TIMEOUT_MILLIS = "fsaconv.timeoutMillis";

    public static final int DEFAULT_MAX_STATES = 10000;
    public static final int DEFAULT_CACHE_CAPACITY = 256;

    public EngineConfig {
        if (maxDeterminizedStates < 1) {
            throw new IllegalArgumentException("maxDeterminizedStates must be positive: " + maxDeterminizedStates);
        }
        if (cacheCapacity < 0) {
            throw new IllegalArgumentException("cacheCapacity must not be negative: " + cacheCapacity);
        }
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig(DEFAULT_MAX_STATES, true, DEFAULT_CACHE_CAPACITY, null);
    }

    /**
     * Reads the {@code fsaconv.*} keys; missing keys keep their default.
     */
    public static EngineConfig fromProperties(Properties props) {
        final EngineConfig d = defaults();
        final String timeoutMillis = props.getProperty(TIMEOUT_MILLIS);
        return new EngineConfig(
                intProperty(props, MAX_STATES, d.maxDeterminizedStates()),
                booleanProperty(props, AUTO_OPTIMIZE, d.autoOptimize()),
                intProperty(props, CACHE_CAPACITY, d.cacheCapacity()),
                timeoutMillis == null ? d.timeout() : Duration.ofMillis(parseInt(TIMEOUT_MILLIS, timeoutMillis)));
    }

    public EngineConfig withMaxDeterminizedStates(int max) {
        return new EngineConfig(max, autoOptimize, cacheCapacity, timeout);
    }

    public EngineConfig withAutoOptimize(boolean enabled) {
        return new EngineConfig(maxDeterminizedStates, enabled, cacheCapacity, timeout);
    }

    public EngineConfig withCacheCapacity(int capacity) {
        return new EngineConfig(maxDeterminizedStates, autoOptimize, capacity, timeout);
    }

    public EngineConfig withTimeout(Duration limit) {
        return new EngineConfig(maxDeterminizedStates, autoOptimize, cacheCapacity, limit);
    }

    private static int intProperty(Properties props, String key, int fallback) {
        final String value = props.getProperty(key);
        return value == null ? fallback : parseInt(key, value);
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": '" + value + "'", e);
        }
    }

    private static boolean booleanProperty(Properties props, String key, boolean fallback) {
        final String value = props.getProperty(key);
        if (value == null) {
            return fallback;
        }
        final String v = value.trim();
        if (v.equalsIgnoreCase("true")) {
            return true;
        }
        if (v.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException("Invalid boolean for " + key + ": '" + value + "'");
    }
}
