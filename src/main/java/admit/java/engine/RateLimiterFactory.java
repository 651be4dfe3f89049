package admit.java.engine;

import admit.core.clock.Clock;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factory for creating rate limiter engines from configuration.
 *
 * Thread-safety: This class is stateless and thread-safe.
 */
public final class RateLimiterFactory {

    private RateLimiterFactory() {
        // Utility class, no instantiation
    }

    /**
     * Creates an engine backed by a fresh in-memory table.
     *
     * @param name Policy name
     * @param clock Clock instance for time control (injected for testability)
     * @param config Limit, window, sweep interval and failure policy
     * @return A new, not yet started engine
     * @throws IllegalArgumentException if configuration is invalid
     */
    public static RateLimiterEngine create(String name, Clock clock, RateLimiterConfig config) {
        return new RateLimiterEngine(name, clock, config, new InMemoryRateLimitStore());
    }

    /**
     * Creates one independent engine per named policy.
     *
     * @param clock Shared clock
     * @param policies Policy name to configuration
     * @return Engines keyed by policy name, in the iteration order of {@code policies}
     */
    public static Map<String, RateLimiterEngine> createAll(Clock clock, Map<String, RateLimiterConfig> policies) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (policies == null) throw new IllegalArgumentException("policies cannot be null");

        Map<String, RateLimiterEngine> engines = new LinkedHashMap<>();
        policies.forEach((policy, config) -> engines.put(policy, create(policy, clock, config)));
        return engines;
    }
}
