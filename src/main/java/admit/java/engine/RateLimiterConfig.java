package admit.java.engine;

/**
 * Configuration for one fixed-window rate limiter.
 *
 * @param limit Maximum admits per window
 * @param windowMillis Window length in milliseconds
 * @param sweepIntervalMillis Delay between expired-record sweeps
 * @param failurePolicy Answer to give when the backing store fails
 */
public record RateLimiterConfig(
    int limit,
    long windowMillis,
    long sweepIntervalMillis,
    FailurePolicy failurePolicy
) {
    public RateLimiterConfig {
        if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
        if (windowMillis <= 0) throw new IllegalArgumentException("windowSize must be > 0");
        if (sweepIntervalMillis <= 0) throw new IllegalArgumentException("sweepInterval must be > 0");
        if (failurePolicy == null) throw new IllegalArgumentException("failurePolicy cannot be null");
    }

    /**
     * Creates a Fixed Window configuration that fails open and sweeps once per window.
     *
     * @param limit Maximum admits per window
     * @param windowMillis Window size in milliseconds
     * @return Configuration for Fixed Window
     */
    public static RateLimiterConfig fixedWindow(int limit, long windowMillis) {
        return new RateLimiterConfig(limit, windowMillis, windowMillis, FailurePolicy.FAIL_OPEN);
    }

    public RateLimiterConfig withFailurePolicy(FailurePolicy policy) {
        return new RateLimiterConfig(limit, windowMillis, sweepIntervalMillis, policy);
    }

    public RateLimiterConfig withSweepInterval(long intervalMillis) {
        return new RateLimiterConfig(limit, windowMillis, intervalMillis, failurePolicy);
    }
}
