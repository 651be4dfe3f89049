package admit.core.model;

/**
 * Outcome of a single rate-limit check.
 *
 * @param decision ADMIT or REJECT
 * @param remaining admits left in the current window (0 on reject)
 * @param retryAfterMillis time until the window reopens (0 on admit)
 * @param degraded true when the decision came from the failure policy, not the counter
 */
public record RateLimitResult(
    Decision decision,
    int remaining,
    long retryAfterMillis,
    boolean degraded
) {
    public static RateLimitResult admit(int remaining) {
        return new RateLimitResult(Decision.ADMIT, Math.max(0, remaining), 0L, false);
    }

    public static RateLimitResult reject(long retryAfterMillis) {
        return new RateLimitResult(Decision.REJECT, 0, Math.max(1L, retryAfterMillis), false);
    }

    public static RateLimitResult degraded(Decision decision) {
        return new RateLimitResult(decision, 0, 0L, true);
    }

    public boolean admitted() {
        return decision == Decision.ADMIT;
    }
}
