package admit.core.model;

/**
 * Admit-or-reject contract keyed by client identity.
 * Implementations must be safe for concurrent callers and must not throw
 * for backing-store failures; those are resolved by a documented failure policy.
 */
public interface RateLimiter {
    RateLimitResult check(String key);
}
