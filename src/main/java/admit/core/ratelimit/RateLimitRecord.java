package admit.core.ratelimit;

/**
 * Per-key counter state. Immutable: every update replaces the record.
 *
 * @param count admits granted in the current window
 * @param resetAtMillis end of the window; a request strictly after this opens a new one
 */
public record RateLimitRecord(int count, long resetAtMillis) {

    public RateLimitRecord {
        if (count < 0) throw new IllegalArgumentException("count < 0");
    }

    public static RateLimitRecord open(long nowMillis, long windowMillis) {
        return new RateLimitRecord(1, nowMillis + windowMillis);
    }

    public boolean expiredAt(long nowMillis) {
        return nowMillis > resetAtMillis;
    }

    RateLimitRecord increment() {
        return new RateLimitRecord(count + 1, resetAtMillis);
    }
}
