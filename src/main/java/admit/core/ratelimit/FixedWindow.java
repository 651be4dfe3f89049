package admit.core.ratelimit;

import admit.core.model.RateLimitResult;

/**
 * Fixed-window counter, expressed as a pure transition over {@link RateLimitRecord}.
 *
 * The window opens at the first request of a key and lasts {@code windowMillis}.
 * Once {@code now > resetAt} the next request starts a fresh window with count 1,
 * regardless of how requests were spread over the previous one.
 */
public final class FixedWindow {

    /**
     * Result of applying one request to a record.
     *
     * @param next record to store (same instance as the input on reject)
     * @param result decision handed back to the caller
     */
    public record Transition(RateLimitRecord next, RateLimitResult result) {}

    private final long windowMillis;
    private final int limit;

    public FixedWindow(long windowMillis, int limit) {
        if (windowMillis <= 0) throw new IllegalArgumentException("window <= 0");
        if (limit <= 0) throw new IllegalArgumentException("limit <= 0");
        this.windowMillis = windowMillis;
        this.limit = limit;
    }

    /**
     * @param current stored record, or null when the key has none
     * @param nowMillis current time
     */
    public Transition apply(RateLimitRecord current, long nowMillis) {
        if (current == null || current.expiredAt(nowMillis)) {
            RateLimitRecord opened = RateLimitRecord.open(nowMillis, windowMillis);
            return new Transition(opened, RateLimitResult.admit(limit - opened.count()));
        }

        if (current.count() >= limit) {
            // window still covers now == resetAt, so the first admitted instant is resetAt + 1
            long retryAfter = current.resetAtMillis() - nowMillis + 1;
            return new Transition(current, RateLimitResult.reject(retryAfter));
        }

        RateLimitRecord next = current.increment();
        return new Transition(next, RateLimitResult.admit(limit - next.count()));
    }

    public long windowMillis() {
        return windowMillis;
    }

    public int limit() {
        return limit;
    }
}
