package admit.core.ratelimit;

import java.util.function.UnaryOperator;

/**
 * Backing table for rate-limit records, one record per key.
 */
public interface RateLimitStore {

    /**
     * Atomically replaces the record for {@code key} with {@code update.apply(current)}.
     * {@code current} is null when no record exists. No other update of the same key
     * may interleave with this one. Updates of different keys must not block each other.
     *
     * @return the record stored after the update
     */
    RateLimitRecord compute(String key, UnaryOperator<RateLimitRecord> update);

    /**
     * Removes every record whose window ended before {@code nowMillis}.
     * A record replaced concurrently with a live window must survive.
     *
     * @return number of records removed
     */
    int sweepExpired(long nowMillis);

    int size();

    void clear();
}
