package admit.java.engine;

import admit.core.ratelimit.RateLimitRecord;
import admit.core.ratelimit.RateLimitStore;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-local rate-limit table.
 *
 * Thread-safety:
 * - compute() delegates to ConcurrentHashMap.compute, which runs the update
 *   under the bin lock of that key only; unrelated keys proceed in parallel
 * - sweepExpired() uses the conditional remove(key, value): a record replaced
 *   between the expiry test and the removal stays
 */
public final class InMemoryRateLimitStore implements RateLimitStore {

    private final ConcurrentHashMap<String, RateLimitRecord> records = new ConcurrentHashMap<>();

    @Override
    public RateLimitRecord compute(String key, UnaryOperator<RateLimitRecord> update) {
        return records.compute(key, (k, current) -> update.apply(current));
    }

    @Override
    public int sweepExpired(long nowMillis) {
        int removed = 0;
        for (Map.Entry<String, RateLimitRecord> entry : records.entrySet()) {
            RateLimitRecord record = entry.getValue();
            if (record.expiredAt(nowMillis) && records.remove(entry.getKey(), record)) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int size() {
        return records.size();
    }

    @Override
    public void clear() {
        records.clear();
    }
}
