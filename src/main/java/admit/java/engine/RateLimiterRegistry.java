package admit.java.engine;

import admit.core.clock.Clock;
import admit.core.model.RateLimitResult;
import admit.core.model.ReasonCode;
import admit.core.model.ValidationException;

import java.util.Map;
import java.util.Set;

/**
 * Named rate-limit policies, each with its own table and sweep task.
 *
 * Different endpoints get different budgets (name checks, realtime auth tokens,
 * registration prepare/submit). A key exhausted under one policy is untouched
 * under another. The {@value #DEFAULT_POLICY} policy is always present.
 */
public final class RateLimiterRegistry implements AutoCloseable {

    public static final String DEFAULT_POLICY = "default";

    private final Map<String, RateLimiterEngine> engines;

    public RateLimiterRegistry(Clock clock, Map<String, RateLimiterConfig> policies) {
        if (policies == null || !policies.containsKey(DEFAULT_POLICY)) {
            throw new IllegalArgumentException("policies must define '" + DEFAULT_POLICY + "'");
        }
        this.engines = Map.copyOf(RateLimiterFactory.createAll(clock, policies));
    }

    /**
     * Checks {@code key} against the named policy.
     *
     * @param policy Policy name; null or blank selects the default policy
     * @param key Client identity
     * @throws ValidationException if the policy is unknown or the key is blank
     */
    public RateLimitResult check(String policy, String key) {
        return limiter(policy).check(key);
    }

    public RateLimiterEngine limiter(String policy) {
        String resolved = (policy == null || policy.isBlank()) ? DEFAULT_POLICY : policy.trim();
        RateLimiterEngine engine = engines.get(resolved);
        if (engine == null) {
            throw new ValidationException(ReasonCode.UNKNOWN_POLICY, "unknown rate-limit policy: " + resolved);
        }
        return engine;
    }

    public Set<String> policies() {
        return engines.keySet();
    }

    public void start() {
        engines.values().forEach(RateLimiterEngine::start);
    }

    public void stop() {
        engines.values().forEach(RateLimiterEngine::stop);
    }

    @Override
    public void close() {
        stop();
    }
}
