package admit.java.config;

import admit.core.collision.IdentityRules;
import admit.core.verification.VerificationQueue;
import admit.java.engine.FailurePolicy;
import admit.java.engine.RateLimiterConfig;
import admit.java.engine.RateLimiterRegistry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Typed view of the flat configuration produced by {@link AdmissionConfigLoader}.
 *
 * @param rateLimits policy name to limiter settings; always contains "default"
 * @param identityRules collision guard settings
 * @param depthWarningThreshold verification queue backlog warning level
 * @param registrationPolicy rate-limit policy applied by the registration gate
 * @param port gRPC port of the standalone server
 */
public record AdmissionConfig(
    Map<String, RateLimiterConfig> rateLimits,
    IdentityRules identityRules,
    long depthWarningThreshold,
    String registrationPolicy,
    int port
) {
    public static final int DEFAULT_RATE_LIMIT_MAX = 100;
    public static final long DEFAULT_RATE_LIMIT_WINDOW_MS = 600_000L;
    public static final int DEFAULT_PORT = 9090;

    private static final String POLICY_PREFIX = "rateLimit.policies.";

    public AdmissionConfig {
        rateLimits = Map.copyOf(rateLimits);
        if (!rateLimits.containsKey(RateLimiterRegistry.DEFAULT_POLICY)) {
            throw new IllegalArgumentException("rateLimits must contain the default policy");
        }
        if (!rateLimits.containsKey(registrationPolicy)) {
            throw new IllegalArgumentException("registration.policy refers to unknown policy: " + registrationPolicy);
        }
    }

    public static AdmissionConfig defaults() {
        return fromProperties(Map.of());
    }

    /**
     * Binds flat keys, falling back to defaults for anything missing.
     *
     * @throws ConfigException when a value is malformed
     */
    public static AdmissionConfig fromProperties(Map<String, String> props) {
        FailurePolicy failurePolicy = failurePolicy(props, "rateLimit.failurePolicy", FailurePolicy.FAIL_OPEN);
        int max = intValue(props, "rateLimit.max", DEFAULT_RATE_LIMIT_MAX);
        long windowMs = longValue(props, "rateLimit.windowMs", DEFAULT_RATE_LIMIT_WINDOW_MS);
        long sweepMs = longValue(props, "rateLimit.sweepIntervalMs", windowMs);

        Map<String, RateLimiterConfig> rateLimits = new LinkedHashMap<>();
        rateLimits.put(RateLimiterRegistry.DEFAULT_POLICY, new RateLimiterConfig(max, windowMs, sweepMs, failurePolicy));
        for (String policy : policyNames(props)) {
            String prefix = POLICY_PREFIX + policy + '.';
            int policyMax = intValue(props, prefix + "max", max);
            long policyWindow = longValue(props, prefix + "windowMs", windowMs);
            long policySweep = longValue(props, prefix + "sweepIntervalMs", policyWindow);
            FailurePolicy policyFailure = failurePolicy(props, prefix + "failurePolicy", failurePolicy);
            rateLimits.put(policy, new RateLimiterConfig(policyMax, policyWindow, policySweep, policyFailure));
        }

        IdentityRules defaults = IdentityRules.defaults();
        IdentityRules rules = new IdentityRules(
            longValue(props, "collisionGuard.deterrenceWindowMs", defaults.deterrenceWindowMillis()),
            intValue(props, "collisionGuard.minNameLength", defaults.minNameLength()),
            intValue(props, "collisionGuard.maxNameLength", defaults.maxNameLength()),
            intValue(props, "collisionGuard.maxSymbolLength", defaults.maxSymbolLength())
        );

        return new AdmissionConfig(
            rateLimits,
            rules,
            longValue(props, "verificationQueue.depthWarningThreshold", VerificationQueue.DEFAULT_DEPTH_WARNING_THRESHOLD),
            props.getOrDefault("registration.policy", RateLimiterRegistry.DEFAULT_POLICY).trim(),
            intValue(props, "server.port", DEFAULT_PORT)
        );
    }

    private static Set<String> policyNames(Map<String, String> props) {
        Set<String> names = new TreeSet<>();
        for (String key : props.keySet()) {
            if (key.startsWith(POLICY_PREFIX)) {
                String rest = key.substring(POLICY_PREFIX.length());
                int dot = rest.indexOf('.');
                if (dot <= 0) {
                    throw new ConfigException(key, "malformed policy key");
                }
                String name = rest.substring(0, dot);
                if (name.equals(RateLimiterRegistry.DEFAULT_POLICY)) {
                    throw new ConfigException(key, "configure the default policy under rateLimit.*");
                }
                names.add(name);
            }
        }
        return names;
    }

    private static FailurePolicy failurePolicy(Map<String, String> props, String key, FailurePolicy fallback) {
        String raw = props.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return FailurePolicy.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new ConfigException(key, e.getMessage(), e);
        }
    }

    private static int intValue(Map<String, String> props, String key, int fallback) {
        String raw = props.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException(key, "must be an integer, got: " + raw, e);
        }
    }

    private static long longValue(Map<String, String> props, String key, long fallback) {
        String raw = props.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException(key, "must be an integer, got: " + raw, e);
        }
    }
}
