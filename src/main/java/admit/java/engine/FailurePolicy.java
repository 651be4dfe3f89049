package admit.java.engine;

import admit.core.model.Decision;

import java.util.Locale;

/**
 * What a rate limiter answers when its backing store fails.
 *
 * - FAIL_OPEN: admit. An infrastructure hiccup must not turn into a total outage.
 * - FAIL_CLOSED: reject. Abuse protection wins over availability.
 *
 * Either way the result is flagged as degraded so callers can tell it apart.
 */
public enum FailurePolicy {
    FAIL_OPEN(Decision.ADMIT),
    FAIL_CLOSED(Decision.REJECT);

    private final Decision decision;

    FailurePolicy(Decision decision) {
        this.decision = decision;
    }

    public Decision decision() {
        return decision;
    }

    /**
     * Parses "fail-open", "FAIL_OPEN", "open" and the closed equivalents.
     */
    public static FailurePolicy parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("failure policy must not be empty");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "FAIL_OPEN", "OPEN" -> FAIL_OPEN;
            case "FAIL_CLOSED", "CLOSED" -> FAIL_CLOSED;
            default -> throw new IllegalArgumentException("unknown failure policy: " + value);
        };
    }
}
