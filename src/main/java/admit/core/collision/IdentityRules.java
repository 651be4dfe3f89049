package admit.core.collision;

import java.time.Duration;

/**
 * Tunables of the collision guard.
 *
 * @param deterrenceWindowMillis how long a non-graduated registration blocks copies
 * @param minNameLength shortest accepted name, after trimming
 * @param maxNameLength longest accepted name, after trimming
 * @param maxSymbolLength longest accepted symbol, after trimming
 */
public record IdentityRules(
    long deterrenceWindowMillis,
    int minNameLength,
    int maxNameLength,
    int maxSymbolLength
) {
    public static final long DEFAULT_DETERRENCE_WINDOW_MILLIS = Duration.ofMinutes(10).toMillis();

    public IdentityRules {
        if (deterrenceWindowMillis <= 0) throw new IllegalArgumentException("deterrenceWindow must be > 0");
        if (minNameLength <= 0) throw new IllegalArgumentException("minNameLength must be > 0");
        if (maxNameLength < minNameLength) throw new IllegalArgumentException("maxNameLength < minNameLength");
        if (maxSymbolLength <= 0) throw new IllegalArgumentException("maxSymbolLength must be > 0");
    }

    public static IdentityRules defaults() {
        return new IdentityRules(DEFAULT_DETERRENCE_WINDOW_MILLIS, 3, 32, 10);
    }

    public IdentityRules withDeterrenceWindow(long millis) {
        return new IdentityRules(millis, minNameLength, maxNameLength, maxSymbolLength);
    }
}
