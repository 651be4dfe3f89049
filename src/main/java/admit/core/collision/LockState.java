package admit.core.collision;

/**
 * Derived lock on an identity; never persisted.
 *
 * @param status lock kind
 * @param remainingMillis time until a LOCKED_RECENT lock lapses; 0 otherwise
 */
public record LockState(LockStatus status, long remainingMillis) {

    private static final LockState UNLOCKED = new LockState(LockStatus.UNLOCKED, 0L);
    private static final LockState GRADUATED = new LockState(LockStatus.LOCKED_GRADUATED, 0L);

    public static LockState unlocked() {
        return UNLOCKED;
    }

    public static LockState lockedGraduated() {
        return GRADUATED;
    }

    public static LockState lockedRecent(long remainingMillis) {
        if (remainingMillis <= 0) throw new IllegalArgumentException("remaining must be > 0");
        return new LockState(LockStatus.LOCKED_RECENT, remainingMillis);
    }

    public boolean locked() {
        return status != LockStatus.UNLOCKED;
    }

    /**
     * User-facing explanation of this state for the given query.
     */
    public String describe(IdentityQuery query) {
        String name = query.name();
        if (query.nameOnly()) {
            return switch (status) {
                case LOCKED_GRADUATED -> "Token name \"" + name + "\" belongs to a graduated token";
                case LOCKED_RECENT -> "Token name \"" + name + "\" was recently created";
                case UNLOCKED -> "Token name \"" + name + "\" is available";
            };
        }
        String symbol = query.displaySymbol();
        return switch (status) {
            case LOCKED_GRADUATED ->
                "A graduated token with name \"" + name + "\" and symbol \"" + symbol + "\" exists";
            case LOCKED_RECENT ->
                "A token with name \"" + name + "\" and symbol \"" + symbol + "\" was recently created";
            case UNLOCKED -> "Token name \"" + name + "\" and symbol \"" + symbol + "\" are available";
        };
    }
}
