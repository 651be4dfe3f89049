package admit.core.collision;

public enum LockStatus {
    UNLOCKED,
    /** Permanent: the matching token graduated. */
    LOCKED_GRADUATED,
    /** Temporary: the matching token was created inside the deterrence window. */
    LOCKED_RECENT
}
