package admit.core.model;

/**
 * Machine-readable reason attached to every rejected input.
 */
public enum ReasonCode {
    KEY_REQUIRED,
    UNKNOWN_POLICY,
    NAME_REQUIRED,
    NAME_TOO_SHORT,
    NAME_TOO_LONG,
    SYMBOL_TOO_LONG,
    SUBJECT_REQUIRED,
    SUBJECT_TOO_LONG,
    BATCH_SIZE_INVALID
}
