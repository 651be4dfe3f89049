package admit.core.model;

/**
 * A backing store (identity registry, pending set, rate-limit table) could not be reached.
 * Distinct from a normal reject: the caller decides whether to fail the request or degrade.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
