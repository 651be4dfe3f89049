package admit.core.model;

/**
 * Input rejected before any decision is made. Never coerced into a default.
 */
public class ValidationException extends IllegalArgumentException {

    private final ReasonCode reason;

    public ValidationException(ReasonCode reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ReasonCode reason() {
        return reason;
    }
}
