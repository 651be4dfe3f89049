package admit.core.admission;

/**
 * Raised by an {@link IdentityWriter} when another registration already holds the identity.
 * Callers treat it as a lost race, not a failure.
 */
public class IdentityTakenException extends Exception {

    private final String subject;

    public IdentityTakenException(String subject) {
        super("identity already taken: " + subject);
        this.subject = subject;
    }

    public String subject() {
        return subject;
    }
}
