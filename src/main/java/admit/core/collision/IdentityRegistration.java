package admit.core.collision;

/**
 * A token identity as recorded by the registry. Read-only from the admission layer.
 *
 * @param subject token identifier (e.g. mint address); case-sensitive
 * @param name display name as registered
 * @param symbol ticker symbol, upper-cased
 * @param createdAtMillis registration time
 * @param graduated true once the token left its launch phase; locks the identity for good
 * @param verified true once downstream verification confirmed the subject
 * @param active false for retired registrations, which never match a lookup
 */
public record IdentityRegistration(
    String subject,
    String name,
    String symbol,
    long createdAtMillis,
    boolean graduated,
    boolean verified,
    boolean active
) {
    public IdentityRegistration {
        if (subject == null || subject.isBlank()) throw new IllegalArgumentException("subject cannot be empty");
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name cannot be empty");
    }

    public static IdentityRegistration created(String subject, String name, String symbol, long createdAtMillis) {
        return new IdentityRegistration(subject, name, symbol, createdAtMillis, false, false, true);
    }

    public IdentityRegistration graduate() {
        return new IdentityRegistration(subject, name, symbol, createdAtMillis, true, verified, active);
    }

    public IdentityRegistration verify() {
        return new IdentityRegistration(subject, name, symbol, createdAtMillis, graduated, true, active);
    }

    public IdentityRegistration retire() {
        return new IdentityRegistration(subject, name, symbol, createdAtMillis, graduated, verified, false);
    }
}
