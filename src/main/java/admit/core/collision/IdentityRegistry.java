package admit.core.collision;

import java.util.Optional;

/**
 * Read side of the external identity registry.
 *
 * Implementations throw {@link admit.core.model.StoreUnavailableException} when the
 * registry cannot be reached; an empty result always means "no such record".
 */
public interface IdentityRegistry {

    /**
     * Zero-or-one active registration matching the query case-insensitively
     * (name and symbol, or name alone in name-only mode).
     */
    Optional<IdentityRegistration> findActive(IdentityQuery query);

    /**
     * The registration for an exact subject, active or not.
     */
    Optional<IdentityRegistration> findBySubject(String subject);
}
