package admit.core.admission;

import admit.core.collision.IdentityRegistration;

/**
 * Write side of the external identity registry. The authoritative uniqueness check
 * lives here, not in the collision guard.
 */
public interface IdentityWriter {

    /**
     * @throws IdentityTakenException if the registry's uniqueness constraint rejects the insert
     * @throws admit.core.model.StoreUnavailableException if the registry cannot be reached
     */
    void insert(IdentityRegistration registration) throws IdentityTakenException;

    /**
     * Flags the subject's registration as graduated, locking its identity for good.
     *
     * @return false if no registration exists for {@code subject}
     */
    boolean markGraduated(String subject);

    /**
     * Flags the subject's registration as verified, so it is never queued again.
     *
     * @return false if no registration exists for {@code subject}
     */
    boolean markVerified(String subject);
}
