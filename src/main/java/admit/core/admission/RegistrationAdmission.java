package admit.core.admission;

import admit.core.collision.CollisionGuard;
import admit.core.collision.IdentityQuery;
import admit.core.collision.IdentityRegistration;
import admit.core.collision.LockState;
import admit.core.model.RateLimitResult;
import admit.core.model.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gate in front of token registration: rate limit the client first (cheap, no I/O),
 * then ask the collision guard. Persisting is the caller's call; {@link #record}
 * maps the registry's uniqueness violation to {@link RegistrationOutcome#IDENTITY_TAKEN}.
 */
public final class RegistrationAdmission {

    private static final Logger log = LoggerFactory.getLogger(RegistrationAdmission.class);

    private final RateLimiter rateLimiter;
    private final CollisionGuard guard;
    private final IdentityWriter writer;

    public RegistrationAdmission(RateLimiter rateLimiter, CollisionGuard guard, IdentityWriter writer) {
        if (rateLimiter == null) throw new IllegalArgumentException("rateLimiter cannot be null");
        if (guard == null) throw new IllegalArgumentException("guard cannot be null");
        if (writer == null) throw new IllegalArgumentException("writer cannot be null");
        this.rateLimiter = rateLimiter;
        this.guard = guard;
        this.writer = writer;
    }

    /**
     * @throws admit.core.model.ValidationException for a blank key or an invalid name/symbol
     * @throws admit.core.model.StoreUnavailableException if the registry lookup fails
     */
    public RegistrationDecision admit(String clientKey, String name, String symbol) {
        // malformed requests spend a permit too, so a client flooding bad names is throttled
        RateLimitResult rateLimit = rateLimiter.check(clientKey);
        if (!rateLimit.admitted()) {
            return RegistrationDecision.rateLimited(rateLimit);
        }

        IdentityQuery query = guard.normalize(name, symbol);
        LockState lockState = guard.evaluate(query);
        if (lockState.locked()) {
            return RegistrationDecision.locked(rateLimit, lockState);
        }
        return RegistrationDecision.admitted(rateLimit, lockState);
    }

    /**
     * Persists an admitted registration.
     *
     * @throws admit.core.model.StoreUnavailableException if the registry cannot be reached
     */
    public RegistrationDecision record(IdentityRegistration registration) {
        try {
            writer.insert(registration);
            return RegistrationDecision.recorded();
        } catch (IdentityTakenException e) {
            log.debug("Registration of {} lost the uniqueness race", e.subject());
            return RegistrationDecision.taken();
        }
    }
}
