package admit.core.admission;

import admit.core.collision.LockState;
import admit.core.model.RateLimitResult;

/**
 * @param outcome overall answer
 * @param rateLimit rate-limit result, null for persistence outcomes
 * @param lockState guard result, null when the request was rate limited or persisted
 */
public record RegistrationDecision(RegistrationOutcome outcome, RateLimitResult rateLimit, LockState lockState) {

    static RegistrationDecision rateLimited(RateLimitResult rateLimit) {
        return new RegistrationDecision(RegistrationOutcome.RATE_LIMITED, rateLimit, null);
    }

    static RegistrationDecision locked(RateLimitResult rateLimit, LockState lockState) {
        return new RegistrationDecision(RegistrationOutcome.IDENTITY_LOCKED, rateLimit, lockState);
    }

    static RegistrationDecision admitted(RateLimitResult rateLimit, LockState lockState) {
        return new RegistrationDecision(RegistrationOutcome.ADMITTED, rateLimit, lockState);
    }

    static RegistrationDecision recorded() {
        return new RegistrationDecision(RegistrationOutcome.RECORDED, null, null);
    }

    static RegistrationDecision taken() {
        return new RegistrationDecision(RegistrationOutcome.IDENTITY_TAKEN, null, null);
    }

    public boolean proceed() {
        return outcome == RegistrationOutcome.ADMITTED || outcome == RegistrationOutcome.RECORDED;
    }
}
