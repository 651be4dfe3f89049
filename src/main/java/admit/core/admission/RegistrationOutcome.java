package admit.core.admission;

public enum RegistrationOutcome {
    ADMITTED,
    RATE_LIMITED,
    IDENTITY_LOCKED,
    IDENTITY_TAKEN,
    RECORDED
}
