package admit.core.model;

public enum Decision {
    ADMIT,
    REJECT
}
