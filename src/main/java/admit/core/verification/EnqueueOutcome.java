package admit.core.verification;

public enum EnqueueOutcome {
    ENQUEUED,
    SKIPPED_ALREADY_VERIFIED,
    SKIPPED_ALREADY_QUEUED
}
