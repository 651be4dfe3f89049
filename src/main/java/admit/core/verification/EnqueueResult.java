package admit.core.verification;

/**
 * @param outcome what happened to the subject
 * @param queueDepth pending-set size seen after the insert; -1 when the set was not
 *                   consulted (already verified) or its size could not be read
 */
public record EnqueueResult(EnqueueOutcome outcome, long queueDepth) {

    public static final long UNKNOWN_DEPTH = -1L;

    private static final EnqueueResult ALREADY_VERIFIED =
        new EnqueueResult(EnqueueOutcome.SKIPPED_ALREADY_VERIFIED, UNKNOWN_DEPTH);

    public static EnqueueResult enqueued(long depth) {
        return new EnqueueResult(EnqueueOutcome.ENQUEUED, depth);
    }

    public static EnqueueResult alreadyQueued(long depth) {
        return new EnqueueResult(EnqueueOutcome.SKIPPED_ALREADY_QUEUED, depth);
    }

    public static EnqueueResult alreadyVerified() {
        return ALREADY_VERIFIED;
    }

    public boolean queued() {
        return outcome == EnqueueOutcome.ENQUEUED;
    }

    public boolean hasQueueDepth() {
        return queueDepth >= 0;
    }
}
