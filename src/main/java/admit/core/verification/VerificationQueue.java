package admit.core.verification;

import admit.core.clock.Clock;
import admit.core.collision.IdentityRegistration;
import admit.core.collision.IdentityRegistry;
import admit.core.model.ReasonCode;
import admit.core.model.StoreUnavailableException;
import admit.core.model.Subjects;
import admit.core.model.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Schedules at most one pending verification job per subject.
 *
 * <p>enqueue() order:
 * <ol>
 *   <li>registry says the subject is verified: skip, without touching the pending set</li>
 *   <li>otherwise insert-if-absent into the pending set, scored by the current time</li>
 *   <li>lost the insert (already pending): skip; won it: enqueued</li>
 * </ol>
 *
 * <p>enqueue() never removes entries; {@link #drain} is the only removal path and
 * belongs to the verification worker. The queue watches depth and logs a warning
 * when it climbs past the configured threshold, which means the worker has stalled.
 */
public final class VerificationQueue {

    private static final Logger log = LoggerFactory.getLogger(VerificationQueue.class);

    public static final long DEFAULT_DEPTH_WARNING_THRESHOLD = 1000L;
    static final int MAX_SUBJECT_LENGTH = Subjects.MAX_LENGTH;
    /** Upper bound on one drain batch. */
    public static final int MAX_DRAIN_BATCH = 500;

    private final Clock clock;
    private final IdentityRegistry registry;
    private final PendingSetStore pending;
    private final long depthWarningThreshold;
    private final AtomicBoolean backlogged = new AtomicBoolean(false);

    public VerificationQueue(Clock clock, IdentityRegistry registry, PendingSetStore pending,
                             long depthWarningThreshold) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (registry == null) throw new IllegalArgumentException("registry cannot be null");
        if (pending == null) throw new IllegalArgumentException("pending cannot be null");
        if (depthWarningThreshold <= 0) throw new IllegalArgumentException("depthWarningThreshold must be > 0");
        this.clock = clock;
        this.registry = registry;
        this.pending = pending;
        this.depthWarningThreshold = depthWarningThreshold;
    }

    /**
     * @param subject token identifier; trimmed, case preserved
     * @throws ValidationException if the subject is blank or too long
     * @throws StoreUnavailableException if the registry or the pending set fails
     *         before the outcome is known
     */
    public EnqueueResult enqueue(String subject) {
        String normalized = Subjects.normalize(subject);

        if (alreadyVerified(normalized)) {
            return EnqueueResult.alreadyVerified();
        }

        boolean inserted;
        try {
            inserted = pending.insertIfAbsent(normalized, clock.nowMillis());
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("pending set insert failed", e);
        }

        long depth = readDepthAfterWrite();
        if (inserted) {
            log.debug("Queued {} for verification (depth {})", normalized, depth);
            return EnqueueResult.enqueued(depth);
        }
        return EnqueueResult.alreadyQueued(depth);
    }

    /**
     * Removes and returns up to {@code max} subjects, oldest first. A drained subject
     * can be enqueued again, so a worker that fails verification simply re-enqueues it.
     *
     * @param max batch size, 1 to {@value #MAX_DRAIN_BATCH}
     * @throws ValidationException if {@code max} is out of range
     * @throws StoreUnavailableException if the pending set fails
     */
    public List<String> drain(int max) {
        if (max <= 0 || max > MAX_DRAIN_BATCH) {
            throw new ValidationException(ReasonCode.BATCH_SIZE_INVALID,
                "max must be between 1 and " + MAX_DRAIN_BATCH + ", got " + max);
        }
        List<String> drained;
        try {
            drained = pending.popOldest(max);
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("pending set drain failed", e);
        }
        long depth = readDepthAfterWrite();
        log.debug("Drained {} subjects for verification (depth {})", drained.size(), depth);
        return drained;
    }

    /**
     * Current pending-set size; also feeds the backlog warning.
     *
     * @throws StoreUnavailableException if the pending set cannot be read
     */
    public long depth() {
        long depth;
        try {
            depth = pending.size();
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("pending set size failed", e);
        }
        observeDepth(depth);
        return depth;
    }

    /**
     * True while the last observed depth was above the warning threshold.
     */
    public boolean isBacklogged() {
        return backlogged.get();
    }

    public long depthWarningThreshold() {
        return depthWarningThreshold;
    }

    private boolean alreadyVerified(String subject) {
        Optional<IdentityRegistration> registration;
        try {
            registration = registry.findBySubject(subject);
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("identity registry lookup failed", e);
        }
        return registration.map(IdentityRegistration::verified).orElse(false);
    }

    // The write already happened; a failed size read must not turn it into an error.
    private long readDepthAfterWrite() {
        try {
            long depth = pending.size();
            observeDepth(depth);
            return depth;
        } catch (RuntimeException e) {
            log.warn("Could not read verification queue depth", e);
            return EnqueueResult.UNKNOWN_DEPTH;
        }
    }

    private void observeDepth(long depth) {
        if (depth > depthWarningThreshold) {
            if (backlogged.compareAndSet(false, true)) {
                log.warn("Verification queue depth {} exceeds warning threshold {}; drain worker may be stalled",
                    depth, depthWarningThreshold);
            }
        } else if (backlogged.compareAndSet(true, false)) {
            log.info("Verification queue depth {} back within threshold {}", depth, depthWarningThreshold);
        }
    }
}
