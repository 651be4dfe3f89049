package admit.core.verification;

import java.util.List;

/**
 * Score-ordered set of subjects waiting for verification, shared with an
 * out-of-process drain worker.
 *
 * Implementations throw {@link admit.core.model.StoreUnavailableException} when unreachable.
 */
public interface PendingSetStore {

    /**
     * Adds {@code member} with {@code score} unless it is already present.
     * Must be one atomic operation: of two concurrent calls for the same member,
     * exactly one returns true. An existing member keeps its original score.
     *
     * @return true if the member was inserted
     */
    boolean insertIfAbsent(String member, double score);

    long size();

    /**
     * Drain side: removes and returns up to {@code max} members, lowest score first.
     */
    List<String> popOldest(int max);
}
