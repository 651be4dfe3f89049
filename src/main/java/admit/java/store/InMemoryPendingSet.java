package admit.java.store;

import admit.core.verification.PendingSetStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Process-local sorted set with insert-if-absent semantics.
 *
 * Design:
 * - a member index (HashMap) for O(1) membership
 * - a TreeSet ordered by (score, member) for oldest-first draining
 * - all operations synchronized, so the membership test and the insert are one step
 */
public final class InMemoryPendingSet implements PendingSetStore {

    private record Entry(double score, String member) {}

    private static final Comparator<Entry> BY_SCORE =
        Comparator.comparingDouble(Entry::score).thenComparing(Entry::member);

    private final Map<String, Entry> members = new HashMap<>();
    private final TreeSet<Entry> ordered = new TreeSet<>(BY_SCORE);

    @Override
    public synchronized boolean insertIfAbsent(String member, double score) {
        if (member == null) throw new IllegalArgumentException("member cannot be null");
        if (members.containsKey(member)) {
            return false;
        }
        Entry entry = new Entry(score, member);
        members.put(member, entry);
        ordered.add(entry);
        return true;
    }

    @Override
    public synchronized long size() {
        return members.size();
    }

    @Override
    public synchronized List<String> popOldest(int max) {
        if (max <= 0) throw new IllegalArgumentException("max must be > 0");
        List<String> popped = new ArrayList<>(Math.min(max, members.size()));
        Iterator<Entry> it = ordered.iterator();
        while (it.hasNext() && popped.size() < max) {
            Entry entry = it.next();
            it.remove();
            members.remove(entry.member());
            popped.add(entry.member());
        }
        return popped;
    }

    public synchronized boolean contains(String member) {
        return members.containsKey(member);
    }

    public synchronized Double scoreOf(String member) {
        Entry entry = members.get(member);
        return entry == null ? null : entry.score();
    }
}
