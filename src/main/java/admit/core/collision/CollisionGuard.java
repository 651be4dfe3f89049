package admit.core.collision;

import admit.core.clock.Clock;
import admit.core.model.StoreUnavailableException;

import java.util.Optional;

/**
 * Copycat deterrence for token identities.
 *
 * Advisory only: one registry lookup, no writes. The persistence layer must still
 * enforce uniqueness when the caller inserts, since two registrations of the same
 * identity can both pass evaluate() before either is stored.
 *
 * Classification of the matching registration, in order:
 * <ol>
 *   <li>none: UNLOCKED</li>
 *   <li>graduated: LOCKED_GRADUATED, whatever its age</li>
 *   <li>younger than the deterrence window: LOCKED_RECENT</li>
 *   <li>otherwise UNLOCKED; the lock lapses on its own</li>
 * </ol>
 */
public final class CollisionGuard {

    private final Clock clock;
    private final IdentityRegistry registry;
    private final IdentityRules rules;

    public CollisionGuard(Clock clock, IdentityRegistry registry, IdentityRules rules) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (registry == null) throw new IllegalArgumentException("registry cannot be null");
        if (rules == null) throw new IllegalArgumentException("rules cannot be null");
        this.clock = clock;
        this.registry = registry;
        this.rules = rules;
    }

    /**
     * @param name proposed token name
     * @param symbol proposed symbol, or null/blank for name-only matching
     * @throws admit.core.model.ValidationException if the name or symbol is rejected
     * @throws StoreUnavailableException if the registry lookup fails
     */
    public LockState evaluate(String name, String symbol) {
        return evaluate(normalize(name, symbol));
    }

    public LockState evaluate(IdentityQuery query) {
        Optional<IdentityRegistration> match = lookup(query);
        if (match.isEmpty()) {
            return LockState.unlocked();
        }

        IdentityRegistration registration = match.get();
        if (registration.graduated()) {
            return LockState.lockedGraduated();
        }

        // a createdAt ahead of our clock counts as brand new
        long age = Math.max(0L, clock.nowMillis() - registration.createdAtMillis());
        if (age < rules.deterrenceWindowMillis()) {
            return LockState.lockedRecent(rules.deterrenceWindowMillis() - age);
        }
        return LockState.unlocked();
    }

    public IdentityQuery normalize(String name, String symbol) {
        return IdentityQuery.normalize(name, symbol, rules);
    }

    public IdentityRules rules() {
        return rules;
    }

    private Optional<IdentityRegistration> lookup(IdentityQuery query) {
        try {
            return registry.findActive(query);
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("identity registry lookup failed", e);
        }
    }
}
