package admit.java.store;

import admit.core.admission.IdentityTakenException;
import admit.core.admission.IdentityWriter;
import admit.core.collision.IdentityQuery;
import admit.core.collision.IdentityRegistration;
import admit.core.collision.IdentityRegistry;

import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-local identity registry for the standalone server and for tests.
 *
 * Subjects are unique: insert() is a putIfAbsent on the subject. Names and symbols
 * are not unique; when several active registrations match a query, a graduated one
 * wins, then the most recently created.
 */
public final class InMemoryIdentityRegistry implements IdentityRegistry, IdentityWriter {

    private static final Comparator<IdentityRegistration> MOST_RESTRICTIVE =
        Comparator.comparing(IdentityRegistration::graduated)
            .thenComparingLong(IdentityRegistration::createdAtMillis);

    private final ConcurrentHashMap<String, IdentityRegistration> bySubject = new ConcurrentHashMap<>();

    @Override
    public Optional<IdentityRegistration> findActive(IdentityQuery query) {
        return bySubject.values().stream()
            .filter(IdentityRegistration::active)
            .filter(query::matches)
            .max(MOST_RESTRICTIVE);
    }

    @Override
    public Optional<IdentityRegistration> findBySubject(String subject) {
        return Optional.ofNullable(bySubject.get(subject));
    }

    @Override
    public void insert(IdentityRegistration registration) throws IdentityTakenException {
        if (bySubject.putIfAbsent(registration.subject(), registration) != null) {
            throw new IdentityTakenException(registration.subject());
        }
    }

    @Override
    public boolean markGraduated(String subject) {
        return update(subject, IdentityRegistration::graduate);
    }

    @Override
    public boolean markVerified(String subject) {
        return update(subject, IdentityRegistration::verify);
    }

    public boolean retire(String subject) {
        return update(subject, IdentityRegistration::retire);
    }

    public int size() {
        return bySubject.size();
    }

    private boolean update(String subject, UnaryOperator<IdentityRegistration> change) {
        return bySubject.computeIfPresent(subject, (key, current) -> change.apply(current)) != null;
    }
}
