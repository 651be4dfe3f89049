package admit.core.model;

/**
 * Validation shared by every operation keyed on a token subject.
 */
public final class Subjects {

    public static final int MAX_LENGTH = 128;

    private Subjects() {}

    /**
     * @return the subject trimmed, case preserved
     * @throws ValidationException if the subject is blank or longer than {@value #MAX_LENGTH}
     */
    public static String normalize(String subject) {
        String normalized = subject == null ? "" : subject.trim();
        if (normalized.isEmpty()) {
            throw new ValidationException(ReasonCode.SUBJECT_REQUIRED, "subject must not be empty");
        }
        if (normalized.length() > MAX_LENGTH) {
            throw new ValidationException(ReasonCode.SUBJECT_TOO_LONG,
                "subject must be at most " + MAX_LENGTH + " characters");
        }
        return normalized;
    }
}
