package admit.java.config;

/**
 * Malformed configuration, tagged with the dotted key it was found under.
 */
public final class ConfigException extends IllegalArgumentException {

    private final String key;

    public ConfigException(String key, String message) {
        super(key + ": " + message);
        this.key = key;
    }

    public ConfigException(String key, String message, Throwable cause) {
        super(key + ": " + message, cause);
        this.key = key;
    }

    /** Dotted key of the offending entry, or {@code "<root>"} for the document itself. */
    public String key() {
        return key;
    }
}
