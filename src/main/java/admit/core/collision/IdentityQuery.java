package admit.core.collision;

import admit.core.model.ReasonCode;
import admit.core.model.ValidationException;

import java.util.Locale;

/**
 * A validated, case-folded (name, symbol?) pair.
 *
 * @param name trimmed name as the caller typed it, for messages
 * @param nameKey lower-cased name used for matching
 * @param symbol trimmed, upper-cased symbol, or null for name-only matching
 * @param displaySymbol trimmed symbol as the caller typed it, or null
 */
public record IdentityQuery(String name, String nameKey, String symbol, String displaySymbol) {

    public static IdentityQuery normalize(String rawName, String rawSymbol, IdentityRules rules) {
        String name = rawName == null ? "" : rawName.trim();
        if (name.isEmpty()) {
            throw new ValidationException(ReasonCode.NAME_REQUIRED, "Token name is required");
        }
        if (name.length() < rules.minNameLength()) {
            throw new ValidationException(ReasonCode.NAME_TOO_SHORT,
                "Token name must be at least " + rules.minNameLength() + " characters long");
        }
        if (name.length() > rules.maxNameLength()) {
            throw new ValidationException(ReasonCode.NAME_TOO_LONG,
                "Token name must be at most " + rules.maxNameLength() + " characters long");
        }

        String symbol = rawSymbol == null ? "" : rawSymbol.trim();
        if (symbol.length() > rules.maxSymbolLength()) {
            throw new ValidationException(ReasonCode.SYMBOL_TOO_LONG,
                "Token symbol must be at most " + rules.maxSymbolLength() + " characters long");
        }

        return new IdentityQuery(
            name,
            name.toLowerCase(Locale.ROOT),
            symbol.isEmpty() ? null : symbol.toUpperCase(Locale.ROOT),
            symbol.isEmpty() ? null : symbol
        );
    }

    /**
     * Name-only mode, kept for older callers that do not send a symbol.
     */
    public boolean nameOnly() {
        return symbol == null;
    }

    /**
     * Case-insensitive match against a registration: both fields when a symbol
     * was given, the name alone otherwise.
     */
    public boolean matches(IdentityRegistration registration) {
        if (!registration.name().trim().equalsIgnoreCase(name)) {
            return false;
        }
        return nameOnly()
            || (registration.symbol() != null && registration.symbol().trim().equalsIgnoreCase(symbol));
    }
}
