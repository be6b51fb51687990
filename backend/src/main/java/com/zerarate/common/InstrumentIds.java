package com.zerarate.common;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for instrument identifiers such as {@code $ZRA+0000}.
 * Identifiers are opaque strings everywhere except symbol-family derivation.
 */
public final class InstrumentIds {

    /** Native fee instrument; also the symbol-family key of ZRA. */
    public static final String NATIVE_FEE_INSTRUMENT = "$ZRA+0000";

    private static final String FAMILY_SUFFIX = "0000";
    private static final Pattern CANONICAL = Pattern.compile("^\\$([A-Za-z]+)\\+(\\d{4})$");

    private InstrumentIds() {}

    /**
     * Returns the identifier unchanged if non-blank.
     *
     * @throws IllegalArgumentException when null or blank
     */
    public static String requireValid(String instrumentId) {
        if (instrumentId == null || instrumentId.isBlank()) {
            throw new IllegalArgumentException("Instrument identifier must be a non-empty string");
        }
        return instrumentId;
    }

    /**
     * Currency symbol of a canonical identifier ({@code $ZRA+0042} -> {@code ZRA}).
     */
    public static Optional<String> symbol(String instrumentId) {
        if (instrumentId == null) {
            return Optional.empty();
        }
        Matcher m = CANONICAL.matcher(instrumentId);
        return m.matches() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /**
     * Symbol-family key of a canonical identifier ({@code $ZRA+0042} -> {@code $ZRA+0000}).
     * Empty when the identifier does not follow {@code $<letters>+<4 digits>}.
     */
    public static Optional<String> symbolFamilyKey(String instrumentId) {
        return symbol(instrumentId).map(s -> "$" + s + "+" + FAMILY_SUFFIX);
    }
}
