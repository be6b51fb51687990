package com.zerarate.rate.fallback;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a fallback entry was found: literal identifier or the identifier's symbol family ({@code +0000}).
 */
public enum FallbackMatchType {
    EXACT_MATCH("exact_match"),
    SYMBOL_MATCH("symbol_match");

    private final String tag;

    FallbackMatchType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    /**
     * Human description used in degraded-resolution warnings.
     */
    public String describe(String sourceKey) {
        return switch (this) {
            case EXACT_MATCH -> "exact match for " + sourceKey;
            case SYMBOL_MATCH -> "symbol match using " + sourceKey;
        };
    }
}
