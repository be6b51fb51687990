package com.zerarate.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Provenance of a resolved rate. Priority when resolving: INDEXER &gt; VALIDATOR &gt; FALLBACK.
 * Carried for observability only; never changes resolution once a rate is obtained.
 */
public enum RateSource {
    VALIDATOR("validator"),
    INDEXER("indexer"),
    FALLBACK("fallback");

    private final String tag;

    RateSource(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    /**
     * Parses a tag ("validator", "indexer", "fallback") or enum name, case-insensitive.
     *
     * @throws IllegalArgumentException for unknown tags
     */
    @JsonCreator
    public static RateSource fromTag(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Rate source must be a non-empty string");
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (RateSource source : values()) {
            if (source.tag.equals(normalized)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown rate source: " + value);
    }

    /**
     * True for sources that can push rates from outside the resolver (streaming feeds).
     */
    public boolean isLive() {
        return this != FALLBACK;
    }
}
