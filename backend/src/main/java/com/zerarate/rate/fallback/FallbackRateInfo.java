package com.zerarate.rate.fallback;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Static fallback rate with the match strategy and the table key that produced it.
 */
public record FallbackRateInfo(
        BigDecimal rate,
        @JsonProperty("source") FallbackMatchType matchType,
        String sourceKey) {}
