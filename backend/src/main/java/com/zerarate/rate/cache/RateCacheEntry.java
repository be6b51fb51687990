package com.zerarate.rate.cache;

import com.zerarate.domain.RateSource;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Most recently resolved rate for one instrument. Replaced as a unit, never merged.
 */
public record RateCacheEntry(BigDecimal rate, Instant timestamp, RateSource source) {}
