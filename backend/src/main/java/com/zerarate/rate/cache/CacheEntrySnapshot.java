package com.zerarate.rate.cache;

import com.zerarate.domain.RateSource;

import java.math.BigDecimal;

/**
 * Diagnostic view of one cache entry. {@code expired} is {@code ageMs >= ttl}.
 */
public record CacheEntrySnapshot(String instrumentId, BigDecimal rate, long ageMs, boolean expired, RateSource source) {}
