package com.zerarate.rate;

import com.zerarate.common.InstrumentIds;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

/**
 * Construction-time configuration of a {@link RateResolver}.
 *
 * @param cacheTtl          how long a live-source rate is served from cache
 * @param fallbackRates     static rates used when every live source fails
 * @param minimumRates      per-instrument floors applied to every returned rate
 * @param safeguardsEnabled whether minimum rates are enforced
 */
public record RateResolverSettings(
        Duration cacheTtl,
        Map<String, BigDecimal> fallbackRates,
        Map<String, BigDecimal> minimumRates,
        boolean safeguardsEnabled) {

    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(3000);
    public static final BigDecimal DEFAULT_NATIVE_RATE = new BigDecimal("0.10");

    public RateResolverSettings {
        cacheTtl = cacheTtl == null ? DEFAULT_CACHE_TTL : cacheTtl;
        fallbackRates = fallbackRates == null ? Map.of() : fallbackRates;
        minimumRates = minimumRates == null ? Map.of() : minimumRates;
    }

    /**
     * TTL 3000 ms, fallback and minimum of 0.10 USD for the native fee instrument, safeguards on.
     */
    public static RateResolverSettings defaults() {
        return new RateResolverSettings(
                DEFAULT_CACHE_TTL,
                Map.of(InstrumentIds.NATIVE_FEE_INSTRUMENT, DEFAULT_NATIVE_RATE),
                Map.of(InstrumentIds.NATIVE_FEE_INSTRUMENT, DEFAULT_NATIVE_RATE),
                true);
    }
}
