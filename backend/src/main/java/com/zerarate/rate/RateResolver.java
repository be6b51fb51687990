package com.zerarate.rate;

import com.zerarate.common.Amounts;
import com.zerarate.common.InstrumentIds;
import com.zerarate.domain.RateSource;
import com.zerarate.rate.cache.RateCache;
import com.zerarate.rate.cache.RateCacheEntry;
import com.zerarate.rate.cache.RateCacheInfo;
import com.zerarate.rate.fallback.FallbackRateInfo;
import com.zerarate.rate.fallback.FallbackRateTable;
import com.zerarate.rate.safeguard.MinimumRateSafeguard;
import com.zerarate.rate.source.RateSourceAdapter;
import com.zerarate.rate.source.SourceOutcome;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves USD per unit of an instrument. Chain: cache → live sources in order → fallback table,
 * with the minimum-rate safeguard applied to every returned value.
 * <p>
 * Live-source hits are cached; fallback hits are not, so every call after a degraded one retries
 * the live sources. Concurrent misses for one key each query the sources; last write wins.
 */
@Slf4j
public class RateResolver {

    private final RateCache cache;
    private final FallbackRateTable fallbackTable;
    private final MinimumRateSafeguard safeguard;
    private final List<RateSourceAdapter> sources;

    public RateResolver(RateResolverSettings settings, List<RateSourceAdapter> sources, Clock clock) {
        this.cache = new RateCache(settings.cacheTtl(), clock);
        this.fallbackTable = new FallbackRateTable(settings.fallbackRates());
        this.safeguard = new MinimumRateSafeguard(settings.minimumRates(), settings.safeguardsEnabled());
        this.sources = List.copyOf(sources);
    }

    public RateResolver(RateResolverSettings settings, List<RateSourceAdapter> sources) {
        this(settings, sources, Clock.systemUTC());
    }

    public BigDecimal resolve(String instrumentId) {
        return resolve(instrumentId, true);
    }

    /**
     * Resolve the rate for an instrument.
     *
     * @param useCache when false the cache is not read (a live hit is still written)
     * @throws IllegalArgumentException  for a blank identifier
     * @throws RateResolutionException when no live source succeeds and no fallback entry exists
     */
    public BigDecimal resolve(String instrumentId, boolean useCache) {
        String id = InstrumentIds.requireValid(instrumentId);
        if (useCache) {
            Optional<RateCacheEntry> cached = cache.getFresh(id);
            if (cached.isPresent()) {
                log.debug("Cache hit for {} ({})", id, cached.get().source().tag());
                return safeguard.enforce(cached.get().rate(), id);
            }
        }

        List<SourceOutcome> outcomes = new ArrayList<>();
        for (RateSourceAdapter adapter : sources) {
            SourceOutcome outcome = attempt(adapter, id);
            outcomes.add(outcome);
            if (outcome.isResolved()) {
                break;
            }
        }

        ChainDecision decision = RateResolutionChain.decide(outcomes, () -> fallbackTable.lookup(id));
        return switch (decision.getKind()) {
            case LIVE -> {
                SourceOutcome live = decision.getLiveOutcome();
                BigDecimal rate = live.getRate().orElseThrow();
                cache.put(id, rate, live.getSource());
                yield safeguard.enforce(rate, id);
            }
            case FALLBACK -> {
                FallbackRateInfo info = decision.getFallback();
                BigDecimal enforced = safeguard.enforce(info.rate(), id);
                log.warn("All rate sources failed for \"{}\" ({}). Using fallback rate: {} USD per {} (source: {})",
                        id,
                        RateResolutionChain.describeFailures(decision.getFailures()),
                        enforced.toPlainString(),
                        id,
                        info.matchType().describe(info.sourceKey()));
                yield enforced;
            }
            case EXHAUSTED -> throw new RateResolutionException(id,
                    "No exchange rate available for \"" + id + "\" from any source ("
                            + RateResolutionChain.describeFailures(decision.getFailures())
                            + ") and no fallback rate configured. Please add a fallback rate for this instrument.");
        };
    }

    /**
     * Accept a rate pushed by an external feed. A fresh cached rate wins over the submission.
     *
     * @return the enforced rate now in effect for the instrument
     */
    public BigDecimal submitExternalRate(String instrumentId, BigDecimal rate, RateSource source, boolean useCache) {
        String id = InstrumentIds.requireValid(instrumentId);
        Amounts.requireNonNegative(rate, "Rate");
        if (source == null || !source.isLive()) {
            throw new IllegalArgumentException("External rates must come from a live source, got " + source);
        }
        if (useCache) {
            Optional<RateCacheEntry> cached = cache.getFresh(id);
            if (cached.isPresent()) {
                log.debug("Discarding {} rate for {}: fresh cached rate present", source.tag(), id);
                return safeguard.enforce(cached.get().rate(), id);
            }
        }
        cache.put(id, rate, source);
        return safeguard.enforce(rate, id);
    }

    public BigDecimal submitExternalRate(String instrumentId, BigDecimal rate, RateSource source) {
        return submitExternalRate(instrumentId, rate, source, true);
    }

    /**
     * Fresh cached rates (enforced) for the given identifiers; stale or missing ones are omitted.
     *
     * @throws IllegalArgumentException when any identifier is null or blank
     */
    public Map<String, BigDecimal> cachedRates(Collection<String> instrumentIds) {
        List<String> ids = instrumentIds.stream().map(InstrumentIds::requireValid).toList();
        Map<String, BigDecimal> rates = new LinkedHashMap<>();
        for (String id : ids) {
            cache.getFresh(id).ifPresent(e -> rates.put(id, safeguard.enforce(e.rate(), id)));
        }
        return rates;
    }

    public Optional<FallbackRateInfo> getFallbackInfo(String instrumentId) {
        return fallbackTable.lookup(InstrumentIds.requireValid(instrumentId));
    }

    public void clearCache() {
        cache.clear();
    }

    public RateCacheInfo cacheSnapshot() {
        return cache.info();
    }

    public void updateFallbackRates(Map<String, BigDecimal> rates) {
        fallbackTable.merge(rates);
        log.info("Fallback rates updated: {}", rates.keySet());
    }

    public void updateMinimumRates(Map<String, BigDecimal> rates) {
        safeguard.merge(rates);
        log.info("Minimum rates updated: {}", rates.keySet());
    }

    public void setSafeguardsEnabled(boolean enabled) {
        safeguard.setEnabled(enabled);
        log.info("Rate safeguards {}", enabled ? "enabled" : "disabled");
    }

    public boolean isSafeguardsEnabled() {
        return safeguard.isEnabled();
    }

    public Duration getCacheTtl() {
        return cache.getTtl();
    }

    public List<RateSource> sourceOrder() {
        return sources.stream().map(RateSourceAdapter::source).toList();
    }

    private static SourceOutcome attempt(RateSourceAdapter adapter, String id) {
        SourceOutcome outcome;
        try {
            outcome = adapter.tryResolve(id);
        } catch (RuntimeException e) {
            outcome = SourceOutcome.failed(adapter.source(), e.getMessage());
        }
        if (outcome == null) {
            outcome = SourceOutcome.failed(adapter.source(), "no result");
        }
        if (!outcome.isResolved()) {
            log.warn("{} rate source failed for {}: {}",
                    outcome.getSource().tag(), id, outcome.getFailureReason());
        }
        return outcome;
    }
}
