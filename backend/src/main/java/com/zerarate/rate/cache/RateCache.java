package com.zerarate.rate.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.zerarate.domain.RateSource;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * In-memory rate cache keyed by instrument identifier.
 * <p>
 * The Caffeine store is unbounded and has no expiry policy: entries are never evicted, staleness is
 * judged at read time against the TTL so expired entries remain visible in {@link #snapshot()}.
 * Each put replaces the whole entry; concurrent writers to one key resolve to last writer wins.
 */
public class RateCache {

    private final Cache<String, RateCacheEntry> store = Caffeine.newBuilder().build();
    private final Duration ttl;
    private final Clock clock;

    public RateCache(Duration ttl, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive");
        }
        this.ttl = ttl;
        this.clock = clock;
    }

    public Optional<RateCacheEntry> get(String instrumentId) {
        return Optional.ofNullable(store.getIfPresent(instrumentId));
    }

    /**
     * Fresh entry for the identifier, or empty when absent or stale.
     */
    public Optional<RateCacheEntry> getFresh(String instrumentId) {
        return get(instrumentId).filter(this::isFresh);
    }

    public void put(String instrumentId, BigDecimal rate, RateSource source) {
        store.put(instrumentId, new RateCacheEntry(rate, clock.instant(), source));
    }

    public boolean isFresh(RateCacheEntry entry) {
        return age(entry).compareTo(ttl) < 0;
    }

    public void clear() {
        store.invalidateAll();
    }

    public int size() {
        return store.asMap().size();
    }

    public Duration getTtl() {
        return ttl;
    }

    public List<CacheEntrySnapshot> snapshot() {
        Instant now = clock.instant();
        return store.asMap().entrySet().stream()
                .map(e -> {
                    Duration age = Duration.between(e.getValue().timestamp(), now);
                    return new CacheEntrySnapshot(
                            e.getKey(),
                            e.getValue().rate(),
                            age.toMillis(),
                            age.compareTo(ttl) >= 0,
                            e.getValue().source());
                })
                .sorted(Comparator.comparing(CacheEntrySnapshot::instrumentId))
                .toList();
    }

    public RateCacheInfo info() {
        List<CacheEntrySnapshot> entries = snapshot();
        return new RateCacheInfo(entries.size(), ttl.toMillis(), entries);
    }

    private Duration age(RateCacheEntry entry) {
        return Duration.between(entry.timestamp(), clock.instant());
    }
}
