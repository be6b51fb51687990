package com.zerarate.rate.cache;

import java.util.List;

/**
 * Cache diagnostics: entry count, configured TTL and per-entry snapshots.
 */
public record RateCacheInfo(int size, long ttlMs, List<CacheEntrySnapshot> entries) {}
