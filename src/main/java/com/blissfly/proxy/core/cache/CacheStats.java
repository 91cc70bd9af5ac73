package com.blissfly.proxy.core.cache;

/**
 * Point-in-time snapshot of cache counters.
 *
 * @param hits          Lookups served from the cache.
 * @param misses        Lookups that found nothing live.
 * @param evictions     Entries removed by expiry, sweep or batch eviction.
 * @param totalRequests All lookups.
 * @param size          Live entries.
 * @param memoryBytes   Accounted size of live entries.
 * @param hitRate       hits / totalRequests, 0 when there were no lookups.
 * @param evictionRate  evictions / totalRequests, 0 when there were no lookups.
 */
public record CacheStats(long hits, long misses, long evictions, long totalRequests,
        int size, long memoryBytes, double hitRate, double evictionRate) {
}
