package com.blissfly.proxy.core.cache;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import com.blissfly.proxy.config.CacheConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded, TTL-based store of decoded upstream responses.
 * <p>
 * Bounds are enforced on insertion: while a new entry would push the store past
 * {@code maxSize} entries or {@code maxMemory} bytes, a batch of the least recently
 * accessed entries (about 10%, at least one) is evicted. Expired entries are removed
 * lazily on lookup and by a periodic sweep that also drops entries nobody ever read.
 * <p>
 * All state is guarded by the instance monitor. No I/O happens while it is held.
 */
public class ResponseCache implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private static final Comparator<CacheEntry> LEAST_RECENTLY_ACCESSED = Comparator
            .comparingLong(CacheEntry::getLastAccessedAt)
            .thenComparingLong(CacheEntry::getAccessSequence);

    private final Map<String, CacheEntry> entries = new HashMap<>();
    private final Clock clock;
    private final int maxSize;
    private final long maxMemory;
    private final long defaultTtlMs;
    private final double evictionRatio;
    private final long sweepIntervalMs;
    private final SizingMode sizingMode;

    private long memoryBytes;
    private long sequence;
    private long hits;
    private long misses;
    private long evictions;
    private long totalRequests;

    private ScheduledExecutorService sweeper;

    /**
     * Creates a cache using the system clock.
     *
     * @param config Cache bounds.
     */
    public ResponseCache(CacheConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * Creates a cache reading time from the given clock.
     *
     * @param config Cache bounds.
     * @param clock  Time source for expiry and access tracking.
     */
    public ResponseCache(CacheConfig config, Clock clock) {
        this.clock = clock;
        this.maxSize = Math.max(1, config.getMaxSize());
        this.maxMemory = config.getMaxMemory();
        this.defaultTtlMs = config.getTtl();
        this.evictionRatio = config.getEvictionRatio() > 0 ? config.getEvictionRatio() : 0.1;
        this.sweepIntervalMs = config.getSweepInterval();
        this.sizingMode = SizingMode.fromConfig(config.getSizingMode());
    }

    /**
     * Starts the periodic sweep on a daemon thread. Calling it twice has no effect.
     */
    public synchronized void startSweeper() {
        if (sweeper != null || sweepIntervalMs <= 0) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-sweeper");
            t.setDaemon(true);
            return t;
        });
        sweeper.scheduleAtFixedRate(() -> {
            int removed = sweep();
            if (removed > 0) {
                log.debug("Cache sweep removed {} entries", removed);
            }
        }, sweepIntervalMs, sweepIntervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Stores a value with the default TTL.
     *
     * @param key   Cache key, normalized internally.
     * @param value Response to store.
     */
    public void set(String key, CachedResponse value) {
        set(key, value, Duration.ofMillis(defaultTtlMs));
    }

    /**
     * Stores a value, evicting least recently accessed entries until it fits.
     * A value larger than {@code maxMemory} on its own is not stored.
     *
     * @param key   Cache key, normalized internally.
     * @param value Response to store.
     * @param ttl   Time to live of this entry.
     */
    public synchronized void set(String key, CachedResponse value, Duration ttl) {
        String normalized = normalizeKey(key);
        long size = sizingMode.sizeOf(normalized, value);
        if (size > maxMemory) {
            log.debug("Not caching {}: {} bytes exceeds the memory bound", normalized, size);
            return;
        }

        CacheEntry previous = entries.remove(normalized);
        if (previous != null) {
            memoryBytes -= previous.getSizeBytes();
        }

        while (!entries.isEmpty() && (entries.size() >= maxSize || memoryBytes + size > maxMemory)) {
            evictBatch();
        }

        long now = clock.millis();
        entries.put(normalized, new CacheEntry(normalized, value, now, ttl.toMillis(), size, ++sequence));
        memoryBytes += size;
    }

    /**
     * Looks up a live entry, recording a hit or a miss.
     *
     * @param key Cache key, normalized internally.
     * @return The stored response, or empty if absent or expired.
     */
    public synchronized Optional<CachedResponse> get(String key) {
        totalRequests++;
        String normalized = normalizeKey(key);
        CacheEntry entry = entries.get(normalized);
        long now = clock.millis();
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        if (entry.isExpired(now)) {
            removeEntry(entry);
            evictions++;
            misses++;
            return Optional.empty();
        }
        entry.touch(now, ++sequence);
        hits++;
        return Optional.of(entry.getValue());
    }

    /**
     * Removes entries that are expired or have never been read since insertion.
     *
     * @return Number of removed entries.
     */
    public synchronized int sweep() {
        long now = clock.millis();
        int removed = 0;
        Iterator<CacheEntry> it = entries.values().iterator();
        while (it.hasNext()) {
            CacheEntry entry = it.next();
            if (entry.isExpired(now) || entry.getAccessCount() == 0) {
                it.remove();
                memoryBytes -= entry.getSizeBytes();
                removed++;
            }
        }
        evictions += removed;
        return removed;
    }

    /**
     * @return A snapshot of counters and occupancy.
     */
    public synchronized CacheStats getStats() {
        double hitRate = totalRequests == 0 ? 0.0 : (double) hits / totalRequests;
        double evictionRate = totalRequests == 0 ? 0.0 : (double) evictions / totalRequests;
        return new CacheStats(hits, misses, evictions, totalRequests, entries.size(), memoryBytes,
                hitRate, evictionRate);
    }

    /**
     * @return Number of stored entries, expired ones included until they are collected.
     */
    public synchronized int size() {
        return entries.size();
    }

    /**
     * @return Accounted size of stored entries in bytes.
     */
    public synchronized long memoryBytes() {
        return memoryBytes;
    }

    /**
     * Drops every entry. Counters are kept.
     */
    public synchronized void clear() {
        entries.clear();
        memoryBytes = 0;
    }

    /**
     * Stops the background sweep.
     */
    @Override
    public synchronized void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
        }
    }

    /**
     * Normalizes a URL into a cache key: lowercase scheme and host, default port, empty
     * path and fragment removed, dot segments resolved. Values that are not URLs are used
     * verbatim.
     *
     * @param url The URL or key.
     * @return The normalized key.
     */
    public static String normalizeKey(String url) {
        if (url == null) {
            throw new IllegalArgumentException("cache key must not be null");
        }
        try {
            URI uri = new URI(url).normalize();
            if (!uri.isAbsolute() || uri.isOpaque() || uri.getHost() == null) {
                return url;
            }
            String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
            int port = uri.getPort();
            if (("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443)) {
                port = -1;
            }
            String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
            StringBuilder sb = new StringBuilder(url.length());
            sb.append(scheme).append("://");
            if (uri.getRawUserInfo() != null) {
                sb.append(uri.getRawUserInfo()).append('@');
            }
            sb.append(uri.getHost().toLowerCase(Locale.ROOT));
            if (port != -1) {
                sb.append(':').append(port);
            }
            sb.append(path);
            if (uri.getRawQuery() != null) {
                sb.append('?').append(uri.getRawQuery());
            }
            return sb.toString();
        } catch (URISyntaxException e) {
            return url;
        }
    }

    private void evictBatch() {
        int batch = Math.max(1, (int) Math.round(entries.size() * evictionRatio));
        List<CacheEntry> ordered = new ArrayList<>(entries.values());
        ordered.sort(LEAST_RECENTLY_ACCESSED);
        for (int i = 0; i < batch && i < ordered.size(); i++) {
            removeEntry(ordered.get(i));
            evictions++;
        }
        log.debug("Evicted {} cache entries ({} remain)", Math.min(batch, ordered.size()), entries.size());
    }

    private void removeEntry(CacheEntry entry) {
        if (entries.remove(entry.getKey()) != null) {
            memoryBytes -= entry.getSizeBytes();
        }
    }
}
