package com.blissfly.proxy.core.cache;

/**
 * One slot of the {@link ResponseCache}. Mutated only while the cache monitor is held.
 */
final class CacheEntry {
    private final String key;
    private final CachedResponse value;
    private final long expiresAt;
    private final long sizeBytes;
    private long lastAccessedAt;
    private long accessSequence;
    private int accessCount;

    CacheEntry(String key, CachedResponse value, long createdAt, long ttlMs, long sizeBytes, long sequence) {
        this.key = key;
        this.value = value;
        this.expiresAt = createdAt + ttlMs;
        this.sizeBytes = sizeBytes;
        this.lastAccessedAt = createdAt;
        this.accessSequence = sequence;
    }

    boolean isExpired(long now) {
        return now > expiresAt;
    }

    void touch(long now, long sequence) {
        lastAccessedAt = now;
        accessSequence = sequence;
        accessCount++;
    }

    String getKey() {
        return key;
    }

    CachedResponse getValue() {
        return value;
    }

    long getLastAccessedAt() {
        return lastAccessedAt;
    }

    /** Tie-breaker for entries touched within the same clock tick. */
    long getAccessSequence() {
        return accessSequence;
    }

    int getAccessCount() {
        return accessCount;
    }

    long getSizeBytes() {
        return sizeBytes;
    }
}
