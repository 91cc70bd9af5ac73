package com.blissfly.proxy.config;

/**
 * Response cache bounds and housekeeping.
 */
public class CacheConfig {
    private boolean enabled = true;

    /** Maximum number of live entries. */
    private int maxSize = 1000;

    /** Maximum accounted size of all live entries, in bytes. */
    private long maxMemory = 100L * 1024 * 1024;

    /** Default time-to-live in milliseconds. */
    private long ttl = 600_000;

    /** Interval of the background sweep in milliseconds. */
    private long sweepInterval = 300_000;

    /** Share of entries removed by one eviction batch. */
    private double evictionRatio = 0.1;

    /** EXACT or ESTIMATED; see {@code SizingMode}. */
    private String sizingMode = "EXACT";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public void setMaxSize(int maxSize) {
        this.maxSize = maxSize;
    }

    public long getMaxMemory() {
        return maxMemory;
    }

    public void setMaxMemory(long maxMemory) {
        this.maxMemory = maxMemory;
    }

    public long getTtl() {
        return ttl;
    }

    public void setTtl(long ttl) {
        this.ttl = ttl;
    }

    public long getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(long sweepInterval) {
        this.sweepInterval = sweepInterval;
    }

    public double getEvictionRatio() {
        return evictionRatio;
    }

    public void setEvictionRatio(double evictionRatio) {
        this.evictionRatio = evictionRatio;
    }

    public String getSizingMode() {
        return sizingMode;
    }

    public void setSizingMode(String sizingMode) {
        this.sizingMode = sizingMode;
    }
}
