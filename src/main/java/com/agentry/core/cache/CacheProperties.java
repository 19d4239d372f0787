package com.agentry.core.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Two-tier cache sizing. The memory tier holds hot entries; the disk tier
 * under {@link #directory} is the larger overflow.
 */
@Component
@ConfigurationProperties(prefix = "agentry.cache")
public class CacheProperties {

    private boolean enabled = true;
    private long memoryMaxMb = 50;
    private long diskMaxMb = 200;
    private int maxEntries = 1000;
    private long ttlMinutes = 60;
    private long sweepIntervalMinutes = 10;
    private String directory = ".agentry/cache";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getMemoryMaxMb() {
        return memoryMaxMb;
    }

    public void setMemoryMaxMb(long memoryMaxMb) {
        this.memoryMaxMb = memoryMaxMb;
    }

    public long getDiskMaxMb() {
        return diskMaxMb;
    }

    public void setDiskMaxMb(long diskMaxMb) {
        this.diskMaxMb = diskMaxMb;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }

    public long getTtlMinutes() {
        return ttlMinutes;
    }

    public void setTtlMinutes(long ttlMinutes) {
        this.ttlMinutes = ttlMinutes;
    }

    public long getSweepIntervalMinutes() {
        return sweepIntervalMinutes;
    }

    public void setSweepIntervalMinutes(long sweepIntervalMinutes) {
        this.sweepIntervalMinutes = sweepIntervalMinutes;
    }

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public long memoryMaxBytes() {
        return memoryMaxMb * 1024 * 1024;
    }

    public long diskMaxBytes() {
        return diskMaxMb * 1024 * 1024;
    }
}
