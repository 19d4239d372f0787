package com.agentry.core.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "agentry.history")
public class HistoryProperties {

    private int maxEntries = 1000;
    private long maxMemoryMb = 100;
    private long ttlMinutes = 60;
    /** Pressure ratio above which a sweep evicts proactively. */
    private double pressureThreshold = 0.8;
    /** Share of the oldest entries dropped by a pressure eviction. */
    private double pressureEvictFraction = 0.25;

    public int getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }

    public long getMaxMemoryMb() {
        return maxMemoryMb;
    }

    public void setMaxMemoryMb(long maxMemoryMb) {
        this.maxMemoryMb = maxMemoryMb;
    }

    public long getTtlMinutes() {
        return ttlMinutes;
    }

    public void setTtlMinutes(long ttlMinutes) {
        this.ttlMinutes = ttlMinutes;
    }

    public double getPressureThreshold() {
        return pressureThreshold;
    }

    public void setPressureThreshold(double pressureThreshold) {
        this.pressureThreshold = pressureThreshold;
    }

    public double getPressureEvictFraction() {
        return pressureEvictFraction;
    }

    public void setPressureEvictFraction(double pressureEvictFraction) {
        this.pressureEvictFraction = pressureEvictFraction;
    }

    public long maxMemoryBytes() {
        return maxMemoryMb * 1024 * 1024;
    }
}
