package com.agentry.core.cache;

public enum EvictionReason {
    /** Entry count or byte ceiling exceeded. */
    CAPACITY,
    EXPIRED,
    PRESSURE,
    STALE,
    EXPLICIT
}
