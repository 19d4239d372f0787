package com.agentry.core.context;

/**
 * @param snapshot the prepared context
 * @param cached   true when served from the cache rather than loaded fresh
 */
public record LoadedContext(ContextSnapshot snapshot, boolean cached) {}
