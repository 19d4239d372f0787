package com.agentry.core.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.mockito.Mockito.*;

class CacheSweeperTest {

    @Test
    @DisplayName("sweep purges both the cache and the history")
    void sweepsBoth() {
        var cache = mock(TieredCache.class);
        var history = mock(ExecutionHistory.class);
        when(cache.sweep()).thenReturn(2);

        new CacheSweeper(cache, history, new CacheProperties()).sweep();

        verify(cache).sweep();
        verify(history).sweep();
    }

    @Test
    @DisplayName("a failing sweep is logged and does not propagate")
    void failureContained() {
        var cache = mock(TieredCache.class);
        var history = mock(ExecutionHistory.class);
        when(cache.sweep()).thenThrow(new IllegalStateException("disk gone"));

        new CacheSweeper(cache, history, new CacheProperties()).sweep();

        verify(history, never()).sweep();
    }
}
