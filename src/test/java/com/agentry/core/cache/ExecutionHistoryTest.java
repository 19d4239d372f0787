package com.agentry.core.cache;

import com.agentry.core.model.ErrorKind;
import com.agentry.core.model.ExecutionMetrics;
import com.agentry.core.model.ExecutionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionHistoryTest {

    private MutableClock clock;
    private HistoryProperties properties;
    private final AtomicReference<Double> heap = new AtomicReference<>(0.1);

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        properties = new HistoryProperties();
        properties.setMaxEntries(10);
    }

    private ExecutionHistory newHistory() {
        return new ExecutionHistory(properties, null, clock, heap::get);
    }

    private static ExecutionResult ok(String agent) {
        return ExecutionResult.succeeded(agent, "done", ExecutionMetrics.of(10));
    }

    @Test
    @DisplayName("keeps at most maxEntries, dropping the oldest")
    void entryCeiling() {
        properties.setMaxEntries(3);
        var history = newHistory();
        for (int i = 1; i <= 4; i++) {
            history.record("e" + i, "task " + i, ok("coder"));
            clock.advance(Duration.ofSeconds(1));
        }

        assertEquals(3, history.size());
        assertTrue(history.find("e1").isEmpty());
        assertTrue(history.find("e4").isPresent());
        assertEquals(1, history.metrics().evictions());
    }

    @Test
    @DisplayName("lists newest first and filters by agent")
    void listing() {
        var history = newHistory();
        history.record("e1", "first", ok("coder"));
        clock.advance(Duration.ofSeconds(1));
        history.record("e2", "second", ok("reviewer"));
        clock.advance(Duration.ofSeconds(1));
        history.record("e3", "third", ExecutionResult.failed("coder", ErrorKind.RUNTIME_ERROR, "boom",
                ExecutionMetrics.of(5)));

        assertEquals("e3", history.all().get(0).executionId());
        assertEquals(2, history.byAgent("coder").size());
        assertEquals("first", history.byAgent("coder").get(1).taskSummary());
    }

    @Test
    @DisplayName("long task descriptions are shortened in the summary")
    void summarizesDescription() {
        var entry = newHistory().record("e1", "x".repeat(500), ok("coder"));

        assertEquals(100, entry.taskSummary().length());
    }

    @Test
    @DisplayName("entries older than the ttl disappear")
    void ttl() {
        properties.setTtlMinutes(1);
        var history = newHistory();
        history.record("e1", "task", ok("coder"));
        clock.advance(Duration.ofMinutes(2));

        assertTrue(history.all().isEmpty());
        assertEquals(1, history.sweep());
        assertEquals(0, history.size());
    }

    @Test
    @DisplayName("high pressure evicts a share of the oldest entries on sweep")
    void pressureEviction() {
        var history = newHistory();
        for (int i = 1; i <= 4; i++) {
            history.record("e" + i, "task", ok("coder"));
            clock.advance(Duration.ofSeconds(1));
        }
        heap.set(0.95);

        assertFalse(history.isWithinLimits());
        assertEquals(1, history.sweep());
        assertTrue(history.find("e1").isEmpty());
        assertEquals(3, history.size());
    }

    @Test
    @DisplayName("low pressure leaves entries alone")
    void lowPressure() {
        var history = newHistory();
        history.record("e1", "task", ok("coder"));

        assertTrue(history.isWithinLimits());
        assertEquals(0, history.sweep());
        assertTrue(history.summary().startsWith("History: 1/10 entries"));
    }
}
