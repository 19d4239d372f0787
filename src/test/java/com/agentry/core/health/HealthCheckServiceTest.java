package com.agentry.core.health;

import com.agentry.core.cache.CacheProperties;
import com.agentry.core.cache.ExecutionHistory;
import com.agentry.core.cache.HistoryProperties;
import com.agentry.core.cache.TieredCache;
import com.agentry.core.execution.AgentRuntime;
import com.agentry.core.security.FileOperation;
import com.agentry.core.security.SecurityGate;
import com.agentry.core.security.SecurityProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    @TempDir
    Path tempDir;

    private ExecutionHistory history;
    private TieredCache cache;
    private CacheProperties cacheProperties;
    private SecurityGate gate;

    @BeforeEach
    void setUp() {
        history = new ExecutionHistory(new HistoryProperties(), null, Clock.systemUTC());
        cacheProperties = new CacheProperties();
        cacheProperties.setDirectory(tempDir.resolve("cache").toString());
        cache = new TieredCache(cacheProperties, new ObjectMapper(), null, Clock.systemUTC());
        var securityProperties = new SecurityProperties();
        securityProperties.setAllowedBasePaths(List.of(tempDir.toString()));
        gate = new SecurityGate(securityProperties, null, Clock.systemUTC());
    }

    private static HealthStatus component(List<HealthStatus> results, String name) {
        return results.stream()
                .filter(s -> name.equals(s.component()))
                .findFirst()
                .orElseThrow();
    }

    @Test
    @DisplayName("checkAll returns runtime, history, cache and security components")
    void checkAllReturnsAllComponents() {
        var service = new HealthCheckService(null, history, cache, gate);

        var components = service.checkAll().stream().map(HealthStatus::component).toList();

        assertEquals(List.of("runtime", "history", "cache", "security"), components);
    }

    @Test
    @DisplayName("No runtime -> runtime DOWN")
    void noRuntimeDown() {
        var service = new HealthCheckService(null, history, cache, gate);

        assertEquals(HealthStatus.Status.DOWN, component(service.checkAll(), "runtime").status());
    }

    @Test
    @DisplayName("Available runtime -> runtime UP")
    void availableRuntimeUp() {
        var runtime = mock(AgentRuntime.class);
        when(runtime.isAvailable()).thenReturn(true);
        when(runtime.describe()).thenReturn("mock");
        var service = new HealthCheckService(runtime, history, cache, gate);

        var status = component(service.checkAll(), "runtime");

        assertEquals(HealthStatus.Status.UP, status.status());
        assertTrue(status.detail().contains("mock"));
    }

    @Test
    @DisplayName("Runtime throwing on availability check -> runtime DOWN")
    void runtimeErrorDown() {
        var runtime = mock(AgentRuntime.class);
        when(runtime.isAvailable()).thenThrow(new IllegalStateException("no socket"));
        var service = new HealthCheckService(runtime, history, cache, gate);

        var status = component(service.checkAll(), "runtime");

        assertEquals(HealthStatus.Status.DOWN, status.status());
        assertEquals("Runtime error: no socket", status.detail());
    }

    @Test
    @DisplayName("Fresh cache -> UP, disabled cache -> DEGRADED")
    void cacheStatus() {
        assertEquals(HealthStatus.Status.UP,
                component(new HealthCheckService(null, history, cache, gate).checkAll(), "cache").status());

        cacheProperties.setEnabled(false);
        var disabled = new TieredCache(cacheProperties, new ObjectMapper(), null, Clock.systemUTC());

        assertEquals(HealthStatus.Status.DEGRADED,
                component(new HealthCheckService(null, history, disabled, gate).checkAll(), "cache").status());
    }

    @Test
    @DisplayName("A critical security event -> security DEGRADED")
    void criticalEventDegradesSecurity() {
        var service = new HealthCheckService(null, history, cache, gate);
        assertEquals(HealthStatus.Status.UP, component(service.checkAll(), "security").status());

        gate.validatePath("../../etc/passwd", FileOperation.READ);

        var status = component(service.checkAll(), "security");
        assertEquals(HealthStatus.Status.DEGRADED, status.status());
        assertEquals("1", status.metadata().get("critical"));
    }

    @Test
    @DisplayName("overall picks the worst status")
    void overallStatus() {
        var up = new HealthStatus("a", HealthStatus.Status.UP, "", null);
        var degraded = new HealthStatus("b", HealthStatus.Status.DEGRADED, "", Map.of());
        var down = new HealthStatus("c", HealthStatus.Status.DOWN, "", Map.of());

        assertEquals(HealthStatus.Status.UP, HealthStatus.overall(List.of()));
        assertEquals(HealthStatus.Status.DEGRADED, HealthStatus.overall(List.of(up, degraded)));
        assertEquals(HealthStatus.Status.DOWN, HealthStatus.overall(List.of(down, degraded, up)));
        assertTrue(up.metadata().isEmpty());
    }
}
