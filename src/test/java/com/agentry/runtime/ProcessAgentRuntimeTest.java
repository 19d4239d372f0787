package com.agentry.runtime;

import com.agentry.core.execution.AgentResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessAgentRuntimeTest {

    private ProcessAgentRuntime runtime;

    private ProcessAgentRuntime runtimeFor(String... command) {
        var properties = new RuntimeProperties();
        properties.setCommand(List.of(command));
        runtime = new ProcessAgentRuntime(properties);
        return runtime;
    }

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.shutdown();
        }
    }

    @Test
    @DisplayName("writes the prompt to stdin and returns stdout")
    void echoesPrompt() throws Exception {
        AgentResponse response = runtimeFor("cat").invoke("reviewer", "Review it", "## Context\n", Duration.ofSeconds(10));

        assertTrue(response.success());
        assertTrue(response.output().startsWith("## Task\n\nReview it"));
        assertTrue(response.output().contains("## Context"));
    }

    @Test
    @DisplayName("substitutes the agent placeholder in arguments")
    void agentPlaceholder() throws Exception {
        AgentResponse response = runtimeFor("sh", "-c", "echo running {agent}").invoke("coder", "x", "", Duration.ofSeconds(10));

        assertEquals("running coder", response.output().strip());
    }

    @Test
    @DisplayName("a non-zero exit is a failure carrying stderr")
    void nonZeroExit() throws Exception {
        AgentResponse response = runtimeFor("sh", "-c", "echo broken >&2; exit 3").invoke("coder", "x", "", Duration.ofSeconds(10));

        assertFalse(response.success());
        assertEquals("broken", response.error());
    }

    @Test
    @DisplayName("a process outliving the timeout is destroyed")
    void timeout() throws Exception {
        AgentResponse response = runtimeFor("sleep", "5").invoke("coder", "x", "", Duration.ofMillis(200));

        assertFalse(response.success());
        assertTrue(response.error().contains("did not exit within 200ms"));
    }

    @Test
    @DisplayName("an empty command is unavailable")
    void unconfigured() {
        var unconfigured = new ProcessAgentRuntime(new RuntimeProperties());

        assertFalse(unconfigured.isAvailable());
        assertEquals("process: not configured", unconfigured.describe());
        assertThrows(IllegalStateException.class,
                () -> unconfigured.invoke("coder", "x", "", Duration.ofSeconds(1)));
        unconfigured.shutdown();
    }
}
