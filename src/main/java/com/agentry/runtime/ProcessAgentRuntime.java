package com.agentry.runtime;

import com.agentry.core.execution.AgentResponse;
import com.agentry.core.execution.AgentRuntime;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an agent as an external process.
 * <p>
 * The task and its prepared context are written to the process's stdin;
 * stdout is the agent output. Exit code 0 means success. When the calling
 * thread is interrupted (the coordinator's deadline expired) the process is
 * destroyed forcibly.
 */
@Component
public class ProcessAgentRuntime implements AgentRuntime {

    private static final Logger log = LoggerFactory.getLogger(ProcessAgentRuntime.class);

    static final String AGENT_PLACEHOLDER = "{agent}";

    private final RuntimeProperties properties;
    private final ExecutorService io = Executors.newCachedThreadPool(new ThreadFactory() {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "agent-process-io-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    });

    public ProcessAgentRuntime(RuntimeProperties properties) {
        this.properties = properties;
    }

    @Override
    public AgentResponse invoke(String agentName, String task, String context, Duration timeout) throws Exception {
        if (!isAvailable()) {
            throw new IllegalStateException("No agent runtime command configured (agentry.runtime.command)");
        }
        List<String> command = properties.getCommand().stream()
                .map(arg -> arg.replace(AGENT_PLACEHOLDER, agentName))
                .toList();
        var builder = new ProcessBuilder(command).redirectErrorStream(false);
        if (properties.getWorkingDirectory() != null && !properties.getWorkingDirectory().isBlank()) {
            builder.directory(new File(properties.getWorkingDirectory()));
        }
        builder.environment().put("AGENTRY_AGENT", agentName);

        log.debug("Starting agent process: {}", command);
        Process process = builder.start();
        try {
            byte[] prompt = ("## Task\n\n" + task + "\n\n" + context).getBytes(StandardCharsets.UTF_8);
            CompletableFuture<Void> stdin = CompletableFuture.runAsync(() -> writeQuietly(process.getOutputStream(), prompt), io);
            CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readQuietly(process.getInputStream()), io);
            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readQuietly(process.getErrorStream()), io);

            boolean exited = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!exited) {
                process.destroyForcibly();
                return AgentResponse.failure("Agent process did not exit within " + timeout.toMillis() + "ms");
            }
            stdin.join();
            String output = stdout.get();
            String errors = stderr.get();
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                log.warn("Agent process for {} exited with code {}", agentName, exitCode);
                String message = errors.isBlank() ? "Agent process exited with code " + exitCode : errors.strip();
                return new AgentResponse(false, output, message, null);
            }
            return new AgentResponse(true, output, null, null);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            process.destroyForcibly();
            throw new IOException("Failed to read agent process output", e.getCause());
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    @Override
    public boolean isAvailable() {
        return properties.getCommand() != null && !properties.getCommand().isEmpty();
    }

    @Override
    public String describe() {
        return isAvailable() ? "process: " + String.join(" ", properties.getCommand()) : "process: not configured";
    }

    @PreDestroy
    void shutdown() {
        io.shutdownNow();
    }

    private static void writeQuietly(OutputStream out, byte[] bytes) {
        try (out) {
            out.write(bytes);
        } catch (IOException e) {
            // The process may exit without reading its input
            log.debug("Agent process closed stdin early: {}", e.getMessage());
        }
    }

    private static String readQuietly(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Agent process stream closed: {}", e.getMessage());
            return "";
        }
    }
}
