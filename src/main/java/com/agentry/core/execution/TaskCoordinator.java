package com.agentry.core.execution;

import com.agentry.core.cache.ExecutionHistory;
import com.agentry.core.cache.HistoryEntry;
import com.agentry.core.cache.TieredCache;
import com.agentry.core.context.ContextLoader;
import com.agentry.core.context.ContextSnapshot;
import com.agentry.core.context.LoadedContext;
import com.agentry.core.events.AgentryEvent;
import com.agentry.core.events.EventBus;
import com.agentry.core.logging.MdcContext;
import com.agentry.core.metrics.AgentryMetrics;
import com.agentry.core.model.BatchResult;
import com.agentry.core.model.ErrorKind;
import com.agentry.core.model.ExecutionMetrics;
import com.agentry.core.model.ExecutionResult;
import com.agentry.core.model.Task;
import com.agentry.core.security.FileOperation;
import com.agentry.core.security.PathValidation;
import com.agentry.core.security.SecurityGate;
import com.agentry.core.security.SecurityViolationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Runs {@link Task}s against the {@link AgentRuntime}.
 * <p>
 * A single task is validated, its paths checked by the {@link SecurityGate},
 * its context prepared through the context cache, and the agent call made on
 * a worker thread under a hard deadline. A batch bounds how many tasks hold an
 * admission slot at once; a slot is released as soon as its task finishes or
 * times out. Per-task failures are returned as failed results, never thrown.
 */
@Service
public class TaskCoordinator {

    private static final Logger log = LoggerFactory.getLogger(TaskCoordinator.class);

    static final Pattern AGENT_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,99}");
    private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^a-zA-Z0-9\\-_]");
    private static final Duration STOP_GRACE = Duration.ofSeconds(5);

    private final AgentRuntime runtime;
    private final SecurityGate gate;
    private final ContextLoader contextLoader;
    private final OutputWriter outputWriter;
    private final ExecutionHistory history;
    private final TieredCache cache;
    private final ExecutionProperties properties;
    private final EventBus eventBus;
    private final ObjectMapper mapper;
    private final AgentryMetrics metrics;
    private final Clock clock;

    private final ExecutionStats stats = new ExecutionStats();
    private final AtomicInteger activeExecutions = new AtomicInteger();
    private final AtomicInteger batchCounter = new AtomicInteger();
    private final ExecutorService workers = Executors.newCachedThreadPool(namedDaemon("agent-worker"));

    @Autowired
    public TaskCoordinator(AgentRuntime runtime, SecurityGate gate, ContextLoader contextLoader,
                           OutputWriter outputWriter, ExecutionHistory history, TieredCache cache,
                           ExecutionProperties properties, EventBus eventBus, ObjectMapper mapper,
                           @Autowired(required = false) AgentryMetrics metrics,
                           @Autowired(required = false) Clock clock) {
        this.runtime = runtime;
        this.gate = gate;
        this.contextLoader = contextLoader;
        this.outputWriter = outputWriter;
        this.history = history;
        this.cache = cache;
        this.properties = properties;
        this.eventBus = eventBus;
        this.mapper = mapper;
        this.metrics = metrics;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    // --- Single task ---

    public ExecutionResult executeSingle(Task task) {
        return execute(task, null);
    }

    /**
     * @param deadlinePassed set by the owning batch once its deadline expires, null outside batches
     */
    private ExecutionResult execute(Task task, AtomicBoolean deadlinePassed) {
        String executionId = newExecutionId();
        MdcContext.setExecution(executionId, task.agentName());
        activeExecutions.incrementAndGet();
        try {
            log.info("Executing task for agent {}", task.agentName());
            eventBus.publish(AgentryEvent.of("execution.started", executionId, task.agentName(),
                    Map.of("task", abbreviate(task.taskDescription(), 100))));
            ExecutionResult result = attempt(executionId, task, deadlinePassed);
            finish(executionId, task, result);
            return result;
        } finally {
            activeExecutions.decrementAndGet();
            MdcContext.clearExecution();
        }
    }

    private ExecutionResult attempt(String executionId, Task task, AtomicBoolean deadlinePassed) {
        long startMs = System.currentTimeMillis();
        try {
            validate(task);
        } catch (TaskValidationException e) {
            log.warn("Task rejected: {}", e.getMessage());
            return ExecutionResult.failed(task.agentName(), ErrorKind.VALIDATION_ERROR, e.getMessage(),
                    ExecutionMetrics.of(elapsed(startMs)));
        }

        String violation = checkPaths(task);
        if (violation != null) {
            log.warn("Task paths rejected: {}", violation);
            return ExecutionResult.failed(task.agentName(), ErrorKind.SECURITY_VIOLATION, violation,
                    ExecutionMetrics.of(elapsed(startMs)));
        }

        String context;
        try {
            context = prepareContext(task);
        } catch (SecurityViolationException e) {
            return ExecutionResult.failed(task.agentName(), ErrorKind.SECURITY_VIOLATION, e.getMessage(),
                    ExecutionMetrics.of(elapsed(startMs)));
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to prepare context: {}", e.getMessage());
            return ExecutionResult.failed(task.agentName(), ErrorKind.IO_ERROR,
                    "Failed to load context: " + e.getMessage(), ExecutionMetrics.of(elapsed(startMs)));
        }
        long contextBytes = context.getBytes(StandardCharsets.UTF_8).length;

        Duration timeout = task.timeout() != null ? task.timeout() : properties.defaultTimeout();
        Future<AgentResponse> future = workers.submit(() -> {
            MdcContext.setExecution(executionId, task.agentName());
            try {
                return runtime.invoke(task.agentName(), task.taskDescription(), context, timeout);
            } finally {
                MdcContext.clearExecution();
            }
        });

        AgentResponse response;
        try {
            response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Agent {} timed out after {}ms", task.agentName(), timeout.toMillis());
            return ExecutionResult.timedOut(task.agentName(),
                    new ExecutionMetrics(elapsed(startMs), null, contextBytes));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Agent {} failed: {}", task.agentName(), cause.getMessage());
            return ExecutionResult.failed(task.agentName(), ErrorKind.RUNTIME_ERROR,
                    cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(),
                    new ExecutionMetrics(elapsed(startMs), null, contextBytes));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            if (deadlinePassed != null && deadlinePassed.get()) {
                log.warn("Agent {} stopped at the batch deadline", task.agentName());
                return ExecutionResult.timedOut(task.agentName(),
                        new ExecutionMetrics(elapsed(startMs), null, contextBytes));
            }
            return ExecutionResult.failed(task.agentName(), ErrorKind.RUNTIME_ERROR, "interrupted",
                    new ExecutionMetrics(elapsed(startMs), null, contextBytes));
        }

        Integer tokens = response.tokensUsed() != null ? response.tokensUsed() : (int) (context.length() / 4);
        if (!response.success()) {
            String error = response.error() != null ? response.error() : "Agent runtime reported failure";
            return new ExecutionResult(false, response.output(), error, ErrorKind.RUNTIME_ERROR,
                    new ExecutionMetrics(elapsed(startMs), tokens, contextBytes), task.agentName(), Instant.now(clock));
        }

        String output = response.output() != null ? response.output() : "";
        if (task.outputPath() != null) {
            try {
                Path written = outputWriter.write(task.outputPath(), output, task.outputFormat());
                log.info("Wrote {} output to {}", task.outputFormat(), written);
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to write output to {}: {}", task.outputPath(), e.getMessage());
                return new ExecutionResult(false, output, "Failed to write output: " + e.getMessage(),
                        ErrorKind.IO_ERROR, new ExecutionMetrics(elapsed(startMs), tokens, contextBytes),
                        task.agentName(), Instant.now(clock));
            }
        }
        return new ExecutionResult(true, output, null, null,
                new ExecutionMetrics(elapsed(startMs), tokens, contextBytes), task.agentName(), Instant.now(clock));
    }

    private void validate(Task task) {
        if (task.agentName() == null || task.agentName().isBlank()) {
            throw new TaskValidationException("Agent name is required");
        }
        if (!AGENT_NAME.matcher(task.agentName()).matches()) {
            throw new TaskValidationException("Invalid agent name: " + task.agentName());
        }
        if (task.taskDescription() == null || task.taskDescription().isBlank()) {
            throw new TaskValidationException("Task description is required");
        }
        if (task.timeout() != null && (task.timeout().isZero() || task.timeout().isNegative())) {
            throw new TaskValidationException("Timeout must be positive");
        }
        for (String key : task.variables().keySet()) {
            if (key == null || key.isBlank()) {
                throw new TaskValidationException("Variable names must not be empty");
            }
        }
    }

    /**
     * @return the joined violations of the first rejected path, or null when all pass
     */
    private String checkPaths(Task task) {
        List<String> readPaths = new ArrayList<>();
        if (task.contextPath() != null) {
            readPaths.add(task.contextPath());
        }
        readPaths.addAll(task.contextRefs());
        for (String path : readPaths) {
            PathValidation validation = gate.validatePath(path, FileOperation.READ);
            if (!validation.valid()) {
                return "Invalid context path " + path + ": " + validation.describeViolations();
            }
        }
        if (task.outputPath() != null) {
            PathValidation validation = gate.validatePath(task.outputPath(), FileOperation.WRITE);
            if (!validation.valid()) {
                return "Invalid output path " + task.outputPath() + ": " + validation.describeViolations();
            }
        }
        return null;
    }

    private String prepareContext(Task task) throws IOException {
        List<String> paths = new ArrayList<>();
        if (task.contextPath() != null) {
            paths.add(task.contextPath());
        }
        paths.addAll(task.contextRefs());
        List<ContextSnapshot> snapshots = new ArrayList<>();
        for (String path : paths) {
            LoadedContext loaded = contextLoader.load(path, properties.getContextMaxFiles());
            log.debug("Context {} loaded ({}; {} files)", path, loaded.cached() ? "cached" : "fresh",
                    loaded.snapshot().fileCount());
            snapshots.add(loaded.snapshot());
        }
        return PromptBuilder.context(snapshots, task.variables(), mapper);
    }

    private void finish(String executionId, Task task, ExecutionResult result) {
        stats.record(result);
        history.record(executionId, task.taskDescription(), result);
        long durationMs = result.metrics() != null ? result.metrics().durationMs() : 0;
        if (metrics != null) {
            metrics.recordTaskExecution(task.agentName(), durationMs, result.success());
            if (!result.success() && result.errorKind() != null) {
                metrics.recordTaskError(result.errorKind().code());
            }
        }
        if (result.success()) {
            log.info("Agent {} completed in {}ms", task.agentName(), durationMs);
            eventBus.publish(AgentryEvent.of("execution.completed", executionId, task.agentName(),
                    Map.of("durationMs", durationMs)));
        } else {
            log.warn("Agent {} failed after {}ms: {}", task.agentName(), durationMs, result.error());
            eventBus.publish(AgentryEvent.of("execution.failed", executionId, task.agentName(),
                    Map.of("durationMs", durationMs,
                           "errorKind", result.errorKind() != null ? result.errorKind().code() : "unknown",
                           "error", String.valueOf(result.error()))));
        }
    }

    // --- Batches ---

    /**
     * Runs tasks with at most {@code concurrencyLimit} holding an admission slot at
     * any moment. Results are returned in submission order.
     */
    public BatchResult executeBatch(List<Task> tasks, int concurrencyLimit) {
        long startMs = System.currentTimeMillis();
        if (tasks.isEmpty()) {
            return new BatchResult(0, 0, 0, List.of(), ExecutionReports.batchSummary(List.of(), 0));
        }
        int limit = Math.max(1, concurrencyLimit);
        String batchId = "batch-" + batchCounter.incrementAndGet();
        log.info("Starting {} with {} tasks (max {} concurrent)", batchId, tasks.size(), limit);
        eventBus.publish(AgentryEvent.of("batch.started", batchId, null,
                Map.of("tasks", tasks.size(), "maxConcurrency", limit)));
        if (metrics != null) {
            metrics.recordBatch(tasks.size(), limit);
        }

        var slots = new Semaphore(limit);
        var deadlinePassed = new AtomicBoolean(false);
        var pool = Executors.newFixedThreadPool(Math.min(limit, tasks.size()), namedDaemon(batchId));
        var futures = new ArrayList<CompletableFuture<ExecutionResult>>();
        var results = new ArrayList<ExecutionResult>(tasks.size());
        try {
            for (Task task : tasks) {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    try {
                        slots.acquire();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return ExecutionResult.timedOut(task.agentName(), ExecutionMetrics.of(0));
                    }
                    try {
                        return execute(task, deadlinePassed);
                    } finally {
                        slots.release();
                    }
                }, pool));
            }
            if (!awaitBatch(futures, properties.batchTimeout())) {
                // Running tasks see the flag when interrupted and record their own timeout
                deadlinePassed.set(true);
                pool.shutdownNow();
                awaitStop(pool, batchId);
            }

            // Tasks still unfinished here never reached the runtime or ignored the interrupt
            for (int i = 0; i < tasks.size(); i++) {
                CompletableFuture<ExecutionResult> future = futures.get(i);
                if (future.isDone() && !future.isCompletedExceptionally()) {
                    results.add(future.join());
                } else {
                    future.cancel(true);
                    results.add(ExecutionResult.timedOut(tasks.get(i).agentName(),
                            ExecutionMetrics.of(elapsed(startMs))));
                }
            }
        } finally {
            pool.shutdownNow();
        }

        long durationMs = elapsed(startMs);
        int successful = (int) results.stream().filter(ExecutionResult::success).count();
        int failed = results.size() - successful;
        log.info("{} finished: {} succeeded, {} failed in {}ms", batchId, successful, failed, durationMs);
        eventBus.publish(AgentryEvent.of("batch.completed", batchId, null,
                Map.of("successful", successful, "failed", failed, "durationMs", durationMs)));
        return new BatchResult(results.size(), successful, failed, results,
                ExecutionReports.batchSummary(results, durationMs));
    }

    /**
     * Runs the same task description against several agents. When a base output path
     * is given each agent writes to {@code <dir>/<agent>_<file>}.
     */
    public BatchResult executeBatch(List<String> agentNames, String taskDescription, BatchOptions options) {
        BatchOptions opts = options != null ? options : BatchOptions.defaults();
        var tasks = new ArrayList<Task>(agentNames.size());
        for (String agent : agentNames) {
            String outputPath = opts.outputPath() != null ? perAgentOutputPath(opts.outputPath(), agent) : null;
            tasks.add(new Task(agent, taskDescription, opts.contextPath(), List.of(), outputPath,
                    opts.format(), opts.timeout(), opts.variables()));
        }
        int limit = opts.maxConcurrency() > 0 ? opts.maxConcurrency() : properties.getMaxParallel();
        return executeBatch(tasks, limit);
    }

    public static String perAgentOutputPath(String baseOutputPath, String agentName) {
        Path base = Path.of(baseOutputPath);
        String fileName = UNSAFE_FILE_CHARS.matcher(agentName).replaceAll("_") + "_" + base.getFileName();
        Path parent = base.getParent();
        return parent != null ? parent.resolve(fileName).toString() : fileName;
    }

    /**
     * @return false when the batch deadline (or an interrupt) cut the wait short
     */
    private boolean awaitBatch(List<CompletableFuture<ExecutionResult>> futures, Duration batchTimeout) {
        var all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        try {
            if (batchTimeout != null) {
                all.get(batchTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } else {
                all.get();
            }
            return true;
        } catch (TimeoutException e) {
            log.warn("Batch timed out after {}ms, cancelling unfinished tasks", batchTimeout.toMillis());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for batch");
            return false;
        } catch (ExecutionException e) {
            log.error("Unexpected error collecting batch results", e.getCause());
            return true;
        }
    }

    private void awaitStop(ExecutorService pool, String batchId) {
        try {
            if (!pool.awaitTermination(STOP_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} workers still running {}ms after cancellation", batchId, STOP_GRACE.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // --- Queries ---

    public ExecutionStatus status() {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        long completed = 0;
        long failed = 0;
        for (HistoryEntry entry : history.all()) {
            if (LocalDate.ofInstant(entry.recordedAt(), ZoneOffset.UTC).equals(today)) {
                if (entry.result().success()) {
                    completed++;
                } else {
                    failed++;
                }
            }
        }
        return new ExecutionStatus(activeExecutions.get(), completed, failed, stats.executions());
    }

    /**
     * Recent executions, newest first.
     *
     * @param agentName only this agent when non-null
     * @param limit     at most this many, or all when not positive
     */
    public List<HistoryEntry> logs(String agentName, int limit) {
        List<HistoryEntry> entries = agentName != null ? history.byAgent(agentName) : history.all();
        return limit > 0 && entries.size() > limit ? entries.subList(0, limit) : entries;
    }

    public ExecutionSummary summary() {
        return new ExecutionSummary(stats.executions(), stats.successes(), stats.failures(),
                stats.successRate(), stats.averageDurationMs(), stats.totalTokens(),
                stats.mostUsedAgent().orElse(null), stats.perAgent());
    }

    public PerformanceStatus performanceStatus() {
        return new PerformanceStatus(history.isWithinLimits(), cache.isHealthy(), history.metrics(), cache.metrics());
    }

    public ExecutionStats stats() {
        return stats;
    }

    public int activeExecutions() {
        return activeExecutions.get();
    }

    public void clearHistory() {
        history.clear();
        stats.reset();
        log.info("Execution history cleared");
    }

    /**
     * Sweeps expired cache entries and relieves history pressure now.
     */
    public void forceCleanup() {
        int cacheRemoved = cache.sweep();
        int historyRemoved = history.sweep();
        log.info("Forced cleanup removed {} cache entries and {} history entries", cacheRemoved, historyRemoved);
    }

    @PreDestroy
    void shutdown() {
        workers.shutdownNow();
    }

    // --- Helpers ---

    private String newExecutionId() {
        return "exec-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static long elapsed(long startMs) {
        return System.currentTimeMillis() - startMs;
    }

    private static String abbreviate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max);
    }

    private static ThreadFactory namedDaemon(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
