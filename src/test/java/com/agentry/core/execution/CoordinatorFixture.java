package com.agentry.core.execution;

import com.agentry.core.cache.CacheProperties;
import com.agentry.core.cache.ExecutionHistory;
import com.agentry.core.cache.HistoryProperties;
import com.agentry.core.cache.TieredCache;
import com.agentry.core.context.ContextCache;
import com.agentry.core.context.ContextLoader;
import com.agentry.core.events.EventBus;
import com.agentry.core.security.SecurityGate;
import com.agentry.core.security.SecurityProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * A {@link TaskCoordinator} wired to real collaborators over a temporary directory.
 * The security base is {@code <root>/workspace}; the disk cache lives beside it.
 */
public record CoordinatorFixture(
    Path workspace,
    SecurityGate gate,
    TieredCache cache,
    ExecutionHistory history,
    EventBus eventBus,
    ExecutionProperties properties,
    TaskCoordinator coordinator
) {

    public static CoordinatorFixture create(Path root, AgentRuntime runtime) throws IOException {
        return create(root, runtime, new ExecutionProperties());
    }

    public static CoordinatorFixture create(Path root, AgentRuntime runtime, ExecutionProperties properties)
            throws IOException {
        Path workspace = Files.createDirectories(root.resolve("workspace"));
        var mapper = new ObjectMapper().findAndRegisterModules();
        var clock = Clock.systemUTC();

        var securityProperties = new SecurityProperties();
        securityProperties.setAllowedBasePaths(List.of(workspace.toString()));
        var gate = new SecurityGate(securityProperties, null, clock);

        var cacheProperties = new CacheProperties();
        cacheProperties.setDirectory(root.resolve("cache").toString());
        var cache = new TieredCache(cacheProperties, mapper, null, clock);
        var history = new ExecutionHistory(new HistoryProperties(), null, clock);
        var eventBus = new EventBus();

        var coordinator = new TaskCoordinator(runtime, gate, new ContextLoader(gate, new ContextCache(cache)),
                new OutputWriter(gate, mapper), history, cache, properties, eventBus, mapper, null, clock);
        return new CoordinatorFixture(workspace, gate, cache, history, eventBus, properties, coordinator);
    }
}
