package com.agentry.core.context;

import com.agentry.core.security.FileOperation;
import com.agentry.core.security.SecurityGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Prepares the context an agent sees for a file or directory path.
 * <p>
 * Every path goes through the {@link SecurityGate}. The current signature is
 * computed on each call; the cached snapshot is used only when it still matches,
 * otherwise the files are loaded fresh and the cache is repopulated.
 */
@Service
public class ContextLoader {

    private static final Logger log = LoggerFactory.getLogger(ContextLoader.class);

    private final SecurityGate gate;
    private final ContextCache contextCache;

    public ContextLoader(SecurityGate gate, ContextCache contextCache) {
        this.gate = gate;
        this.contextCache = contextCache;
    }

    /**
     * @throws com.agentry.core.security.SecurityViolationException if the gate rejects the path
     * @throws IOException if the path is missing or unreadable
     */
    public LoadedContext load(String contextPath, int maxFiles) throws IOException {
        Path root = gate.requireValidPath(contextPath, FileOperation.READ);
        List<Path> files = ContextFiles.select(root, maxFiles, this::admit);
        String signature = Fingerprints.of(root, files);

        var cached = contextCache.lookup(root, signature);
        if (cached.isPresent()) {
            log.debug("Context cache hit for {}", root);
            return new LoadedContext(cached.get(), true);
        }

        List<ContextFile> loaded = new ArrayList<>();
        long totalBytes = 0;
        for (Path file : files) {
            String name = file.equals(root) ? file.getFileName().toString() : root.relativize(file).toString();
            String content = gate.secureRead(file.toString());
            loaded.add(new ContextFile(name, content));
            totalBytes += content.getBytes(StandardCharsets.UTF_8).length;
        }
        ContextSnapshot snapshot = new ContextSnapshot(root.toString(), loaded, totalBytes, signature);
        contextCache.store(root, snapshot);
        log.debug("Loaded {} context file(s) from {} ({} bytes)", loaded.size(), root, totalBytes);
        return new LoadedContext(snapshot, false);
    }

    /**
     * Runs each candidate file through the gate before anything opens it. Rejected
     * files are left out of the context; the gate has already recorded the event.
     */
    private boolean admit(Path file) {
        var validation = gate.validatePath(file.toString(), FileOperation.READ);
        if (!validation.valid()) {
            log.warn("Skipping context file {}: {}", file, validation.describeViolations());
            return false;
        }
        return true;
    }
}
