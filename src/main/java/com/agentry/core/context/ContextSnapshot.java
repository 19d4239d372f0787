package com.agentry.core.context;

import java.util.List;

/**
 * Prepared context for one context path, as stored in the cache.
 *
 * @param contextPath absolute normalized source path
 * @param files       loaded files in a stable order
 * @param totalBytes  sum of the loaded content sizes in UTF-8 bytes
 * @param signature   fingerprint of the source at load time
 */
public record ContextSnapshot(
    String contextPath,
    List<ContextFile> files,
    long totalBytes,
    String signature
) {

    public ContextSnapshot {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public int fileCount() {
        return files.size();
    }
}
