package com.agentry.core.context;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Chooses which files of a context directory are handed to an agent.
 */
final class ContextFiles {

    static final Set<String> IGNORED_DIRECTORIES = Set.of(".git", "node_modules", "target", "build", "dist");

    private ContextFiles() {}

    /**
     * Files under {@code root}, sorted by relative path, outside ignored
     * directories, accepted by {@code filter}, at most {@code maxFiles}.
     * Symbolic links are offered to {@code filter} as candidates so it can refuse
     * them; nothing here opens a file. A regular file root yields itself.
     */
    static List<Path> select(Path root, int maxFiles, Predicate<Path> filter) throws IOException {
        if (Files.isRegularFile(root)) {
            return List.of(root);
        }
        if (!Files.isDirectory(root)) {
            throw new IOException("Context path does not exist: " + root);
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                    .filter(p -> Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS) || Files.isSymbolicLink(p))
                    .filter(p -> !isIgnored(root.relativize(p)))
                    .sorted()
                    .filter(filter)
                    .limit(Math.max(0, maxFiles))
                    .toList();
        }
    }

    private static boolean isIgnored(Path relative) {
        for (Path segment : relative) {
            if (IGNORED_DIRECTORIES.contains(segment.toString())) {
                return true;
            }
        }
        return false;
    }
}
