package com.agentry.core.context;

import com.agentry.core.cache.Digests;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.List;

/**
 * Content signatures used to decide whether a cached context is still current.
 * Content is hashed rather than relying on modification times, whose
 * granularity can hide a quick rewrite.
 */
final class Fingerprints {

    private Fingerprints() {}

    static String of(Path root, List<Path> files) throws IOException {
        MessageDigest digest = Digests.sha256();
        for (Path file : files) {
            String name = file.equals(root) ? file.getFileName().toString() : root.relativize(file).toString();
            digest.update(name.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(Long.toString(Files.size(file)).getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            try (InputStream in = Files.newInputStream(file)) {
                byte[] buffer = new byte[8192];
                int read;
                while ((read = in.read(buffer)) != -1) {
                    digest.update(buffer, 0, read);
                }
            }
            digest.update((byte) 0);
        }
        return Digests.hex(digest.digest());
    }
}
