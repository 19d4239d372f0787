package com.agentry.core.security;

import com.agentry.core.metrics.AgentryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single choke point for every filesystem path and every piece of untrusted text
 * that flows through task execution.
 *
 * <p>Paths are checked for traversal sequences before resolution, then resolved,
 * normalized and confined to the allowed base directories. Content is stripped
 * of control characters and of script-injection patterns. Every rejection is
 * appended to a bounded {@link SecurityAuditLog}.
 */
@Service
public class SecurityGate {

    private static final Logger log = LoggerFactory.getLogger(SecurityGate.class);
    private static final Logger audit = LoggerFactory.getLogger("agentry.security");

    public static final String SANITIZED_PLACEHOLDER = "[SANITIZED_CONTENT]";

    private static final Pattern TRAVERSAL = Pattern.compile(
            "(?i)(\\.\\.|%2e%2e|%252e%252e|%2e\\.|\\.%2e|\\.%2f|\\.%5c)");
    private static final Pattern PATH_CONTROL_CHARS = Pattern.compile("[\\x00-\\x1f\\x7f]");
    private static final Pattern CONTENT_CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0b\\x0c\\x0e-\\x1f\\x7f]");

    private static final List<InjectionRule> INJECTION_RULES = List.of(
            new InjectionRule("script block",
                    Pattern.compile("(?is)<script\\b[^>]*>.*?</script\\s*>"), SANITIZED_PLACEHOLDER),
            new InjectionRule("script tag",
                    Pattern.compile("(?i)</?script\\b[^>]*>"), SANITIZED_PLACEHOLDER),
            new InjectionRule("javascript url",
                    Pattern.compile("(?i)javascript\\s*:"), SANITIZED_PLACEHOLDER),
            new InjectionRule("event handler attribute",
                    Pattern.compile("(?i)(<[^>]*?)\\s+on[a-z]+\\s*=\\s*(\"[^\"]*\"|'[^']*'|[^\\s>]+)"),
                    "$1 " + SANITIZED_PLACEHOLDER),
            new InjectionRule("eval call",
                    Pattern.compile("\\beval\\s*\\("), SANITIZED_PLACEHOLDER),
            new InjectionRule("function constructor",
                    Pattern.compile("\\b(?:new\\s+)?Function\\s*\\("), SANITIZED_PLACEHOLDER),
            new InjectionRule("string timer",
                    Pattern.compile("\\bset(?:Timeout|Interval)\\s*\\(\\s*[\"'`]"), SANITIZED_PLACEHOLDER)
    );

    private final SecurityProperties properties;
    private final AgentryMetrics metrics;
    private final Clock clock;
    private final SecurityAuditLog auditLog;
    private final List<Path> allowedBases;

    public SecurityGate(SecurityProperties properties,
                        @Autowired(required = false) AgentryMetrics metrics,
                        @Autowired(required = false) Clock clock) {
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.auditLog = new SecurityAuditLog(properties.getAuditLogCapacity());
        this.allowedBases = resolveBases(properties.getAllowedBasePaths());
    }

    /** Test constructor without metrics. */
    SecurityGate(SecurityProperties properties) {
        this(properties, null, Clock.systemUTC());
    }

    // --- Paths ---

    /**
     * Validates a path for the given operation. Relative paths are resolved
     * against the first allowed base directory.
     */
    public PathValidation validatePath(String rawPath, FileOperation operation) {
        if (rawPath == null || rawPath.isBlank()) {
            return reject(rawPath, null, operation, SecurityEvent.Kind.INVALID_PATH,
                    SecurityEvent.Severity.MEDIUM, "Path is empty");
        }
        if (PATH_CONTROL_CHARS.matcher(rawPath).find()) {
            return reject(rawPath, null, operation, SecurityEvent.Kind.INVALID_PATH,
                    SecurityEvent.Severity.HIGH, "Path contains control characters");
        }
        if (TRAVERSAL.matcher(rawPath).find()) {
            return reject(rawPath, null, operation, SecurityEvent.Kind.PATH_TRAVERSAL_ATTEMPT,
                    SecurityEvent.Severity.CRITICAL, "Path traversal sequence detected");
        }

        Path resolved;
        try {
            Path candidate = Path.of(rawPath.replace('\\', '/'));
            if (!candidate.isAbsolute()) {
                candidate = allowedBases.get(0).resolve(candidate);
            }
            resolved = candidate.toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            return reject(rawPath, null, operation, SecurityEvent.Kind.INVALID_PATH,
                    SecurityEvent.Severity.MEDIUM, "Path cannot be parsed: " + e.getReason());
        }

        Path base = allowedBases.stream().filter(resolved::startsWith).findFirst().orElse(null);
        if (base == null) {
            return reject(rawPath, resolved, operation, SecurityEvent.Kind.UNAUTHORIZED_PATH_ACCESS,
                    SecurityEvent.Severity.HIGH, "Path is outside the allowed base directories");
        }
        String restricted = matchRestricted(resolved);
        if (restricted != null) {
            return reject(rawPath, resolved, operation, SecurityEvent.Kind.RESTRICTED_PATH_ACCESS,
                    SecurityEvent.Severity.HIGH, "Path falls under restricted location " + restricted);
        }
        int depth = base.equals(resolved) ? 0 : base.relativize(resolved).getNameCount();
        if (depth > properties.getMaxDepth()) {
            return reject(rawPath, resolved, operation, SecurityEvent.Kind.DEPTH_VIOLATION,
                    SecurityEvent.Severity.MEDIUM,
                    "Path depth " + depth + " exceeds maximum " + properties.getMaxDepth());
        }

        boolean exists = Files.exists(resolved, LinkOption.NOFOLLOW_LINKS);
        if (!properties.isAllowSymlinks()) {
            String symlinkViolation = checkSymlink(resolved, base);
            if (symlinkViolation != null) {
                return reject(rawPath, resolved, operation, SecurityEvent.Kind.SYMLINK_VIOLATION,
                        SecurityEvent.Severity.HIGH, symlinkViolation);
            }
        }

        boolean regularFile = exists && Files.isRegularFile(resolved);
        if (regularFile || (!exists && operation == FileOperation.WRITE)) {
            if (!hasAllowedExtension(resolved)) {
                return reject(rawPath, resolved, operation, SecurityEvent.Kind.EXTENSION_VIOLATION,
                        SecurityEvent.Severity.MEDIUM, "File extension is not allowed: " + resolved.getFileName());
            }
        }
        if (regularFile) {
            try {
                long size = Files.size(resolved);
                if (size > properties.getMaxFileSizeBytes()) {
                    return reject(rawPath, resolved, operation, SecurityEvent.Kind.FILE_SIZE_VIOLATION,
                            SecurityEvent.Severity.MEDIUM,
                            "File size " + size + " exceeds maximum " + properties.getMaxFileSizeBytes());
                }
            } catch (IOException e) {
                return reject(rawPath, resolved, operation, SecurityEvent.Kind.INVALID_PATH,
                        SecurityEvent.Severity.LOW, "File size cannot be read: " + e.getMessage());
            }
        }

        log.debug("Path accepted for {}: {}", operation, resolved);
        return PathValidation.accepted(resolved);
    }

    /**
     * Validates the path and throws when it is rejected.
     */
    public Path requireValidPath(String rawPath, FileOperation operation) {
        PathValidation validation = validatePath(rawPath, operation);
        if (!validation.valid()) {
            throw new SecurityViolationException("Access denied to " + rawPath, validation.violations());
        }
        return validation.resolvedPath();
    }

    /**
     * Reads a file after validation. The content returned is sanitized.
     */
    public String secureRead(String rawPath) throws IOException {
        Path path = requireValidPath(rawPath, FileOperation.READ);
        if (!Files.isRegularFile(path)) {
            throw new IOException("Not a regular file: " + path);
        }
        String content = Files.readString(path, StandardCharsets.UTF_8);
        record(SecurityEvent.Kind.ACCESS_GRANTED, SecurityEvent.Severity.LOW, FileOperation.READ,
                rawPath, path.toString(), "Read " + content.length() + " characters");
        return sanitizeContent(content, path.toString());
    }

    /**
     * Writes content after validating the target path and the content size.
     * Parent directories are created as needed.
     */
    public Path secureWrite(String rawPath, String content) throws IOException {
        Path path = requireValidPath(rawPath, FileOperation.WRITE);
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > properties.getMaxFileSizeBytes()) {
            record(SecurityEvent.Kind.FILE_SIZE_VIOLATION, SecurityEvent.Severity.MEDIUM, FileOperation.WRITE,
                    rawPath, path.toString(), "Content size " + bytes.length + " exceeds maximum");
            throw new SecurityViolationException("Content too large for " + rawPath);
        }
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(path, bytes);
        record(SecurityEvent.Kind.ACCESS_GRANTED, SecurityEvent.Severity.LOW, FileOperation.WRITE,
                rawPath, path.toString(), "Wrote " + bytes.length + " bytes");
        return path;
    }

    /**
     * Checks a glob pattern used to select context files. Only relative
     * patterns or absolute patterns inside an allowed base are accepted.
     */
    public PathValidation validateGlobPattern(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return reject(pattern, null, FileOperation.VALIDATE, SecurityEvent.Kind.INVALID_PATH,
                    SecurityEvent.Severity.LOW, "Glob pattern is empty");
        }
        if (TRAVERSAL.matcher(pattern).find()) {
            return reject(pattern, null, FileOperation.VALIDATE, SecurityEvent.Kind.PATH_TRAVERSAL_ATTEMPT,
                    SecurityEvent.Severity.CRITICAL, "Path traversal sequence in glob pattern");
        }
        String normalized = pattern.replace('\\', '/');
        if (normalized.startsWith("/")) {
            int firstWildcard = indexOfWildcard(normalized);
            String prefix = firstWildcard < 0 ? normalized : normalized.substring(0, normalized.lastIndexOf('/', firstWildcard) + 1);
            Path root = Path.of(prefix.isEmpty() ? "/" : prefix).normalize();
            boolean inside = allowedBases.stream().anyMatch(root::startsWith);
            if (!inside) {
                return reject(pattern, root, FileOperation.VALIDATE, SecurityEvent.Kind.UNAUTHORIZED_PATH_ACCESS,
                        SecurityEvent.Severity.HIGH, "Glob pattern reaches outside the allowed base directories");
            }
        }
        try {
            FileSystems.getDefault().getPathMatcher("glob:" + normalized);
        } catch (IllegalArgumentException e) {
            return reject(pattern, null, FileOperation.VALIDATE, SecurityEvent.Kind.INVALID_PATH,
                    SecurityEvent.Severity.LOW, "Malformed glob pattern: " + e.getMessage());
        }
        return PathValidation.accepted(null);
    }

    // --- Content ---

    public String sanitizeContent(String content) {
        return sanitizeContent(content, "content");
    }

    /**
     * Removes control characters (tab, newline and carriage return survive) and
     * replaces script-injection patterns with {@value #SANITIZED_PLACEHOLDER}.
     *
     * @param source where the content came from, used only for the audit trail
     */
    public String sanitizeContent(String content, String source) {
        if (content == null || content.isEmpty()) {
            return content;
        }
        String result = CONTENT_CONTROL_CHARS.matcher(content).replaceAll("");
        for (InjectionRule rule : INJECTION_RULES) {
            Matcher matcher = rule.pattern().matcher(result);
            if (matcher.find()) {
                result = matcher.replaceAll(rule.replacement());
                record(SecurityEvent.Kind.INJECTION_ATTEMPT, SecurityEvent.Severity.HIGH, FileOperation.VALIDATE,
                        source, null, "Neutralized " + rule.name());
            }
        }
        return result;
    }

    // --- Audit ---

    public List<SecurityEvent> auditEvents(SecurityEvent.Severity severity, int limit) {
        return auditLog.query(severity, limit);
    }

    public SecurityReport report() {
        List<SecurityEvent> events = auditLog.all();
        long critical = events.stream().filter(e -> e.severity() == SecurityEvent.Severity.CRITICAL).count();
        long high = events.stream().filter(e -> e.severity() == SecurityEvent.Severity.HIGH).count();
        long traversal = events.stream().filter(e -> e.kind() == SecurityEvent.Kind.PATH_TRAVERSAL_ATTEMPT).count();
        long injection = events.stream().filter(e -> e.kind() == SecurityEvent.Kind.INJECTION_ATTEMPT).count();
        List<SecurityEvent> recent = events.size() > 50 ? events.subList(events.size() - 50, events.size()) : events;
        return new SecurityReport(List.copyOf(recent), events.size(), critical, high, traversal, injection);
    }

    public List<Path> allowedBases() {
        return allowedBases;
    }

    // --- Internals ---

    private PathValidation reject(String rawPath, Path resolved, FileOperation operation,
                                  SecurityEvent.Kind kind, SecurityEvent.Severity severity, String violation) {
        SecurityEvent event = record(kind, severity, operation, rawPath,
                resolved != null ? resolved.toString() : null, violation);
        return PathValidation.rejected(resolved, violation, event);
    }

    private SecurityEvent record(SecurityEvent.Kind kind, SecurityEvent.Severity severity, FileOperation operation,
                                 String originalPath, String resolvedPath, String detail) {
        SecurityEvent event = new SecurityEvent(Instant.now(clock), kind, severity, operation,
                originalPath, resolvedPath, detail);
        auditLog.append(event);
        switch (severity) {
            case CRITICAL -> audit.error("{} [{}] {} {}: {}", kind, severity, operation, originalPath, detail);
            case HIGH -> audit.warn("{} [{}] {} {}: {}", kind, severity, operation, originalPath, detail);
            default -> audit.info("{} [{}] {} {}: {}", kind, severity, operation, originalPath, detail);
        }
        if (metrics != null) {
            metrics.recordSecurityEvent(kind.name().toLowerCase(Locale.ROOT), severity.name().toLowerCase(Locale.ROOT));
        }
        return event;
    }

    private String matchRestricted(Path resolved) {
        for (String entry : properties.getRestrictedPaths()) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            if (entry.contains("*")) {
                PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + entry);
                for (Path p = resolved; p != null; p = p.getParent()) {
                    if (matcher.matches(p)) {
                        return entry;
                    }
                }
            } else if (resolved.startsWith(Path.of(entry).toAbsolutePath().normalize())) {
                return entry;
            }
        }
        return null;
    }

    /**
     * Walks from the base down to the target and refuses any existing component
     * that is a symbolic link, so a write cannot create files through a linked
     * parent directory. The nearest existing ancestor must also really live under the base.
     */
    private String checkSymlink(Path resolved, Path base) {
        Path current = base;
        Path nearestExisting = Files.exists(base, LinkOption.NOFOLLOW_LINKS) ? base : null;
        for (Path name : base.relativize(resolved)) {
            current = current.resolve(name);
            if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
                break;
            }
            if (Files.isSymbolicLink(current)) {
                return current.equals(resolved)
                        ? "Symbolic links are not allowed"
                        : "Path passes through symbolic link " + current;
            }
            nearestExisting = current;
        }
        if (nearestExisting == null) {
            return null;
        }
        try {
            if (!nearestExisting.toRealPath().startsWith(base.toRealPath())) {
                return "Path escapes its base directory through a symbolic link";
            }
        } catch (IOException e) {
            return "Real path cannot be resolved: " + e.getMessage();
        }
        return null;
    }

    /**
     * True when the file name carries an allowed extension, or no allow-list is configured.
     */
    public boolean hasAllowedExtension(Path path) {
        List<String> allowed = properties.getAllowedExtensions();
        if (allowed == null || allowed.isEmpty()) {
            return true;
        }
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        String extension = name.substring(dot);
        return allowed.stream().anyMatch(ext -> ext.equalsIgnoreCase(extension));
    }

    private static int indexOfWildcard(String pattern) {
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '*' || c == '?' || c == '[' || c == '{') {
                return i;
            }
        }
        return -1;
    }

    private static List<Path> resolveBases(List<String> configured) {
        List<Path> bases = new ArrayList<>();
        if (configured != null) {
            for (String base : configured) {
                if (base != null && !base.isBlank()) {
                    bases.add(Path.of(base).toAbsolutePath().normalize());
                }
            }
        }
        if (bases.isEmpty()) {
            bases.add(Path.of("").toAbsolutePath().normalize());
        }
        return List.copyOf(bases);
    }

    private record InjectionRule(String name, Pattern pattern, String replacement) {}
}
