package com.agentry.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "agentry.security")
public class SecurityProperties {

    /** Base directories every resolved path must live under. Empty means the working directory. */
    private List<String> allowedBasePaths = new ArrayList<>();
    private List<String> allowedExtensions = new ArrayList<>(List.of(
            ".md", ".ts", ".js", ".json", ".yaml", ".yml", ".txt", ".java", ".xml", ".properties"));
    private long maxFileSizeBytes = 10L * 1024 * 1024;
    private int maxDepth = 10;
    private List<String> restrictedPaths = new ArrayList<>(List.of(
            "/etc", "/bin", "/sbin", "/usr/bin", "/usr/sbin", "/proc", "/sys", "/dev",
            "/root/.ssh", "/root/.config", "/home/*/.ssh", "/home/*/.config"));
    private boolean allowSymlinks = false;
    private int auditLogCapacity = 1000;

    public List<String> getAllowedBasePaths() {
        return allowedBasePaths;
    }

    public void setAllowedBasePaths(List<String> allowedBasePaths) {
        this.allowedBasePaths = allowedBasePaths;
    }

    public List<String> getAllowedExtensions() {
        return allowedExtensions;
    }

    public void setAllowedExtensions(List<String> allowedExtensions) {
        this.allowedExtensions = allowedExtensions;
    }

    public long getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    public void setMaxFileSizeBytes(long maxFileSizeBytes) {
        this.maxFileSizeBytes = maxFileSizeBytes;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public List<String> getRestrictedPaths() {
        return restrictedPaths;
    }

    public void setRestrictedPaths(List<String> restrictedPaths) {
        this.restrictedPaths = restrictedPaths;
    }

    public boolean isAllowSymlinks() {
        return allowSymlinks;
    }

    public void setAllowSymlinks(boolean allowSymlinks) {
        this.allowSymlinks = allowSymlinks;
    }

    public int getAuditLogCapacity() {
        return auditLogCapacity;
    }

    public void setAuditLogCapacity(int auditLogCapacity) {
        this.auditLogCapacity = auditLogCapacity;
    }
}
