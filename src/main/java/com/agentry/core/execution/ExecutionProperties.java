package com.agentry.core.execution;

import com.agentry.core.model.FailurePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "agentry.execution")
public class ExecutionProperties {

    /** Admission slots for one batch. */
    private int maxParallel = 3;
    private long defaultTimeoutSeconds = 300;
    /** Whole-batch deadline; 0 disables it. */
    private long batchTimeoutSeconds = 0;
    private FailurePolicy failurePolicy = FailurePolicy.CONTINUE;
    private int contextMaxFiles = 10;

    public int getMaxParallel() {
        return maxParallel;
    }

    public void setMaxParallel(int maxParallel) {
        this.maxParallel = maxParallel;
    }

    public long getDefaultTimeoutSeconds() {
        return defaultTimeoutSeconds;
    }

    public void setDefaultTimeoutSeconds(long defaultTimeoutSeconds) {
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
    }

    public long getBatchTimeoutSeconds() {
        return batchTimeoutSeconds;
    }

    public void setBatchTimeoutSeconds(long batchTimeoutSeconds) {
        this.batchTimeoutSeconds = batchTimeoutSeconds;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    public void setFailurePolicy(FailurePolicy failurePolicy) {
        this.failurePolicy = failurePolicy;
    }

    public int getContextMaxFiles() {
        return contextMaxFiles;
    }

    public void setContextMaxFiles(int contextMaxFiles) {
        this.contextMaxFiles = contextMaxFiles;
    }

    public Duration defaultTimeout() {
        return Duration.ofSeconds(defaultTimeoutSeconds);
    }

    public Duration batchTimeout() {
        return batchTimeoutSeconds > 0 ? Duration.ofSeconds(batchTimeoutSeconds) : null;
    }
}
