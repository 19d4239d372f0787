package com.agentry.runtime;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * External command backing the process agent runtime. Each argument may use
 * the {@code {agent}} placeholder, replaced by the agent name.
 */
@Component
@ConfigurationProperties(prefix = "agentry.runtime")
public class RuntimeProperties {

    private List<String> command = new ArrayList<>();
    private String workingDirectory;

    public List<String> getCommand() {
        return command;
    }

    public void setCommand(List<String> command) {
        this.command = command;
    }

    public String getWorkingDirectory() {
        return workingDirectory;
    }

    public void setWorkingDirectory(String workingDirectory) {
        this.workingDirectory = workingDirectory;
    }
}
