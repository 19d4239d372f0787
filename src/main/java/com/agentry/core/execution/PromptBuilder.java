package com.agentry.core.execution;

import com.agentry.core.context.ContextFile;
import com.agentry.core.context.ContextSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Map;

/**
 * Renders prepared context and variables as the markdown sections an agent receives.
 */
final class PromptBuilder {

    private PromptBuilder() {}

    static String context(List<ContextSnapshot> snapshots, Map<String, Object> variables, ObjectMapper mapper) {
        var sb = new StringBuilder();
        boolean hasFiles = snapshots.stream().anyMatch(s -> s.fileCount() > 0);
        if (hasFiles) {
            sb.append("## Context\n\n");
            for (ContextSnapshot snapshot : snapshots) {
                for (ContextFile file : snapshot.files()) {
                    sb.append("### ").append(file.name()).append("\n\n")
                      .append("```\n").append(file.content());
                    if (!file.content().endsWith("\n")) {
                        sb.append('\n');
                    }
                    sb.append("```\n\n");
                }
            }
        }
        if (variables != null && !variables.isEmpty()) {
            sb.append("## Variables\n\n```json\n");
            try {
                sb.append(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(variables));
            } catch (JsonProcessingException e) {
                sb.append(variables);
            }
            sb.append("\n```\n");
        }
        return sb.toString();
    }

    static String full(String task, String context) {
        return "## Task\n\n" + task + "\n\n" + context;
    }
}
