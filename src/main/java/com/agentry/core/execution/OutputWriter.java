package com.agentry.core.execution;

import com.agentry.core.model.OutputFormat;
import com.agentry.core.security.SecurityGate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Renders agent output in the requested format, sanitized, and writes it
 * through the {@link SecurityGate}.
 */
@Component
public class OutputWriter {

    private static final Pattern UNSAFE_KEY_CHARS = Pattern.compile("[^A-Za-z0-9_]");
    private static final Pattern MARKDOWN_HEADING = Pattern.compile("(?m)^#{1,6}\\s");

    private final SecurityGate gate;
    private final ObjectMapper mapper;

    public OutputWriter(SecurityGate gate, ObjectMapper mapper) {
        this.gate = gate;
        this.mapper = mapper;
    }

    public Path write(String outputPath, String output, OutputFormat format) throws IOException {
        return gate.secureWrite(outputPath, render(output, format, outputPath));
    }

    /**
     * @param source label recorded with any injection events
     */
    public String render(String output, OutputFormat format, String source) {
        String text = output == null ? "" : output;
        return switch (format == null ? OutputFormat.TEXT : format) {
            case TEXT -> gate.sanitizeContent(text, source);
            case JSON -> renderJson(text, source);
            case MARKDOWN -> renderMarkdown(text, source);
        };
    }

    private String renderJson(String text, String source) {
        JsonNode node;
        try {
            node = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            node = null;
        }
        if (node == null || node.isMissingNode()) {
            ObjectNode wrapper = mapper.createObjectNode();
            wrapper.put("output", gate.sanitizeContent(text, source));
            node = wrapper;
        } else {
            node = sanitizeNode(node, source);
        }
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize sanitized JSON output", e);
        }
    }

    private JsonNode sanitizeNode(JsonNode node, String source) {
        if (node.isTextual()) {
            return TextNode.valueOf(gate.sanitizeContent(node.asText(), source));
        }
        if (node.isArray()) {
            ArrayNode array = mapper.createArrayNode();
            for (JsonNode element : node) {
                array.add(sanitizeNode(element, source));
            }
            return array;
        }
        if (node.isObject()) {
            ObjectNode object = mapper.createObjectNode();
            List<Map.Entry<String, JsonNode>> fields = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            it.forEachRemaining(fields::add);
            for (Map.Entry<String, JsonNode> field : fields) {
                String key = UNSAFE_KEY_CHARS.matcher(field.getKey()).replaceAll("_");
                object.set(key, sanitizeNode(field.getValue(), source));
            }
            return object;
        }
        return node;
    }

    private String renderMarkdown(String text, String source) {
        String sanitized = gate.sanitizeContent(text, source)
                .replace("<", "&lt;")
                .replace(">", "&gt;");
        if (!MARKDOWN_HEADING.matcher(sanitized).find()) {
            sanitized = "# Agent Output\n\n" + sanitized;
        }
        return sanitized;
    }
}
