package com.agentry.core.scheduler;

import com.agentry.core.model.Recipe;
import com.agentry.core.model.Step;
import com.agentry.core.model.VariableDefinition;
import com.agentry.core.model.VariableType;
import com.agentry.core.security.SecurityGate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a recipe document in JSON form. Field names follow the recipe model;
 * {@code agent}, {@code task} and {@code variables} are accepted as short forms.
 * Only the document shape is checked here; {@link RecipeValidator} checks the rest.
 */
@Component
public class JsonRecipeLoader {

    private final SecurityGate gate;
    private final ObjectMapper mapper;

    public JsonRecipeLoader(SecurityGate gate, ObjectMapper mapper) {
        this.gate = gate;
        this.mapper = mapper;
    }

    public Recipe load(String path) throws IOException {
        return parse(gate.secureRead(path));
    }

    public Recipe parse(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RecipeValidationException("Recipe document is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new RecipeValidationException(List.of("Recipe document must be a JSON object"));
        }

        Map<String, VariableDefinition> variables = new LinkedHashMap<>();
        JsonNode vars = root.path("variables");
        if (vars.isObject()) {
            var fields = vars.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                variables.put(field.getKey(), parseVariable(field.getKey(), field.getValue()));
            }
        }

        return new Recipe(
                text(root, "name"),
                text(root, "description"),
                text(root, "version"),
                stringList(root.path("tags")),
                variables,
                parseSteps(root.path("steps")),
                parseSteps(root.path("cleanup")));
    }

    private VariableDefinition parseVariable(String name, JsonNode node) {
        if (!node.isObject()) {
            throw new RecipeValidationException(List.of("Variable '" + name + "' must be an object"));
        }
        VariableType type;
        try {
            type = node.hasNonNull("type") ? VariableType.fromCode(node.get("type").asText()) : VariableType.STRING;
        } catch (IllegalArgumentException e) {
            throw new RecipeValidationException(List.of("Variable '" + name + "' has unknown type "
                    + node.get("type").asText()));
        }
        Object defaultValue = node.hasNonNull("default") ? mapper.convertValue(node.get("default"), Object.class) : null;
        return new VariableDefinition(type, text(node, "description"), defaultValue,
                node.path("required").asBoolean(false));
    }

    private List<Step> parseSteps(JsonNode array) {
        List<Step> steps = new ArrayList<>();
        if (array.isMissingNode() || array.isNull()) {
            return steps;
        }
        if (!array.isArray()) {
            throw new RecipeValidationException(List.of("Steps must be a JSON array"));
        }
        for (JsonNode node : array) {
            String agent = node.hasNonNull("agentName") ? text(node, "agentName") : text(node, "agent");
            String task = node.hasNonNull("taskTemplate") ? text(node, "taskTemplate") : text(node, "task");
            JsonNode overrides = node.has("variableOverrides") ? node.get("variableOverrides") : node.path("variables");
            Map<String, Object> overrideMap = overrides.isObject()
                    ? mapper.convertValue(overrides, new TypeReference<LinkedHashMap<String, Object>>() {})
                    : Map.of();
            Duration timeout = node.hasNonNull("timeoutSeconds")
                    ? Duration.ofSeconds(node.get("timeoutSeconds").asLong())
                    : null;
            Boolean parallel = node.hasNonNull("parallel") ? node.get("parallel").asBoolean() : null;
            steps.add(new Step(text(node, "id"), agent, task, stringList(node.path("contextRefs")),
                    overrideMap, stringList(node.path("dependsOn")), parallel, timeout));
        }
        return steps;
    }

    private static String text(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(n -> values.add(n.asText()));
        } else if (node.isTextual() && !node.asText().isBlank()) {
            values.add(node.asText());
        }
        return values;
    }
}
