package com.agentry.core.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TemplateRendererTest {

    @Test
    @DisplayName("substitutes known placeholders and keeps unknown ones")
    void render() {
        String rendered = TemplateRenderer.render("Review {{ target }} for {{team}} by {{deadline}}",
                Map.of("target", "the parser", "team", "core"));

        assertEquals("Review the parser for core by {{deadline}}", rendered);
    }

    @Test
    @DisplayName("joins collections and renders null as empty")
    void formatsValues() {
        Map<String, Object> vars = new HashMap<>();
        vars.put("files", List.of("a.java", "b.java"));
        vars.put("note", null);
        vars.put("count", 3);

        assertEquals("Check a.java, b.java (3) []", TemplateRenderer.render("Check {{files}} ({{count}}) [{{note}}]", vars));
    }

    @Test
    @DisplayName("replacement text is taken literally")
    void literalReplacement() {
        assertEquals("cost $5 \\o/", TemplateRenderer.render("cost {{price}}", Map.of("price", "$5 \\o/")));
    }

    @Test
    @DisplayName("lists placeholder names once each")
    void placeholders() {
        assertEquals(Set.of("a", "b"), TemplateRenderer.placeholders("{{a}} {{b}} {{a}}"));
        assertTrue(TemplateRenderer.placeholders(null).isEmpty());
    }
}
