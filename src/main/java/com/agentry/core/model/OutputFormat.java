package com.agentry.core.model;

import java.util.Locale;

public enum OutputFormat {
    TEXT, JSON, MARKDOWN;

    public static OutputFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return TEXT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "json" -> JSON;
            case "markdown", "md" -> MARKDOWN;
            case "text", "txt" -> TEXT;
            default -> throw new IllegalArgumentException("Unknown output format: " + value);
        };
    }
}
