package com.agentry.core.context;

/**
 * @param name    path relative to the context root, or the file name for a single-file context
 * @param content sanitized file content
 */
public record ContextFile(String name, String content) {}
