package com.polydoc.compiler;

/**
 * @param errors compiler diagnostics, one per line, with line numbers relative to the snippet
 *     body; {@code null} on success
 */
public record CompilationResult(boolean success, String className, String errors) {}
