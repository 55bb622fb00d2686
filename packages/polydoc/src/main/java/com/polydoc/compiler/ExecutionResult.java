package com.polydoc.compiler;

/**
 * Outcome of running a compiled snippet.
 *
 * @param output everything the snippet printed to stdout
 * @param value the snippet's return value rendered with {@link String#valueOf(Object)}, or {@code
 *     null} if it failed
 * @param error description of the failure, or {@code null} on success
 */
public record ExecutionResult(boolean success, String output, String value, String error) {}
