package com.polydoc.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Structured view of a failure, as written to the diagnostics log. */
public record ErrorDetails(
    String type, String message, PolydocErrorCode code, Map<String, Object> context) {

  public ErrorDetails {
    message = message == null ? "" : message;
    context =
        context == null || context.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  /** Key/value suffix for log lines; empty when there is no context. */
  public String contextSuffix() {
    return context.isEmpty() ? "" : " " + context;
  }
}
