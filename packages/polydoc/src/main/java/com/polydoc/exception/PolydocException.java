package com.polydoc.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Root of every failure polydoc raises itself. Carries a {@link PolydocErrorCode} for logs and an
 * optional, insertion-ordered context map (exit codes, paths, filter names).
 */
public class PolydocException extends RuntimeException {
  private final PolydocErrorCode code;
  private final Map<String, Object> context;

  public PolydocException(PolydocErrorCode code, String message) {
    this(code, message, null, null);
  }

  public PolydocException(PolydocErrorCode code, String message, Throwable cause) {
    this(code, message, null, cause);
  }

  public PolydocException(PolydocErrorCode code, String message, Map<String, ?> context) {
    this(code, message, context, null);
  }

  public PolydocException(
      PolydocErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context =
        context == null || context.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(context));
  }

  public PolydocErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return context;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName());
    sb.append('[').append(code).append("] ").append(getMessage());
    if (!context.isEmpty()) {
      sb.append(' ').append(context);
    }
    return sb.toString();
  }
}
