package com.polydoc.exception;

import java.util.Arrays;
import java.util.stream.Collectors;

/** Helpers for turning exceptions into log- and document-friendly text. */
public final class ExceptionUtil {
  static final int DEFAULT_FRAMES = 10;

  private ExceptionUtil() {}

  /** Code and context survive for {@link PolydocException}; anything else is {@code UNKNOWN}. */
  public static ErrorDetails toErrorDetails(Throwable t) {
    String type = t.getClass().getSimpleName();
    if (t instanceof PolydocException ex) {
      return new ErrorDetails(type, ex.getMessage(), ex.getCode(), ex.getContext());
    }
    return new ErrorDetails(type, t.getMessage(), PolydocErrorCode.UNKNOWN, null);
  }

  /**
   * The top {@code maxFrames} frames of {@code t} on one line, innermost first, e.g. {@code
   * Snippet_1.run (Snippet_1.java:4) > Runner.main (Runner.java:10)}. A non-positive limit keeps
   * every frame; {@code null} yields the empty string.
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) {
      return "";
    }
    StackTraceElement[] frames = t.getStackTrace();
    return Arrays.stream(frames)
        .limit(maxFrames > 0 ? maxFrames : frames.length)
        .map(ExceptionUtil::frame)
        .collect(Collectors.joining(" > "));
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, DEFAULT_FRAMES);
  }

  /** Message of the deepest cause, or the class name when no message is available. */
  public static String rootMessage(Throwable t) {
    Throwable current = t;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    String message = current.getMessage();
    return message == null || message.isBlank() ? current.getClass().getSimpleName() : message;
  }

  private static String frame(StackTraceElement e) {
    String file = e.getFileName() == null ? "Unknown Source" : e.getFileName();
    String line = e.getLineNumber() >= 0 ? ":" + e.getLineNumber() : "";
    return e.getClassName() + "." + e.getMethodName() + " (" + file + line + ")";
  }
}
