package com.polydoc.utility;

import java.util.stream.Collectors;

public final class StringUtility {
  private StringUtility() {}

  /** Prefixes each line of {@code text} with {@code width} spaces; line endings become LF. */
  public static String indent(String text, int width) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    String prefix = " ".repeat(Math.max(0, width));
    return text.lines().map(prefix::concat).collect(Collectors.joining("\n"));
  }

  /** Left-aligns {@code value} in a field of {@code width} characters. */
  public static String padRight(String value, int width) {
    return value.length() >= width ? value : value + " ".repeat(width - value.length());
  }
}
