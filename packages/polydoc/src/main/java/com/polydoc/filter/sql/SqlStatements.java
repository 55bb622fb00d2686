package com.polydoc.filter.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a script into statements on {@code ;}. Semicolons inside quoted strings, quoted
 * identifiers and comments do not split. Blank statements are dropped.
 *
 * <p>Does not understand {@code BEGIN ... END} bodies of triggers.
 */
final class SqlStatements {
  private SqlStatements() {}

  static List<String> split(String script) {
    List<String> statements = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    int n = script.length();
    int i = 0;
    while (i < n) {
      char c = script.charAt(i);
      if (c == '\'' || c == '"' || c == '`') {
        int end = closing(script, i + 1, c);
        current.append(script, i, end);
        i = end;
      } else if (c == '-' && i + 1 < n && script.charAt(i + 1) == '-') {
        int end = script.indexOf('\n', i);
        end = end < 0 ? n : end;
        current.append(script, i, end);
        i = end;
      } else if (c == '/' && i + 1 < n && script.charAt(i + 1) == '*') {
        int end = script.indexOf("*/", i + 2);
        end = end < 0 ? n : end + 2;
        current.append(script, i, end);
        i = end;
      } else if (c == ';') {
        add(statements, current);
        current.setLength(0);
        i++;
      } else {
        current.append(c);
        i++;
      }
    }
    add(statements, current);
    return statements;
  }

  // index just past the closing quote; a doubled quote is an escaped one
  private static int closing(String script, int from, char quote) {
    int i = from;
    while (i < script.length()) {
      if (script.charAt(i) == quote) {
        if (i + 1 < script.length() && script.charAt(i + 1) == quote) {
          i += 2;
          continue;
        }
        return i + 1;
      }
      i++;
    }
    return script.length();
  }

  private static void add(List<String> statements, StringBuilder statement) {
    String s = statement.toString().trim();
    if (!s.isEmpty() && !isOnlyComments(s)) {
      statements.add(s);
    }
  }

  private static boolean isOnlyComments(String s) {
    return s.replaceAll("(?s)/\\*.*?\\*/", "").replaceAll("(?m)--.*$", "").isBlank();
  }
}
