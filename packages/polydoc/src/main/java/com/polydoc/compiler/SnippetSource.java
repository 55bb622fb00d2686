package com.polydoc.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Java source generated around a snippet body.
 *
 * <p>The body becomes a method with a {@code Map<String, Object> state} parameter, declared to
 * throw {@code Exception}, inside a class implementing {@code Function<Map<String, Object>,
 * Object>}. Leading {@code import} lines of the body are moved to the top of the file; {@code
 * java.util}, {@code java.util.function} and {@code java.util.stream} are always imported.
 *
 * @param firstBodyLine line of the generated file holding the first line of the body
 */
public record SnippetSource(String className, String code, int firstBodyLine) {

  private static final Pattern IMPORT_LINE =
      Pattern.compile("^\\s*import\\s+(static\\s+)?[\\w.]+(\\.\\*)?\\s*;\\s*$");
  private static final List<String> DEFAULT_IMPORTS =
      List.of("java.util.*", "java.util.function.*", "java.util.stream.*");

  /**
   * @param appendReturn add {@code return null;} after the body, for bodies that do not return
   */
  public static SnippetSource wrap(String className, String body, boolean appendReturn) {
    List<String> imports = new ArrayList<>();
    DEFAULT_IMPORTS.forEach(i -> imports.add("import " + i + ";"));

    String[] lines = body.split("\\R", -1);
    int start = 0;
    while (start < lines.length
        && (lines[start].isBlank() || IMPORT_LINE.matcher(lines[start]).matches())) {
      if (!lines[start].isBlank()) imports.add(lines[start].trim());
      start++;
    }

    StringBuilder src = new StringBuilder();
    imports.forEach(i -> src.append(i).append('\n'));
    src.append('\n')
        .append("public class ")
        .append(className)
        .append(" implements Function<Map<String, Object>, Object> {\n")
        .append("  @Override\n")
        .append("  public Object apply(Map<String, Object> state) {\n")
        .append("    try {\n")
        .append("      return run(state);\n")
        .append("    } catch (RuntimeException e) {\n")
        .append("      throw e;\n")
        .append("    } catch (Exception e) {\n")
        .append("      throw new RuntimeException(e);\n")
        .append("    }\n")
        .append("  }\n\n")
        .append("  private Object run(Map<String, Object> state) throws Exception {\n");
    int firstBodyLine = (int) src.chars().filter(c -> c == '\n').count() + 1;
    for (int i = start; i < lines.length; i++) {
      src.append(lines[i]).append('\n');
    }
    if (appendReturn) {
      src.append("return null;\n");
    }
    src.append("  }\n}\n");
    return new SnippetSource(className, src.toString(), firstBodyLine - start);
  }

  /** Line number of the original body for a line of the generated file. */
  public long bodyLine(long generatedLine) {
    return generatedLine - firstBodyLine + 1;
  }
}
