package com.polydoc.filter.include;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.polydoc.ast.Attr;
import com.polydoc.ast.CodeBlock;
import com.polydoc.ast.Div;
import com.polydoc.ast.RawBlock;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** Builders for the nodes the include filter emits. */
final class IncludeBlocks {
  static final String ERROR_CLASS = "include-error";
  static final String INCLUDED_CLASS = "included";
  static final String SOURCE_ATTRIBUTE = "source";

  private IncludeBlocks() {}

  static CodeBlock error(String requestedPath, String message) {
    return new CodeBlock(
        Attr.ofClasses(ERROR_CLASS), "ERROR including file: " + requestedPath + "\n" + message);
  }

  static CodeBlock code(String content, String language) {
    List<String> classes = language == null || language.isBlank() ? List.of() : List.of(language);
    return new CodeBlock(new Attr("", classes, List.of()), content);
  }

  static RawBlock raw(String content, String format) {
    return new RawBlock(format, content);
  }

  static Div included(Path source, ArrayNode blocks) {
    Attr attr =
        new Attr(
            "", List.of(INCLUDED_CLASS), List.of(Map.entry(SOURCE_ATTRIBUTE, source.toString())));
    return new Div(attr, blocks);
  }
}
