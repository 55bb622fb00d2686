package com.polydoc.ast;

import java.util.Objects;

/** A fenced or indented code block: {@code {"t": "CodeBlock", "c": [attr, text]}}. */
public record CodeBlock(Attr attr, String text) implements Node {
  public static final String TYPE = "CodeBlock";

  public CodeBlock {
    Objects.requireNonNull(attr, "attr must not be null");
    Objects.requireNonNull(text, "text must not be null");
  }

  @Override
  public String type() {
    return TYPE;
  }
}
