package com.polydoc.ast;

import java.util.Objects;

/** Content passed through unprocessed: {@code {"t": "RawBlock", "c": [format, text]}}. */
public record RawBlock(String format, String text) implements Node {
  public static final String TYPE = "RawBlock";

  public RawBlock {
    Objects.requireNonNull(format, "format must not be null");
    Objects.requireNonNull(text, "text must not be null");
  }

  @Override
  public String type() {
    return TYPE;
  }
}
