package com.polydoc.ast;

import com.fasterxml.jackson.databind.node.ArrayNode;
import java.util.Objects;

/** A heading: {@code {"t": "Header", "c": [level, attr, [inline, ...]]}}. */
public record Header(int level, Attr attr, ArrayNode inlines) implements Node {
  public static final String TYPE = "Header";

  public Header {
    Objects.requireNonNull(attr, "attr must not be null");
    Objects.requireNonNull(inlines, "inlines must not be null");
  }

  @Override
  public String type() {
    return TYPE;
  }
}
