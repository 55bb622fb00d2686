package com.polydoc.ast;

import com.fasterxml.jackson.databind.node.ArrayNode;
import java.util.Objects;

/** A grouping container: {@code {"t": "Div", "c": [attr, [block, ...]]}}. */
public record Div(Attr attr, ArrayNode blocks) implements Node {
  public static final String TYPE = "Div";

  public Div {
    Objects.requireNonNull(attr, "attr must not be null");
    Objects.requireNonNull(blocks, "blocks must not be null");
  }

  @Override
  public String type() {
    return TYPE;
  }
}
