package com.polydoc.ast;

import com.fasterxml.jackson.databind.node.ArrayNode;
import java.util.Objects;

public record Para(ArrayNode inlines) implements Node {
  public static final String TYPE = "Para";

  public Para {
    Objects.requireNonNull(inlines, "inlines must not be null");
  }

  @Override
  public String type() {
    return TYPE;
  }
}
