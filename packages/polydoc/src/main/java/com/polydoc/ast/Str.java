package com.polydoc.ast;

import java.util.Objects;

public record Str(String text) implements Node {
  public static final String TYPE = "Str";

  public Str {
    Objects.requireNonNull(text, "text must not be null");
  }

  @Override
  public String type() {
    return TYPE;
  }
}
