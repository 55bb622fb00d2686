package com.polydoc.filter.include;

import java.util.Optional;

/** How an included file's content is rendered, selected by the {@code mode} attribute. */
public enum IncludeMode {
  /** Convert the file to blocks and splice them in; nested includes are expanded. */
  PARSE("parse"),
  /** Show the file verbatim in a code block. */
  CODE("code"),
  /** Pass the file through as an unprocessed raw block. */
  RAW("raw");

  private final String attributeValue;

  IncludeMode(String attributeValue) {
    this.attributeValue = attributeValue;
  }

  public String attributeValue() {
    return attributeValue;
  }

  public static Optional<IncludeMode> fromAttribute(String value) {
    for (IncludeMode mode : values()) {
      if (mode.attributeValue.equals(value)) return Optional.of(mode);
    }
    return Optional.empty();
  }
}
