package com.polydoc.ast;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Any node kind without a dedicated record. {@code content} is the raw {@code "c"} payload, or
 * {@code null} for content-less nodes such as {@code Space}.
 */
public record GenericNode(String type, JsonNode content) implements Node {
  public GenericNode {
    Objects.requireNonNull(type, "type must not be null");
  }
}
