package com.polydoc.converter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.polydoc.exception.ConversionException;

/** Turns markup text into a document AST. Implementations throw {@link ConversionException}. */
public interface DocumentConverter {

  /** Full document: {@code {"pandoc-api-version": ..., "meta": ..., "blocks": [...]}}. */
  JsonNode toAst(String markup);

  /** Just the top-level blocks of {@link #toAst}. */
  default ArrayNode toBlocks(String markup) {
    JsonNode blocks = toAst(markup).get("blocks");
    if (blocks == null || !blocks.isArray()) {
      throw new ConversionException("Converter output has no 'blocks' list");
    }
    return (ArrayNode) blocks;
  }
}
