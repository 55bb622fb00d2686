package com.polydoc.ast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Recognizes, reads and builds nodes in their raw JSON form.
 *
 * <p>Any JSON object carrying a {@code "t"} field is a node. Other values (arrays, plain objects,
 * scalars) are opaque: the walker recurses into them but never dispatches on them.
 */
public final class AstNodes {
  public static final String TYPE_FIELD = "t";
  public static final String CONTENT_FIELD = "c";

  private static final JsonNodeFactory F = JsonNodeFactory.instance;

  private AstNodes() {}

  public static boolean isNode(JsonNode value) {
    return value != null && value.isObject() && value.has(TYPE_FIELD);
  }

  /** Callers must check {@link #isNode} first. */
  public static String typeOf(JsonNode node) {
    return node.get(TYPE_FIELD).asText();
  }

  /** The {@code "c"} payload, or {@code null} for content-less nodes. */
  public static JsonNode contentOf(JsonNode node) {
    return node.get(CONTENT_FIELD);
  }

  /** Builds {@code {"t": type, "c": content}}; {@code "c"} is omitted when content is null. */
  public static ObjectNode makeNode(String type, JsonNode content) {
    ObjectNode node = F.objectNode();
    node.put(TYPE_FIELD, type);
    if (content != null) {
      node.set(CONTENT_FIELD, content);
    }
    return node;
  }

  /** Inline list holding a single {@code Str}. */
  public static ArrayNode text(String value) {
    return F.arrayNode().add(makeNode(Str.TYPE, F.textNode(value)));
  }

  /** Root document {@code {"pandoc-api-version": [...], "meta": {}, "blocks": [...]}}. */
  public static ObjectNode document(ArrayNode blocks) {
    ObjectNode doc = F.objectNode();
    doc.set("pandoc-api-version", F.arrayNode().add(1).add(23).add(1));
    doc.set("meta", F.objectNode());
    doc.set("blocks", blocks);
    return doc;
  }
}
