package com.polydoc.ast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Postorder traversal over arbitrary JSON.
 *
 * <p>Every array and object is descended into, whether or not it is a node. Once a node's children
 * have been walked (and possibly replaced), the node is decoded and handed to the transform, whose
 * result takes its place in the parent:
 *
 * <ul>
 *   <li>the same {@link Node} instance keeps the JSON value as it is;
 *   <li>a different node replaces it with that node's encoding;
 *   <li>{@code null} removes it: dropped from an enclosing array, JSON {@code null} in an object
 *       member or at the root.
 * </ul>
 *
 * <p>The input is never mutated. Containers whose children all came back unchanged are reused, so
 * anything the transform does not touch is carried over exactly.
 */
public final class TreeWalker {
  private static final JsonNodeFactory F = JsonNodeFactory.instance;

  private TreeWalker() {}

  public static JsonNode walk(UnaryOperator<Node> transform, JsonNode root) {
    Objects.requireNonNull(transform, "transform must not be null");
    Objects.requireNonNull(root, "root must not be null");
    JsonNode result = visit(transform, root);
    return result == null ? NullNode.getInstance() : result;
  }

  /** Read-only traversal returning, in postorder, every node accepted by {@code predicate}. */
  public static List<Node> collect(JsonNode ast, Predicate<Node> predicate) {
    List<Node> matches = new ArrayList<>();
    walk(
        node -> {
          if (predicate.test(node)) matches.add(node);
          return node;
        },
        ast);
    return matches;
  }

  public static List<Node> collect(JsonNode ast, String type) {
    return collect(ast, node -> node.type().equals(type));
  }

  private static JsonNode visit(UnaryOperator<Node> transform, JsonNode value) {
    if (value.isArray()) {
      return visitArray(transform, (ArrayNode) value);
    }
    if (value.isObject()) {
      ObjectNode walked = visitObject(transform, (ObjectNode) value);
      return AstNodes.isNode(walked) ? dispatch(transform, walked) : walked;
    }
    return value;
  }

  private static JsonNode dispatch(UnaryOperator<Node> transform, ObjectNode json) {
    Node node = NodeCodec.decode(json);
    Node result = transform.apply(node);
    if (result == null) {
      return null;
    }
    return result == node ? json : NodeCodec.encode(result);
  }

  private static ArrayNode visitArray(UnaryOperator<Node> transform, ArrayNode array) {
    List<JsonNode> children = new ArrayList<>(array.size());
    boolean changed = false;
    for (JsonNode child : array) {
      JsonNode walked = visit(transform, child);
      changed |= walked != child;
      if (walked != null) children.add(walked);
    }
    if (!changed) return array;
    ArrayNode rebuilt = F.arrayNode(children.size());
    rebuilt.addAll(children);
    return rebuilt;
  }

  private static ObjectNode visitObject(UnaryOperator<Node> transform, ObjectNode object) {
    Map<String, JsonNode> members = new LinkedHashMap<>();
    boolean changed = false;
    for (Iterator<Map.Entry<String, JsonNode>> it = object.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> member = it.next();
      JsonNode walked = visit(transform, member.getValue());
      changed |= walked != member.getValue();
      members.put(member.getKey(), walked == null ? NullNode.getInstance() : walked);
    }
    if (!changed) return object;
    ObjectNode rebuilt = F.objectNode();
    rebuilt.setAll(members);
    return rebuilt;
  }
}
