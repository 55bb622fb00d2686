package com.polydoc.ast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Converts between JSON nodes and the {@link Node} sum type.
 *
 * <p>Decoding dispatches on the tag through a table. Content whose shape does not match what its
 * tag requires decodes to {@link GenericNode}, so every node round-trips unchanged.
 */
public final class NodeCodec {
  private static final JsonNodeFactory F = JsonNodeFactory.instance;

  private static final Map<String, Function<JsonNode, Node>> DECODERS =
      Map.of(
          CodeBlock.TYPE, NodeCodec::decodeCodeBlock,
          RawBlock.TYPE, NodeCodec::decodeRawBlock,
          Div.TYPE, NodeCodec::decodeDiv,
          Para.TYPE, c -> c.isArray() ? new Para((ArrayNode) c) : null,
          Plain.TYPE, c -> c.isArray() ? new Plain((ArrayNode) c) : null,
          Header.TYPE, NodeCodec::decodeHeader,
          Image.TYPE, NodeCodec::decodeImage,
          Str.TYPE, c -> c.isTextual() ? new Str(c.asText()) : null);

  private NodeCodec() {}

  /** Decodes a value for which {@link AstNodes#isNode} holds. */
  public static Node decode(JsonNode json) {
    String type = AstNodes.typeOf(json);
    JsonNode content = AstNodes.contentOf(json);
    Function<JsonNode, Node> decoder = DECODERS.get(type);
    if (decoder != null && content != null) {
      Node typed = decoder.apply(content);
      if (typed != null) {
        return typed;
      }
    }
    return new GenericNode(type, content);
  }

  public static JsonNode encode(Node node) {
    if (node instanceof CodeBlock cb) {
      return AstNodes.makeNode(
          CodeBlock.TYPE, F.arrayNode().add(encodeAttr(cb.attr())).add(cb.text()));
    }
    if (node instanceof RawBlock rb) {
      return AstNodes.makeNode(RawBlock.TYPE, F.arrayNode().add(rb.format()).add(rb.text()));
    }
    if (node instanceof Div div) {
      return AstNodes.makeNode(
          Div.TYPE, F.arrayNode().add(encodeAttr(div.attr())).add(div.blocks()));
    }
    if (node instanceof Para para) {
      return AstNodes.makeNode(Para.TYPE, para.inlines());
    }
    if (node instanceof Plain plain) {
      return AstNodes.makeNode(Plain.TYPE, plain.inlines());
    }
    if (node instanceof Header h) {
      return AstNodes.makeNode(
          Header.TYPE,
          F.arrayNode().add(h.level()).add(encodeAttr(h.attr())).add(h.inlines()));
    }
    if (node instanceof Image img) {
      ArrayNode target = F.arrayNode().add(img.url()).add(img.title());
      return AstNodes.makeNode(
          Image.TYPE,
          F.arrayNode().add(encodeAttr(img.attr())).add(img.caption()).add(target));
    }
    if (node instanceof Str str) {
      return AstNodes.makeNode(Str.TYPE, F.textNode(str.text()));
    }
    GenericNode generic = (GenericNode) node;
    return AstNodes.makeNode(generic.type(), generic.content());
  }

  /** Decodes an attribute triple, or returns {@code null} if {@code json} is not one. */
  public static Attr decodeAttr(JsonNode json) {
    if (json == null || !json.isArray() || json.size() != 3) return null;
    JsonNode id = json.get(0);
    JsonNode classes = json.get(1);
    JsonNode kvs = json.get(2);
    if (!id.isTextual() || !classes.isArray() || !kvs.isArray()) return null;

    List<String> classList = new ArrayList<>(classes.size());
    for (JsonNode c : classes) {
      if (!c.isTextual()) return null;
      classList.add(c.asText());
    }
    List<Map.Entry<String, String>> kvList = new ArrayList<>(kvs.size());
    for (JsonNode kv : kvs) {
      if (!kv.isArray() || kv.size() != 2 || !kv.get(0).isTextual() || !kv.get(1).isTextual()) {
        return null;
      }
      kvList.add(Map.entry(kv.get(0).asText(), kv.get(1).asText()));
    }
    return new Attr(id.asText(), classList, kvList);
  }

  public static ArrayNode encodeAttr(Attr attr) {
    ArrayNode classes = F.arrayNode();
    attr.classes().forEach(classes::add);
    ArrayNode kvs = F.arrayNode();
    for (Map.Entry<String, String> kv : attr.attributes()) {
      kvs.add(F.arrayNode().add(kv.getKey()).add(kv.getValue()));
    }
    return F.arrayNode().add(attr.id()).add(classes).add(kvs);
  }

  private static Node decodeCodeBlock(JsonNode c) {
    if (!isPair(c) || !c.get(1).isTextual()) return null;
    Attr attr = decodeAttr(c.get(0));
    return attr == null ? null : new CodeBlock(attr, c.get(1).asText());
  }

  private static Node decodeRawBlock(JsonNode c) {
    if (!isPair(c) || !c.get(0).isTextual() || !c.get(1).isTextual()) return null;
    return new RawBlock(c.get(0).asText(), c.get(1).asText());
  }

  private static Node decodeDiv(JsonNode c) {
    if (!isPair(c) || !c.get(1).isArray()) return null;
    Attr attr = decodeAttr(c.get(0));
    return attr == null ? null : new Div(attr, (ArrayNode) c.get(1));
  }

  private static Node decodeHeader(JsonNode c) {
    if (!c.isArray() || c.size() != 3 || !c.get(0).isInt() || !c.get(2).isArray()) return null;
    Attr attr = decodeAttr(c.get(1));
    return attr == null ? null : new Header(c.get(0).asInt(), attr, (ArrayNode) c.get(2));
  }

  private static Node decodeImage(JsonNode c) {
    if (!c.isArray() || c.size() != 3 || !c.get(1).isArray() || !isPair(c.get(2))) return null;
    JsonNode target = c.get(2);
    if (!target.get(0).isTextual() || !target.get(1).isTextual()) return null;
    Attr attr = decodeAttr(c.get(0));
    return attr == null
        ? null
        : new Image(attr, (ArrayNode) c.get(1), target.get(0).asText(), target.get(1).asText());
  }

  private static boolean isPair(JsonNode c) {
    return c.isArray() && c.size() == 2;
  }
}
