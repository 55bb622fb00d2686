package com.polydoc.ast;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TreeWalker")
class TreeWalkerTest {

  private static final String DOC =
      "{\"pandoc-api-version\":[1,23,1],\"meta\":{\"title\":{\"t\":\"MetaString\",\"c\":\"T\"}},"
          + "\"blocks\":["
          + "{\"t\":\"Para\",\"c\":[{\"t\":\"Str\",\"c\":\"a\"},{\"t\":\"Space\"},"
          + "{\"t\":\"Str\",\"c\":\"b\"}]},"
          + "{\"t\":\"CodeBlock\",\"c\":[[\"\",[\"drop\"],[]],\"x\"]},"
          + "{\"t\":\"Div\",\"c\":[[\"\",[],[]],"
          + "[{\"t\":\"Plain\",\"c\":[{\"t\":\"Str\",\"c\":\"c\"}]}]]}"
          + "]}";

  @Test
  @DisplayName("the identity transform returns the same instance")
  void identityPreservesInstance() {
    JsonNode ast = AstIO.parse(DOC);

    assertSame(ast, TreeWalker.walk(n -> n, ast));
  }

  @Test
  @DisplayName("children are visited before their parent")
  void visitsInPostorder() {
    List<String> order = new ArrayList<>();

    TreeWalker.walk(
        n -> {
          order.add(n instanceof Str s ? "Str:" + s.text() : n.type());
          return n;
        },
        AstIO.parse(DOC));

    assertEquals(
        List.of(
            "MetaString", "Str:a", "Space", "Str:b", "Para", "CodeBlock", "Str:c", "Plain", "Div"),
        order);
  }

  @Test
  @DisplayName("returning null removes the node from its array")
  void nullRemovesFromArray() {
    JsonNode ast = AstIO.parse(DOC);

    JsonNode out =
        TreeWalker.walk(
            n -> n instanceof CodeBlock cb && cb.attr().hasClass("drop") ? null : n, ast);

    assertEquals(2, out.get("blocks").size());
    assertEquals(3, ast.get("blocks").size(), "input must not be mutated");
    // untouched siblings are shared, not copied
    assertSame(ast.get("blocks").get(0), out.get("blocks").get(0));
    assertSame(ast.get("meta"), out.get("meta"));
  }

  @Test
  @DisplayName("returning null for an object member or the root leaves JSON null")
  void nullInObjectOrRoot() {
    JsonNode ast = AstIO.parse(DOC);

    JsonNode out = TreeWalker.walk(n -> n.type().equals("MetaString") ? null : n, ast);

    assertTrue(out.get("meta").get("title").isNull());
    assertTrue(TreeWalker.walk(n -> null, AstIO.parse("{\"t\":\"Space\"}")).isNull());
  }

  @Test
  @DisplayName("replacements see already transformed children")
  void parentsSeeTransformedChildren() {
    JsonNode out =
        TreeWalker.walk(
            n -> {
              if (n instanceof Str s) return new Str(s.text().toUpperCase());
              if (n instanceof Plain p) return new Para(p.inlines());
              return n;
            },
            AstIO.parse(DOC));

    JsonNode div = out.get("blocks").get(2);
    JsonNode para = div.get("c").get(1).get(0);
    assertEquals("Para", para.get("t").asText());
    assertEquals("C", para.get("c").get(0).get("c").asText());
  }

  @Test
  @DisplayName("scalars and non-node values are passed through")
  void nonNodesPassThrough() {
    JsonNode numbers = AstIO.parse("[1, 2.50, \"s\", {\"k\": [true, null]}]");

    assertSame(numbers, TreeWalker.walk(n -> null, numbers));
  }

  @Test
  void collectByType() {
    List<Node> strs = TreeWalker.collect(AstIO.parse(DOC), Str.TYPE);

    assertEquals(List.of(new Str("a"), new Str("b"), new Str("c")), strs);
  }
}
