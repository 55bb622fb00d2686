package com.polydoc.filter;

import com.fasterxml.jackson.databind.JsonNode;
import com.polydoc.ast.Node;
import com.polydoc.ast.TreeWalker;

/**
 * A filter described by a predicate and a rewrite. Applying it walks the whole tree in postorder
 * and replaces every node the predicate accepts with the rewrite's result.
 */
public interface NodeFilter extends AstFilter {

  /** Whether this filter owns {@code node}. */
  boolean matches(Node node);

  /** Rewrites a node accepted by {@link #matches}. May return {@code null} to remove it. */
  Node transform(Node node);

  @Override
  default JsonNode apply(JsonNode ast) {
    return TreeWalker.walk(node -> matches(node) ? transform(node) : node, ast);
  }
}
