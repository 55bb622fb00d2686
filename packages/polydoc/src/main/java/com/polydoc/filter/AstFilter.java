package com.polydoc.filter;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A document transformation: takes a whole AST and returns the transformed AST.
 *
 * <p>Filters hold no state between invocations. They may perform I/O while transforming; nothing
 * is promised about idempotence or thread safety beyond each node being visited once per pass.
 */
@FunctionalInterface
public interface AstFilter {

  JsonNode apply(JsonNode ast);

  /** Name used in diagnostics. */
  default String name() {
    return getClass().getSimpleName();
  }
}
