package com.polydoc.filter;

import com.fasterxml.jackson.databind.JsonNode;
import com.polydoc.ast.AstIO;

/** Reads an AST, applies one filter, writes the result. */
public final class FilterRunner {
  private static final org.slf4j.Logger log =
      com.polydoc.logging.LoggingService.getLogger(FilterRunner.class);

  private FilterRunner() {}

  /**
   * @param input file path or {@code "-"} for stdin
   * @param output file path or {@code "-"} for stdout
   */
  public static void execute(AstFilter filter, String input, String output) {
    JsonNode ast = AstIO.read(input);
    long start = System.currentTimeMillis();
    JsonNode filtered = filter.apply(ast);
    log.debug("Filter {} completed in ({}ms)", filter.name(), System.currentTimeMillis() - start);
    AstIO.write(filtered, output);
  }
}
