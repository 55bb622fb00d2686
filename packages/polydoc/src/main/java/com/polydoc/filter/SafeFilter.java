package com.polydoc.filter;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Decorator isolating one filter's failure from the rest of a pipeline.
 *
 * <p>If the delegate throws, the failure is reported once to the diagnostics channel and the input
 * AST is returned as it was. Errors ({@link Error}) are not caught.
 */
public final class SafeFilter implements AstFilter {
  private final AstFilter delegate;
  private final FilterDiagnostics diagnostics;

  public SafeFilter(AstFilter delegate, FilterDiagnostics diagnostics) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
  }

  @Override
  public JsonNode apply(JsonNode ast) {
    try {
      return delegate.apply(ast);
    } catch (RuntimeException e) {
      diagnostics.report(delegate.name(), e);
      return ast;
    }
  }

  @Override
  public String name() {
    return delegate.name();
  }

  public AstFilter delegate() {
    return delegate;
  }
}
