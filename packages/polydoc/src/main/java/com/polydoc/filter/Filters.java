package com.polydoc.filter;

import java.util.Arrays;

/** Factory methods for combining filters. */
public final class Filters {
  private Filters() {}

  /** Wraps {@code filter}; failures go to {@code diagnostics} and the input passes through. */
  public static AstFilter safe(AstFilter filter, FilterDiagnostics diagnostics) {
    return new SafeFilter(filter, diagnostics);
  }

  /** Left-to-right composition: {@code compose(f1, f2)(ast) == f2.apply(f1.apply(ast))}. */
  public static AstFilter compose(AstFilter... filters) {
    return new CompositeFilter(Arrays.asList(filters));
  }
}
