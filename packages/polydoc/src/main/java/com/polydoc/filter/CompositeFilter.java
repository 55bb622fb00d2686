package com.polydoc.filter;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Applies filters left to right, each to the previous one's output: {@code fn(...f2(f1(ast)))}.
 * There is no short-circuit and no rollback.
 */
public final class CompositeFilter implements AstFilter {
  private final List<AstFilter> filters;

  public CompositeFilter(List<? extends AstFilter> filters) {
    Objects.requireNonNull(filters, "filters");
    this.filters = List.copyOf(filters);
  }

  @Override
  public JsonNode apply(JsonNode ast) {
    JsonNode current = ast;
    for (AstFilter filter : filters) {
      current = filter.apply(current);
    }
    return current;
  }

  @Override
  public String name() {
    return filters.stream().map(AstFilter::name).collect(Collectors.joining(" -> ", "[", "]"));
  }

  public List<AstFilter> filters() {
    return filters;
  }
}
