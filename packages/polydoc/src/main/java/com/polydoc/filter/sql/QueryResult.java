package com.polydoc.filter.sql;

import java.util.List;

/**
 * Rows returned by the last result-producing statement of a query block. Values are already
 * rendered as text; SQL {@code NULL} is the empty string.
 */
public record QueryResult(List<String> columns, List<List<String>> rows) {

  public static final QueryResult EMPTY = new QueryResult(List.of(), List.of());

  public QueryResult {
    columns = List.copyOf(columns);
    rows = rows.stream().map(List::copyOf).toList();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }
}
