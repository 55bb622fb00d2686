package com.polydoc.filter.sql;

import com.polydoc.ast.Attr;
import com.polydoc.ast.CodeBlock;
import com.polydoc.ast.Node;
import com.polydoc.exception.ExceptionUtil;
import com.polydoc.filter.NodeFilter;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Executes {@code sqlite-exec} (or {@code sqlite}) code blocks and replaces them with the query
 * results.
 *
 * <pre>
 * ```{.sqlite-exec db="data/sales.db" format=text}
 * SELECT region, SUM(total) AS total FROM orders GROUP BY region;
 * ```
 * </pre>
 *
 * <p>{@code db} names the database file (default from configuration, usually {@code :memory:});
 * {@code format} is {@code table} (a Pandoc table, the default); any other value, usually
 * {@code text}, gives a code block holding the query and an aligned text table. A failing query
 * becomes a code block holding the query and the error.
 */
public class SqliteExecFilter implements NodeFilter {
  private static final org.slf4j.Logger log =
      com.polydoc.logging.LoggingService.getLogger(SqliteExecFilter.class);

  public static final String EXEC_CLASS = "sqlite-exec";
  public static final String SHORT_CLASS = "sqlite";
  public static final String DB_ATTRIBUTE = "db";
  public static final String FORMAT_ATTRIBUTE = "format";
  public static final String TABLE_FORMAT = "table";

  private final SqliteQueryRunner runner;
  private final String defaultDatabase;

  public SqliteExecFilter() {
    this(new SqliteQueryRunner(), SqliteQueryRunner.IN_MEMORY);
  }

  public SqliteExecFilter(SqliteQueryRunner runner, String defaultDatabase) {
    this.runner = Objects.requireNonNull(runner, "runner");
    this.defaultDatabase = defaultDatabase;
  }

  @Override
  public String name() {
    return EXEC_CLASS;
  }

  @Override
  public boolean matches(Node node) {
    return node instanceof CodeBlock cb && cb.attr().hasAnyClass(EXEC_CLASS, SHORT_CLASS);
  }

  @Override
  public Node transform(Node node) {
    CodeBlock block = (CodeBlock) node;
    Attr attr = block.attr();
    String sql = block.text();
    String database = attr.attribute(DB_ATTRIBUTE).orElse(defaultDatabase);

    QueryResult result;
    try {
      result = runner.execute(database, sql);
    } catch (SQLException e) {
      log.warn("Query against {} failed: {}", database, e.getMessage());
      return new CodeBlock(
          attr, "-- SQL Query:\n" + sql + "\n\n-- ERROR:\n" + ExceptionUtil.rootMessage(e));
    }

    log.debug("Query against {} returned {} row(s)", database, result.rows().size());
    if (!TABLE_FORMAT.equals(attr.attribute(FORMAT_ATTRIBUTE).orElse(TABLE_FORMAT))) {
      return new CodeBlock(
          attr, "-- SQL Query:\n" + sql + "\n\n-- Results:\n" + QueryResultRenderer.text(result));
    }
    return QueryResultRenderer.table(result);
  }
}
