package com.polydoc.filter.sql;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Executes query blocks against SQLite through the xerial JDBC driver. */
public class SqliteQueryRunner {
  private static final org.slf4j.Logger log =
      com.polydoc.logging.LoggingService.getLogger(SqliteQueryRunner.class);

  public static final String IN_MEMORY = ":memory:";

  /**
   * Runs every statement of {@code script} in order on one connection to {@code database}, and
   * returns the rows of the last statement that produced a result set.
   *
   * @param database file path, or {@code :memory:} for a fresh in-memory database
   */
  public QueryResult execute(String database, String script) throws SQLException {
    List<String> statements = SqlStatements.split(script);
    QueryResult last = QueryResult.EMPTY;
    try (Connection connection = DriverManager.getConnection(jdbcUrl(database));
        Statement statement = connection.createStatement()) {
      for (String sql : statements) {
        log.trace("Executing on {}: {}", database, sql);
        if (statement.execute(sql)) {
          try (ResultSet rs = statement.getResultSet()) {
            last = read(rs);
          }
        }
      }
    }
    log.debug(
        "Ran {} statement(s) on {}, {} row(s)", statements.size(), database, last.rows().size());
    return last;
  }

  static String jdbcUrl(String database) {
    return "jdbc:sqlite:" + (database == null || database.isBlank() ? IN_MEMORY : database);
  }

  private static QueryResult read(ResultSet rs) throws SQLException {
    ResultSetMetaData meta = rs.getMetaData();
    int count = meta.getColumnCount();
    List<String> columns = new ArrayList<>(count);
    for (int i = 1; i <= count; i++) {
      columns.add(meta.getColumnLabel(i).toLowerCase(Locale.ROOT));
    }
    List<List<String>> rows = new ArrayList<>();
    while (rs.next()) {
      List<String> row = new ArrayList<>(count);
      for (int i = 1; i <= count; i++) {
        Object value = rs.getObject(i);
        row.add(value == null ? "" : String.valueOf(value));
      }
      rows.add(row);
    }
    return new QueryResult(columns, rows);
  }
}
