package com.polydoc.filter.sql;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class SqlStatementsTest {

  @Test
  void splitsOnTopLevelSemicolons() {
    assertEquals(
        List.of("CREATE TABLE t(x)", "INSERT INTO t VALUES (1)", "SELECT x FROM t"),
        SqlStatements.split("CREATE TABLE t(x);\nINSERT INTO t VALUES (1);\nSELECT x FROM t;\n"));
  }

  @Test
  void ignoresSemicolonsInLiteralsAndComments() {
    List<String> statements =
        SqlStatements.split(
            "INSERT INTO t VALUES ('a;b', 'it''s;');\n"
                + "-- note; not a statement\n"
                + "SELECT \"odd;name\" /* x; y */ FROM t");

    assertEquals(2, statements.size());
    assertEquals("INSERT INTO t VALUES ('a;b', 'it''s;')", statements.get(0));
    assertTrue(statements.get(1).endsWith("SELECT \"odd;name\" /* x; y */ FROM t"));
  }

  @Test
  void dropsBlankAndCommentOnlyStatements() {
    assertEquals(List.of("SELECT 1"), SqlStatements.split(";; SELECT 1; -- trailing\n"));
    assertTrue(SqlStatements.split("  ").isEmpty());
  }
}
