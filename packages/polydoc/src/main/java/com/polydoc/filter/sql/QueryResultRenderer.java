package com.polydoc.filter.sql;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.polydoc.ast.AstNodes;
import com.polydoc.ast.Attr;
import com.polydoc.ast.GenericNode;
import com.polydoc.ast.Node;
import com.polydoc.ast.NodeCodec;
import com.polydoc.ast.Para;
import com.polydoc.ast.Plain;
import com.polydoc.utility.StringUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Renders a {@link QueryResult} as a Pandoc table or as an aligned plain-text table. */
final class QueryResultRenderer {
  static final String NO_RESULTS = "No results";
  static final String TABLE_TYPE = "Table";

  private static final JsonNodeFactory F = JsonNodeFactory.instance;

  private QueryResultRenderer() {}

  /**
   * {@code Table} with an empty caption, default column specs, one header row and one body, or a
   * {@code No results} paragraph when there are no rows.
   */
  static Node table(QueryResult result) {
    if (result.isEmpty()) {
      return new Para(AstNodes.text(NO_RESULTS));
    }
    ArrayNode colSpecs = F.arrayNode();
    result
        .columns()
        .forEach(
            c ->
                colSpecs.add(
                    F.arrayNode()
                        .add(AstNodes.makeNode("AlignDefault", null))
                        .add(AstNodes.makeNode("ColWidthDefault", null))));

    ArrayNode caption = F.arrayNode().addNull().add(F.arrayNode());
    ArrayNode head = F.arrayNode().add(emptyAttr()).add(F.arrayNode().add(row(result.columns())));

    ArrayNode bodyRows = F.arrayNode();
    result.rows().forEach(r -> bodyRows.add(row(r)));
    ArrayNode body = F.arrayNode().add(emptyAttr()).add(0).add(F.arrayNode()).add(bodyRows);
    ArrayNode foot = F.arrayNode().add(emptyAttr()).add(F.arrayNode());

    ArrayNode content =
        F.arrayNode()
            .add(emptyAttr())
            .add(caption)
            .add(colSpecs)
            .add(head)
            .add(F.arrayNode().add(body))
            .add(foot);
    return new GenericNode(TABLE_TYPE, content);
  }

  /** Header, separator and rows with columns padded to their widest value, joined by {@code |}. */
  static String text(QueryResult result) {
    if (result.isEmpty()) {
      return NO_RESULTS;
    }
    List<String> columns = result.columns();
    int[] widths = new int[columns.size()];
    for (int i = 0; i < widths.length; i++) {
      widths[i] = columns.get(i).length();
      for (List<String> row : result.rows()) {
        widths[i] = Math.max(widths[i], row.get(i).length());
      }
    }

    List<String> lines = new ArrayList<>();
    lines.add(line(columns, widths));
    List<String> dashes = new ArrayList<>();
    for (int w : widths) {
      dashes.add("-".repeat(w));
    }
    lines.add(String.join("-+-", dashes));
    result.rows().forEach(r -> lines.add(line(r, widths)));
    return String.join("\n", lines);
  }

  private static String line(List<String> values, int[] widths) {
    List<String> cells = new ArrayList<>(values.size());
    for (int i = 0; i < values.size(); i++) {
      cells.add(StringUtility.padRight(values.get(i), widths[i]));
    }
    return cells.stream().collect(Collectors.joining(" | "));
  }

  private static ArrayNode row(List<String> values) {
    ArrayNode cells = F.arrayNode();
    for (String value : values) {
      ArrayNode blocks = F.arrayNode().add(NodeCodec.encode(new Plain(AstNodes.text(value))));
      cells.add(
          F.arrayNode()
              .add(emptyAttr())
              .add(AstNodes.makeNode("AlignDefault", null))
              .add(1)
              .add(1)
              .add(blocks));
    }
    return F.arrayNode().add(emptyAttr()).add(cells);
  }

  private static ArrayNode emptyAttr() {
    return NodeCodec.encodeAttr(Attr.EMPTY);
  }
}
