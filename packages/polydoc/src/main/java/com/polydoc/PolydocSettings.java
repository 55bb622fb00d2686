package com.polydoc;

import com.polydoc.exception.ConfigException;
import com.polydoc.filter.include.IncludeContext;
import com.polydoc.filter.plantuml.DiagramFormat;
import com.polydoc.filter.sql.SqliteQueryRunner;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;

/** Typed view of the {@code polydoc.*} configuration keys, with their defaults applied. */
public record PolydocSettings(
    int includeMaxDepth,
    String includeBaseDir,
    String pandocCommand,
    String pandocFrom,
    String plantumlCommand,
    DiagramFormat plantumlDefaultFormat,
    String sqliteDefaultDb) {

  public static PolydocSettings defaults() {
    return new PolydocSettings(
        IncludeContext.DEFAULT_MAX_DEPTH,
        "",
        "pandoc",
        "markdown",
        "plantuml",
        DiagramFormat.SVG,
        SqliteQueryRunner.IN_MEMORY);
  }

  public static PolydocSettings from(Configuration cfg) {
    PolydocSettings d = defaults();
    int maxDepth;
    try {
      maxDepth = cfg.getInt("polydoc.include.max-depth", d.includeMaxDepth());
    } catch (org.apache.commons.configuration2.ex.ConversionException e) {
      throw new ConfigException("polydoc.include.max-depth must be an integer", e);
    }
    if (maxDepth < 0) {
      throw new ConfigException("polydoc.include.max-depth must not be negative: " + maxDepth);
    }
    String formatValue = cfg.getString("polydoc.plantuml.default-format", "svg");
    DiagramFormat format =
        DiagramFormat.fromAttribute(formatValue)
            .orElseThrow(
                () ->
                    new ConfigException(
                        "Unknown polydoc.plantuml.default-format: " + formatValue));
    return new PolydocSettings(
        maxDepth,
        cfg.getString("polydoc.include.base-dir", d.includeBaseDir()),
        nonBlank(cfg, "polydoc.pandoc.command", d.pandocCommand()),
        nonBlank(cfg, "polydoc.pandoc.from", d.pandocFrom()),
        nonBlank(cfg, "polydoc.plantuml.command", d.plantumlCommand()),
        format,
        nonBlank(cfg, "polydoc.sqlite.default-db", d.sqliteDefaultDb()));
  }

  /** Settings keyed the way they appear in the YAML file. */
  public Map<String, Object> asMap() {
    Map<String, Object> include = new LinkedHashMap<>();
    include.put("max-depth", includeMaxDepth);
    include.put("base-dir", includeBaseDir);
    Map<String, Object> pandoc = new LinkedHashMap<>();
    pandoc.put("command", pandocCommand);
    pandoc.put("from", pandocFrom);
    Map<String, Object> plantuml = new LinkedHashMap<>();
    plantuml.put("command", plantumlCommand);
    plantuml.put("default-format", plantumlDefaultFormat.name().toLowerCase(Locale.ROOT));
    Map<String, Object> sqlite = new LinkedHashMap<>();
    sqlite.put("default-db", sqliteDefaultDb);

    Map<String, Object> polydoc = new LinkedHashMap<>();
    polydoc.put("include", include);
    polydoc.put("pandoc", pandoc);
    polydoc.put("plantuml", plantuml);
    polydoc.put("sqlite", sqlite);
    return Map.of("polydoc", polydoc);
  }

  private static String nonBlank(Configuration cfg, String key, String fallback) {
    String value = cfg.getString(key, null);
    return value == null || value.isBlank() ? fallback : value.trim();
  }
}
