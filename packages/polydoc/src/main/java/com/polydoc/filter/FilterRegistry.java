package com.polydoc.filter;

import com.polydoc.PolydocSettings;
import com.polydoc.converter.DocumentConverter;
import com.polydoc.converter.PandocConverter;
import com.polydoc.converter.ProcessRunner;
import com.polydoc.exception.ValidationException;
import com.polydoc.filter.exec.JavaExecFilter;
import com.polydoc.filter.include.IncludeFilter;
import com.polydoc.filter.plantuml.PlantUmlFilter;
import com.polydoc.filter.sql.SqliteExecFilter;
import com.polydoc.filter.sql.SqliteQueryRunner;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Builds the filters selectable by name on the command line. Every filter returned is wrapped by
 * {@link SafeFilter}; {@code all} composes the individually wrapped filters, so one failing filter
 * does not prevent the others from running.
 */
public class FilterRegistry {
  public static final List<String> NAMES =
      List.of("include", "java-exec", "sqlite-exec", "sqlite", "plantuml", "uml", "all");

  private final PolydocSettings settings;
  private final Path sourceDocument;
  private final ProcessRunner processRunner;
  private final FilterDiagnostics diagnostics;

  public FilterRegistry(PolydocSettings settings, Path sourceDocument) {
    this(settings, sourceDocument, new ProcessRunner(), new LoggingFilterDiagnostics());
  }

  /**
   * @param sourceDocument file the filtered document was converted from, or {@code null}
   */
  public FilterRegistry(
      PolydocSettings settings,
      Path sourceDocument,
      ProcessRunner processRunner,
      FilterDiagnostics diagnostics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.sourceDocument = sourceDocument;
    this.processRunner = Objects.requireNonNull(processRunner, "processRunner");
    this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
  }

  /** Throws {@link ValidationException} for a name not in {@link #NAMES}. */
  public AstFilter create(String name) {
    String key = name == null ? "" : name.trim();
    return switch (key) {
      case "include" -> safe(include());
      case "java-exec" -> safe(new JavaExecFilter());
      case "sqlite-exec", "sqlite" -> safe(sqlite());
      case "plantuml", "uml" -> safe(plantUml());
      case "all" -> Filters.compose(
          safe(include()), safe(new JavaExecFilter()), safe(sqlite()), safe(plantUml()));
      default -> throw new ValidationException(
          "Unknown filter type: '" + name + "'. Expected one of " + String.join(", ", NAMES));
    };
  }

  private AstFilter safe(AstFilter filter) {
    return Filters.safe(filter, diagnostics);
  }

  private IncludeFilter include() {
    DocumentConverter converter =
        new PandocConverter(processRunner, settings.pandocCommand(), settings.pandocFrom());
    String baseDir = settings.includeBaseDir();
    return new IncludeFilter(
        converter,
        baseDir == null || baseDir.isBlank() ? null : Path.of(baseDir),
        sourceDocument,
        settings.includeMaxDepth());
  }

  private SqliteExecFilter sqlite() {
    return new SqliteExecFilter(new SqliteQueryRunner(), settings.sqliteDefaultDb());
  }

  private PlantUmlFilter plantUml() {
    return new PlantUmlFilter(
        processRunner, settings.plantumlCommand(), settings.plantumlDefaultFormat());
  }
}
