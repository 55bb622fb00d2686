package com.polydoc;

import com.polydoc.exception.ExceptionUtil;
import com.polydoc.exception.PolydocException;
import com.polydoc.filter.AstFilter;
import com.polydoc.filter.FilterRegistry;
import com.polydoc.filter.FilterRunner;
import com.polydoc.logging.LoggingService;
import com.polydoc.utility.JacksonUtility;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Command-line entry point.
 *
 * <pre>
 * pandoc doc.md -t json | polydoc filter --type all --source doc.md | pandoc -f json -o doc.html
 * </pre>
 *
 * <p>Exit status is 0 when the document was written, including documents carrying inline error
 * blocks, and 1 when setup failed: bad arguments or configuration, unreadable input, unwritable
 * output.
 */
public class Polydoc {
  private static final org.slf4j.Logger log = LoggingService.getLogger(Polydoc.class);

  static final String USAGE =
      """
      Usage: polydoc <command> [options]

      Commands:
        filter   Read a Pandoc JSON AST, apply a filter, write the result
        config   Print the effective configuration as YAML
        help     Print this message

      Options:
        -t, --type <name>     include, java-exec, sqlite-exec (sqlite), plantuml (uml), all
        -i, --input <path>    Input AST file, or - for stdin (default)
        -o, --output <path>   Output AST file, or - for stdout (default)
        -s, --source <path>   File the document was converted from; includes resolve next to it
        -c, --config <loc>    Configuration: classpath:<res>, file:<uri> or a path
                              (default classpath:application.yaml)
      """;

  private final PrintStream out;
  private final PrintStream err;

  public Polydoc(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  public static void main(String[] args) {
    System.exit(new Polydoc(System.out, System.err).run(args));
  }

  /** Runs one command and returns the process exit status. */
  public int run(String[] args) {
    try {
      StartupParameters parameters = new StartupParameters(args);
      switch (parameters.command()) {
        case "filter" -> filter(parameters);
        case "config" -> out.print(JacksonUtility.toYaml(settings(parameters).asMap()));
        default -> out.print(USAGE);
      }
      out.flush();
      return 0;
    } catch (PolydocException e) {
      log.debug("Command failed", e);
      err.println("polydoc: " + e.getMessage());
      if (e.getCause() != null) {
        err.println("  caused by: " + ExceptionUtil.rootMessage(e));
      }
      return 1;
    } catch (RuntimeException e) {
      log.error("Unexpected failure", e);
      err.println("polydoc: " + ExceptionUtil.rootMessage(e));
      return 1;
    }
  }

  private void filter(StartupParameters parameters) {
    PolydocSettings settings = settings(parameters);
    Path source = parameters.getOptionalParameter("source").map(Path::of).orElse(null);
    AstFilter filter = new FilterRegistry(settings, source).create(parameters.getParameter("type"));
    log.debug("Running filter {}", filter.name());
    FilterRunner.execute(
        filter, parameters.getParameter("input"), parameters.getParameter("output"));
  }

  private static PolydocSettings settings(StartupParameters parameters) {
    ConfigurationProvider provider = new ConfigurationProvider(parameters.configFile());
    LoggingService.applyConfiguration(provider.config());
    return PolydocSettings.from(provider.config());
  }
}
