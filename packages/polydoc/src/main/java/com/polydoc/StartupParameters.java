package com.polydoc;

import com.polydoc.ast.AstIO;
import com.polydoc.exception.ValidationException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Command-line arguments: a command ({@code filter}, {@code config} or {@code help}) followed by
 * {@code --name value} options. Short aliases {@code -t}, {@code -i}, {@code -o}, {@code -s} and
 * {@code -c} stand for {@code --type}, {@code --input}, {@code --output}, {@code --source} and
 * {@code --config}.
 */
public class StartupParameters {
  public static final List<String> COMMANDS = List.of("filter", "config", "help");

  private static final Map<String, String> ALIASES =
      Map.of("t", "type", "i", "input", "o", "output", "s", "source", "c", "config");

  final Map<String, String> parameters = new HashMap<>();
  private final String command;

  {
    parameters.put("config", ConfigurationProvider.DEFAULT_LOCATION);
    parameters.put("input", AstIO.STDIO);
    parameters.put("output", AstIO.STDIO);
  }

  public StartupParameters(String[] arguments) {
    String cmd = null;
    for (int p = 0; p < arguments.length; p++) {
      String arg = arguments[p];
      String name = optionName(arg);
      if (name == null) {
        if (cmd != null) {
          throw new ValidationException("Unexpected argument: " + arg);
        }
        cmd = arg;
        continue;
      }
      if (name.equals("help")) {
        cmd = "help";
        continue;
      }
      if (p == arguments.length - 1) {
        throw new ValidationException("Missing value for option " + arg);
      }
      parameters.put(name, arguments[++p]);
    }
    this.command = cmd == null ? "help" : cmd;
    validate();
  }

  private static String optionName(String arg) {
    if (arg.startsWith("--") && arg.length() > 2) {
      return arg.substring(2);
    }
    if (arg.startsWith("-") && arg.length() == 2 && !arg.equals(AstIO.STDIO)) {
      String alias = ALIASES.get(arg.substring(1));
      if (alias == null && !arg.equals("-h")) {
        throw new ValidationException("Unknown option: " + arg);
      }
      return alias == null ? "help" : alias;
    }
    return null;
  }

  private void validate() {
    if (!COMMANDS.contains(command)) {
      throw new ValidationException(
          "Unknown command: '" + command + "'. Expected one of " + String.join(", ", COMMANDS));
    }
    if (command.equals("filter") && getOptionalParameter("type").isEmpty()) {
      throw new ValidationException("The filter command requires --type <name>");
    }
    if (parameters.get("config").isBlank()) {
      throw new ValidationException("Missing config file location");
    }
  }

  public String command() {
    return command;
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/polydoc.yaml", "config/local.yaml".
   */
  public String configFile() {
    return parameters.get("config");
  }

  public String getParameter(String name) {
    return parameters.get(name);
  }

  public Optional<String> getOptionalParameter(String name) {
    return Optional.ofNullable(parameters.get(name)).filter(v -> !v.isBlank());
  }
}
