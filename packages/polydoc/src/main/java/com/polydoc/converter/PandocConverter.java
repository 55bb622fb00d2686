package com.polydoc.converter;

import com.fasterxml.jackson.databind.JsonNode;
import com.polydoc.ast.AstIO;
import com.polydoc.exception.ConversionException;
import com.polydoc.exception.PolydocException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Converts markup with the {@code pandoc} executable: markup on stdin, JSON AST on stdout. */
public class PandocConverter implements DocumentConverter {
  private static final org.slf4j.Logger log =
      com.polydoc.logging.LoggingService.getLogger(PandocConverter.class);

  private final ProcessRunner runner;
  private final String command;
  private final String fromFormat;

  public PandocConverter(ProcessRunner runner, String command, String fromFormat) {
    this.runner = Objects.requireNonNull(runner, "runner");
    this.command = Objects.requireNonNull(command, "command");
    this.fromFormat = Objects.requireNonNull(fromFormat, "fromFormat");
  }

  @Override
  public JsonNode toAst(String markup) {
    List<String> cmd = List.of(command, "-f", fromFormat, "-t", "json");
    ProcessResult result;
    try {
      result = runner.run(cmd, markup.getBytes(StandardCharsets.UTF_8));
    } catch (PolydocException e) {
      throw new ConversionException("Error running pandoc: " + e.getMessage(), e);
    }
    if (!result.isSuccess()) {
      throw new ConversionException(
          "Pandoc failed: " + result.stderr().trim(),
          Map.of("command", String.join(" ", cmd), "exitCode", result.exitCode()));
    }
    log.trace("pandoc produced {} bytes of JSON", result.stdout().length);
    try {
      return AstIO.parse(result.stdoutAsString());
    } catch (PolydocException e) {
      throw new ConversionException("Pandoc produced invalid JSON: " + e.getMessage(), e);
    }
  }
}
