package com.polydoc.ast;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.polydoc.exception.IoException;
import com.polydoc.exception.SerializationException;
import com.polydoc.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads and writes JSON document trees. A location of {@code "-"} means stdin / stdout; anything
 * else is a file path.
 */
public final class AstIO {
  public static final String STDIO = "-";

  private static final org.slf4j.Logger log =
      com.polydoc.logging.LoggingService.getLogger(AstIO.class);

  private AstIO() {}

  public static JsonNode read(String location) {
    if (STDIO.equals(location)) {
      return read(System.in);
    }
    Path path = Path.of(location);
    try (InputStream in = Files.newInputStream(path)) {
      log.debug("Reading AST from {}", path.toAbsolutePath());
      return read(in);
    } catch (NoSuchFileException e) {
      throw new IoException("Input file not found: " + path.toAbsolutePath(), e);
    } catch (IOException e) {
      throw new IoException("Failed to read input file: " + path.toAbsolutePath(), e);
    }
  }

  public static JsonNode read(InputStream in) {
    JsonNode ast;
    try {
      ast = JacksonUtility.astMapper().readTree(in);
    } catch (IOException e) {
      throw new SerializationException("Input is not a valid JSON document", e);
    }
    if (ast == null || ast.isMissingNode()) {
      throw new SerializationException("Input contained no JSON document");
    }
    return ast;
  }

  public static JsonNode parse(String json) {
    try {
      return JacksonUtility.astMapper().readTree(json);
    } catch (IOException e) {
      throw new SerializationException("Input is not a valid JSON document", e);
    }
  }

  public static void write(JsonNode ast, String location) {
    if (STDIO.equals(location)) {
      write(ast, System.out);
      return;
    }
    Path path = Path.of(location);
    try (OutputStream out = Files.newOutputStream(path)) {
      write(ast, out);
      log.debug("Wrote AST to {}", path.toAbsolutePath());
    } catch (IOException e) {
      throw new IoException("Failed to write output file: " + path.toAbsolutePath(), e);
    }
  }

  /** Writes without closing {@code out}. */
  public static void write(JsonNode ast, OutputStream out) {
    try {
      JacksonUtility.astMapper()
          .writer()
          .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
          .writeValue(out, ast);
      out.flush();
    } catch (IOException e) {
      throw new SerializationException("Failed to write AST as JSON", e);
    }
  }

  public static String toJson(JsonNode ast) {
    try {
      return JacksonUtility.astMapper().writeValueAsString(ast);
    } catch (IOException e) {
      throw new SerializationException("Failed to write AST as JSON", e);
    }
  }
}
