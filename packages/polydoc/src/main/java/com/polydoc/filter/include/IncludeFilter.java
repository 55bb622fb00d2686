package com.polydoc.filter.include;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.polydoc.ast.Attr;
import com.polydoc.ast.CodeBlock;
import com.polydoc.ast.Node;
import com.polydoc.ast.TreeWalker;
import com.polydoc.converter.DocumentConverter;
import com.polydoc.exception.ExceptionUtil;
import com.polydoc.exception.PolydocException;
import com.polydoc.filter.AstFilter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Replaces {@code include} code blocks with the content of the file they name.
 *
 * <p>Markdown usage:
 *
 * <pre>
 * ```{.include mode=code lang=java base="../shared"}
 * examples/Hello.java
 * ```
 * </pre>
 *
 * <p>Attributes: {@code base} overrides the directory relative paths resolve against, for this
 * block only; {@code mode} is {@code parse} (default), {@code code} or {@code raw}; {@code lang}
 * is the code-block language in {@code code} mode; {@code format} is the raw-block format in
 * {@code raw} mode (default {@code markdown}).
 *
 * <p>In {@code parse} mode the file is converted to blocks, its own includes are expanded relative
 * to its directory, and the result is wrapped in an {@code included} div recording the source
 * path. Cycles, missing files, conversion failures and unknown modes become {@code include-error}
 * blocks in the document. Past the maximum depth, include blocks are left as they are.
 */
public class IncludeFilter implements AstFilter {
  private static final org.slf4j.Logger log =
      com.polydoc.logging.LoggingService.getLogger(IncludeFilter.class);

  public static final String INCLUDE_CLASS = "include";
  public static final String BASE_ATTRIBUTE = "base";
  public static final String MODE_ATTRIBUTE = "mode";
  public static final String LANG_ATTRIBUTE = "lang";
  public static final String FORMAT_ATTRIBUTE = "format";
  public static final String DEFAULT_RAW_FORMAT = "markdown";

  private final DocumentConverter converter;
  private final Path baseDir;
  private final Path sourceDocument;
  private final int maxDepth;

  /** Resolves against the current working directory with the default depth bound. */
  public IncludeFilter(DocumentConverter converter) {
    this(converter, null, null, IncludeContext.DEFAULT_MAX_DEPTH);
  }

  /**
   * @param baseDir directory for relative includes; {@code null} means the working directory
   * @param sourceDocument path of the document being filtered, if known; takes precedence over
   *     {@code baseDir} and makes self-inclusion a cycle
   * @param maxDepth nesting depth at which includes stop being expanded
   */
  public IncludeFilter(
      DocumentConverter converter, Path baseDir, Path sourceDocument, int maxDepth) {
    this.converter = Objects.requireNonNull(converter, "converter");
    this.baseDir = baseDir;
    this.sourceDocument = sourceDocument;
    this.maxDepth = maxDepth;
  }

  @Override
  public JsonNode apply(JsonNode ast) {
    return apply(ast, initialContext());
  }

  public JsonNode apply(JsonNode ast, IncludeContext context) {
    return TreeWalker.walk(node -> transform(node, context), ast);
  }

  @Override
  public String name() {
    return INCLUDE_CLASS;
  }

  public boolean matches(Node node) {
    return node instanceof CodeBlock cb && cb.attr().hasClass(INCLUDE_CLASS);
  }

  /** Expands {@code node} if it is an include block; any other node is returned as is. */
  public Node transform(Node node, IncludeContext context) {
    if (!matches(node)) {
      return node;
    }
    CodeBlock block = (CodeBlock) node;
    Attr attr = block.attr();
    String requested = block.text().trim();
    if (requested.isEmpty()) {
      return IncludeBlocks.error(requested, "Include block does not name a file");
    }

    Path resolved;
    try {
      resolved = resolve(requested, attr.attribute(BASE_ATTRIBUTE), context);
    } catch (InvalidPathException e) {
      return IncludeBlocks.error(requested, "Invalid path: " + e.getMessage());
    }

    if (context.isOnStack(resolved)) {
      String chain =
          Stream.concat(context.stack().stream(), Stream.of(resolved))
              .map(Path::toString)
              .collect(Collectors.joining(" -> "));
      log.warn("Include cycle detected: {}", chain);
      return IncludeBlocks.error(requested, "Include cycle detected: " + chain);
    }

    if (context.isDepthExhausted()) {
      log.debug("Maximum include depth {} reached, leaving {} unexpanded", maxDepth, requested);
      return node;
    }

    String modeValue = attr.attribute(MODE_ATTRIBUTE).orElse(IncludeMode.PARSE.attributeValue());
    Optional<IncludeMode> mode = IncludeMode.fromAttribute(modeValue);
    if (mode.isEmpty()) {
      log.warn("Unknown include mode '{}' for {}", modeValue, requested);
      return IncludeBlocks.error(requested, "Unknown include mode: " + modeValue);
    }

    String content;
    try {
      // malformed UTF-8 is replaced, not rejected
      content = new String(Files.readAllBytes(resolved), StandardCharsets.UTF_8);
    } catch (NoSuchFileException e) {
      log.warn("Included file not found: {}", resolved);
      return IncludeBlocks.error(requested, "File not found: " + resolved);
    } catch (IOException e) {
      log.warn("Could not read included file {}: {}", resolved, e.toString());
      return IncludeBlocks.error(
          requested, "Error reading file " + resolved + ": " + ExceptionUtil.rootMessage(e));
    }

    log.debug("Including {} in {} mode at depth {}", resolved, modeValue, context.depth());
    return switch (mode.get()) {
      case CODE -> IncludeBlocks.code(content, attr.attribute(LANG_ATTRIBUTE).orElse(null));
      case RAW -> IncludeBlocks.raw(
          content, attr.attribute(FORMAT_ATTRIBUTE).orElse(DEFAULT_RAW_FORMAT));
      case PARSE -> parse(requested, resolved, content, context);
    };
  }

  private Node parse(String requested, Path resolved, String content, IncludeContext context) {
    ArrayNode blocks;
    try {
      blocks = converter.toBlocks(content);
    } catch (PolydocException e) {
      log.warn("Could not convert included file {}: {}", resolved, e.getMessage());
      return IncludeBlocks.error(requested, e.getMessage());
    }
    ArrayNode expanded = (ArrayNode) apply(blocks, context.descend(resolved));
    return IncludeBlocks.included(resolved, expanded);
  }

  /**
   * Absolute, normalized location of {@code requested}. A {@code base} override applies only to
   * the block declaring it; when relative it is taken from the context's base directory.
   */
  static Path resolve(String requested, Optional<String> baseOverride, IncludeContext context) {
    Path base =
        baseOverride
            .filter(b -> !b.isBlank())
            .map(b -> context.baseDir().resolve(b))
            .orElse(context.baseDir());
    Path file = Path.of(requested);
    return (file.isAbsolute() ? file : base.resolve(file)).toAbsolutePath().normalize();
  }

  private IncludeContext initialContext() {
    if (sourceDocument != null) {
      return IncludeContext.forDocument(sourceDocument, maxDepth);
    }
    return IncludeContext.root(baseDir != null ? baseDir : Path.of(""), maxDepth);
  }
}
