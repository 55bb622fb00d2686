package com.polydoc.filter.plantuml;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.polydoc.ast.Attr;
import com.polydoc.ast.CodeBlock;
import com.polydoc.ast.Image;
import com.polydoc.ast.Node;
import com.polydoc.ast.NodeCodec;
import com.polydoc.ast.Para;
import com.polydoc.converter.ProcessResult;
import com.polydoc.converter.ProcessRunner;
import com.polydoc.exception.PolydocException;
import com.polydoc.filter.NodeFilter;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

/**
 * Renders {@code plantuml} (or {@code uml}) code blocks with the PlantUML command-line tool.
 *
 * <pre>
 * ```{.plantuml format=png}
 * &#64;startuml
 * Alice -&gt; Bob: Hello
 * &#64;enduml
 * ```
 * </pre>
 *
 * <p>Image formats become a paragraph holding an image with a {@code data:} URI; text formats
 * ({@code txt}, {@code utxt}, {@code latex}) become a {@code plantuml-output} code block. Unknown
 * formats fall back to the configured default.
 */
public class PlantUmlFilter implements NodeFilter {
  private static final org.slf4j.Logger log =
      com.polydoc.logging.LoggingService.getLogger(PlantUmlFilter.class);

  public static final String PLANTUML_CLASS = "plantuml";
  public static final String UML_CLASS = "uml";
  public static final String OUTPUT_CLASS = "plantuml-output";
  public static final String ERROR_CLASS = "plantuml-error";
  public static final String FORMAT_ATTRIBUTE = "format";

  private static final JsonNodeFactory F = JsonNodeFactory.instance;

  private final ProcessRunner runner;
  private final String command;
  private final DiagramFormat defaultFormat;

  public PlantUmlFilter() {
    this(new ProcessRunner(), "plantuml", DiagramFormat.SVG);
  }

  public PlantUmlFilter(ProcessRunner runner, String command, DiagramFormat defaultFormat) {
    this.runner = Objects.requireNonNull(runner, "runner");
    this.command = Objects.requireNonNull(command, "command");
    this.defaultFormat = Objects.requireNonNull(defaultFormat, "defaultFormat");
  }

  @Override
  public String name() {
    return PLANTUML_CLASS;
  }

  @Override
  public boolean matches(Node node) {
    return node instanceof CodeBlock cb && cb.attr().hasAnyClass(PLANTUML_CLASS, UML_CLASS);
  }

  @Override
  public Node transform(Node node) {
    CodeBlock block = (CodeBlock) node;
    String source = block.text();
    DiagramFormat format =
        block
            .attr()
            .attribute(FORMAT_ATTRIBUTE)
            .flatMap(DiagramFormat::fromAttribute)
            .orElse(defaultFormat);

    ProcessResult result;
    try {
      result =
          runner.run(
              List.of(command, "-pipe", format.flag()), source.getBytes(StandardCharsets.UTF_8));
    } catch (PolydocException e) {
      log.warn("Could not run {}: {}", command, e.getMessage());
      return error("Failed to execute PlantUML: " + e.getMessage(), source);
    }
    if (!result.isSuccess()) {
      String message = "PlantUML exited with code " + result.exitCode();
      if (!result.stderr().isBlank()) {
        message += "\n" + result.stderr().strip();
      }
      log.warn("PlantUML rendering failed: {}", message);
      return error(message, source);
    }

    log.debug("Rendered diagram as {} ({} bytes)", format, result.stdout().length);
    if (format.isText()) {
      return new CodeBlock(Attr.ofClasses(OUTPUT_CLASS), result.stdoutAsString());
    }
    String base64 = Base64.getEncoder().encodeToString(result.stdout());
    String dataUri = "data:" + format.mimeType() + ";base64," + base64;
    Image image = new Image(Attr.ofClasses(PLANTUML_CLASS), F.arrayNode(), dataUri, "");
    ArrayNode inlines = F.arrayNode().add(NodeCodec.encode(image));
    return new Para(inlines);
  }

  private static CodeBlock error(String message, String source) {
    return new CodeBlock(
        Attr.ofClasses(ERROR_CLASS),
        "ERROR rendering PlantUML:\n" + message + "\n\nOriginal code:\n" + source);
  }
}
