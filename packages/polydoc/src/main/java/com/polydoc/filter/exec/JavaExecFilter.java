package com.polydoc.filter.exec;

import com.fasterxml.jackson.databind.JsonNode;
import com.polydoc.ast.CodeBlock;
import com.polydoc.ast.Node;
import com.polydoc.ast.TreeWalker;
import com.polydoc.compiler.ExecutionResult;
import com.polydoc.compiler.JavaSnippetCompiler;
import com.polydoc.filter.AstFilter;
import java.util.function.Supplier;

/**
 * Runs {@code java-exec} code blocks and replaces each with its code and execution result.
 *
 * <pre>
 * ```{.java-exec}
 * int n = 6 * 7;
 * System.out.println("computing");
 * state.put("answer", n);
 * return n;
 * ```
 * </pre>
 *
 * <p>Blocks of one document run in document order and share the {@code state} map. Compilation and
 * runtime failures are reported inside the resulting block.
 */
public class JavaExecFilter implements AstFilter {
  private static final org.slf4j.Logger log =
      com.polydoc.logging.LoggingService.getLogger(JavaExecFilter.class);

  public static final String EXEC_CLASS = "java-exec";

  private final Supplier<JavaSnippetCompiler> compilerFactory;

  public JavaExecFilter() {
    this(JavaSnippetCompiler::new);
  }

  public JavaExecFilter(Supplier<JavaSnippetCompiler> compilerFactory) {
    this.compilerFactory = compilerFactory;
  }

  @Override
  public JsonNode apply(JsonNode ast) {
    SnippetSession session = new SnippetSession(compilerFactory);
    return TreeWalker.walk(node -> matches(node) ? execute((CodeBlock) node, session) : node, ast);
  }

  @Override
  public String name() {
    return EXEC_CLASS;
  }

  public boolean matches(Node node) {
    return node instanceof CodeBlock cb && cb.attr().hasClass(EXEC_CLASS);
  }

  private CodeBlock execute(CodeBlock block, SnippetSession session) {
    ExecutionResult result = session.execute(block.text());
    if (result.success()) {
      log.debug("Executed java-exec block, result: {}", result.value());
    } else {
      log.warn("java-exec block failed: {}", result.error());
    }
    return new CodeBlock(block.attr(), render(block.text(), result));
  }

  static String render(String code, ExecutionResult result) {
    StringBuilder out =
        new StringBuilder("// Original code:\n")
            .append(code)
            .append("\n\n// Execution result:\n");
    if (result.output() != null && !result.output().isBlank()) {
      out.append("Output:\n").append(result.output().stripTrailing()).append("\n\n");
    }
    if (result.success()) {
      out.append("Result:\n").append(result.value());
    } else {
      out.append("ERROR: ").append(result.error());
    }
    return out.toString();
  }
}
