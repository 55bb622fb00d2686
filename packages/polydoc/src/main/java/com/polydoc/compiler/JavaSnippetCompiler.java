package com.polydoc.compiler;

import com.polydoc.exception.CompilationException;
import com.polydoc.exception.ExceptionUtil;
import com.polydoc.exception.StateException;
import com.polydoc.utility.StringUtility;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;

/**
 * Compiles snippets in memory with the platform Java compiler and runs them.
 *
 * <p>One instance is one session: classes compiled by it stay loadable for its lifetime. Not
 * thread-safe; running a snippet temporarily redirects {@link System#out}.
 */
public class JavaSnippetCompiler {

  private static final org.slf4j.Logger log =
      com.polydoc.logging.LoggingService.getLogger(JavaSnippetCompiler.class);

  static final String MISSING_RETURN = "compiler.err.missing.ret.stmt";

  private final JavaCompiler compiler;
  private final SnippetClassStore classStore;

  public JavaSnippetCompiler() {
    this.compiler = ToolProvider.getSystemJavaCompiler();
    if (this.compiler == null) {
      throw new StateException("No Java compiler available; java-exec needs a JDK, not a JRE.");
    }
    StandardJavaFileManager stdFileManager =
        compiler.getStandardFileManager(null, Locale.ROOT, StandardCharsets.UTF_8);
    this.classStore =
        new SnippetClassStore(stdFileManager, JavaSnippetCompiler.class.getClassLoader());
  }

  /** Compiles {@code body}, adding {@code return null;} if the body does not return a value. */
  public CompilationResult compileSnippet(String className, String body) {
    CompilationResult result = compile(SnippetSource.wrap(className, body, false));
    if (result.success() || !result.errors().contains(MISSING_RETURN)) {
      return stripCodes(result);
    }
    return stripCodes(compile(SnippetSource.wrap(className, body, true)));
  }

  private CompilationResult compile(SnippetSource source) {
    try {
      log.trace(
          "Compiling snippet class {}:\n{}",
          source.className(),
          StringUtility.indent(source.code(), 4));
      DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();

      long start = System.currentTimeMillis();
      JavaCompiler.CompilationTask task =
          compiler.getTask(
              null,
              classStore,
              diagnostics,
              List.of("-proc:none", "-Xlint:none"),
              null,
              List.of(SnippetClassStore.source(source)));
      boolean success = task.call();
      log.trace(
          "Snippet {} {} in {}ms",
          source.className(),
          success ? "compiled" : "failed to compile",
          (System.currentTimeMillis() - start));

      if (success) {
        return new CompilationResult(true, source.className(), null);
      }
      StringBuilder errors = new StringBuilder();
      for (Diagnostic<? extends JavaFileObject> d : diagnostics.getDiagnostics()) {
        if (d.getKind() != Diagnostic.Kind.ERROR) continue;
        errors
            .append('[')
            .append(d.getCode())
            .append("] line ")
            .append(source.bodyLine(d.getLineNumber()))
            .append(": ")
            .append(d.getMessage(Locale.ROOT))
            .append('\n');
      }
      return new CompilationResult(false, source.className(), errors.toString());
    } catch (RuntimeException e) {
      throw new CompilationException("Failed to compile snippet " + source.className(), e);
    }
  }

  /**
   * Runs a class previously compiled by {@link #compileSnippet}, capturing what it prints.
   * Failures of the snippet itself, including stack overflows, assertion errors and linkage
   * errors, are reported in the result, not thrown.
   */
  @SuppressWarnings("unchecked")
  public ExecutionResult runSnippet(String className, Map<String, Object> state) {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    PrintStream original = System.out;
    long start = System.currentTimeMillis();
    try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
      Function<Map<String, Object>, Object> snippet;
      try {
        Class<?> cls = classStore.loader().loadClass(className);
        snippet = (Function<Map<String, Object>, Object>) cls.getConstructor().newInstance();
      } catch (ReflectiveOperationException | ClassCastException e) {
        throw new StateException("Snippet " + className + " is not loadable", e);
      }

      System.setOut(capture);
      try {
        Object value = snippet.apply(state);
        capture.flush();
        log.trace("Snippet {} executed in ({}ms)", className, System.currentTimeMillis() - start);
        return new ExecutionResult(true, output(buffer), String.valueOf(value), null);
      } catch (Exception | StackOverflowError | AssertionError | LinkageError e) {
        // errors a snippet can raise on its own; other VM errors still propagate
        capture.flush();
        Throwable cause =
            e.getCause() != null && e.getClass() == RuntimeException.class ? e.getCause() : e;
        log.debug("Snippet {} threw {}", className, cause.toString());
        String error = cause + "\n" + ExceptionUtil.formatCompactStackTrace(cause, 5);
        return new ExecutionResult(false, output(buffer), null, error);
      } finally {
        System.setOut(original);
      }
    }
  }

  private static String output(ByteArrayOutputStream buffer) {
    return buffer.toString(StandardCharsets.UTF_8);
  }

  private static CompilationResult stripCodes(CompilationResult result) {
    if (result.success()) return result;
    return new CompilationResult(
        false, result.className(), result.errors().replaceAll("(?m)^\\[[\\w.]+] ", "").trim());
  }
}
