package com.polydoc.filter.exec;

import com.polydoc.compiler.CompilationResult;
import com.polydoc.compiler.ExecutionResult;
import com.polydoc.compiler.JavaSnippetCompiler;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Compiles and runs the snippets of one filter pass. Snippets share {@link #state()} and run in the
 * order they are submitted. The compiler is created on first use.
 */
class SnippetSession {
  private final Supplier<JavaSnippetCompiler> compilerFactory;
  private final Map<String, Object> state = new HashMap<>();
  private JavaSnippetCompiler compiler;
  private int counter;

  SnippetSession(Supplier<JavaSnippetCompiler> compilerFactory) {
    this.compilerFactory = compilerFactory;
  }

  ExecutionResult execute(String body) {
    if (compiler == null) {
      compiler = compilerFactory.get();
    }
    String className = "Snippet" + (++counter);
    CompilationResult compiled = compiler.compileSnippet(className, body);
    if (!compiled.success()) {
      return new ExecutionResult(false, "", null, "Compilation failed:\n" + compiled.errors());
    }
    return compiler.runSnippet(className, state);
  }
}
