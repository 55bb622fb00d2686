package com.polydoc.filter.include;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * State threaded through one inclusion pass.
 *
 * <p>Immutable: {@link #descend} returns a new context with the stack extended, so a context can be
 * shared by reentrant or concurrent walks without affecting cycle detection.
 *
 * @param baseDir absolute directory relative includes are resolved against
 * @param stack absolute, normalized paths of the files currently being included, outermost first
 * @param depth number of nested includes above this pass
 * @param maxDepth depth at which includes stop being expanded
 */
public record IncludeContext(Path baseDir, List<Path> stack, int depth, int maxDepth) {
  public static final int DEFAULT_MAX_DEPTH = 10;

  public IncludeContext {
    Objects.requireNonNull(baseDir, "baseDir must not be null");
    baseDir = baseDir.toAbsolutePath().normalize();
    stack = List.copyOf(Objects.requireNonNull(stack, "stack must not be null"));
    if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
    if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
  }

  /** Context for a document whose own location is unknown (e.g. read from stdin). */
  public static IncludeContext root(Path baseDir, int maxDepth) {
    return new IncludeContext(baseDir, List.of(), 0, maxDepth);
  }

  /**
   * Context for the document stored at {@code source}: includes resolve next to it, and the
   * document including itself is reported as a cycle.
   */
  public static IncludeContext forDocument(Path source, int maxDepth) {
    Path abs = source.toAbsolutePath().normalize();
    Path parent = abs.getParent() == null ? abs : abs.getParent();
    return new IncludeContext(parent, List.of(abs), 0, maxDepth);
  }

  /** Context for the blocks parsed out of {@code included}, one level deeper. */
  public IncludeContext descend(Path included) {
    Path abs = included.toAbsolutePath().normalize();
    List<Path> extended = new ArrayList<>(stack);
    extended.add(abs);
    Path parent = abs.getParent() == null ? baseDir : abs.getParent();
    return new IncludeContext(parent, extended, depth + 1, maxDepth);
  }

  public boolean isOnStack(Path path) {
    return stack.contains(path);
  }

  public boolean isDepthExhausted() {
    return depth >= maxDepth;
  }
}
