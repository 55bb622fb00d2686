package com.polydoc.filter.include;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("IncludeContext")
class IncludeContextTest {

  private final Path base = Path.of("/docs").toAbsolutePath();

  @Test
  @DisplayName("descend returns a new context and leaves the parent untouched")
  void descendDoesNotMutate() {
    IncludeContext root = IncludeContext.root(base, 4);
    Path chapter = base.resolve("chapters/one.md");

    IncludeContext child = root.descend(chapter);

    assertEquals(List.of(), root.stack());
    assertEquals(0, root.depth());
    assertEquals(List.of(chapter), child.stack());
    assertEquals(1, child.depth());
    assertEquals(base.resolve("chapters"), child.baseDir());
    assertEquals(4, child.maxDepth());
  }

  @Test
  @DisplayName("forDocument seeds the stack with the document itself")
  void forDocumentSeedsStack() {
    Path doc = base.resolve("book/./index.md");

    IncludeContext ctx = IncludeContext.forDocument(doc, 10);

    assertTrue(ctx.isOnStack(base.resolve("book/index.md")));
    assertEquals(base.resolve("book"), ctx.baseDir());
  }

  @Test
  @DisplayName("depth is exhausted once it reaches the maximum")
  void depthExhaustion() {
    IncludeContext ctx = IncludeContext.root(base, 1);

    assertFalse(ctx.isDepthExhausted());
    assertTrue(ctx.descend(base.resolve("a.md")).isDepthExhausted());
  }

  @Test
  @DisplayName("stack cannot be modified through the accessor")
  void stackIsImmutable() {
    IncludeContext ctx = IncludeContext.root(base, 2).descend(base.resolve("a.md"));

    assertThrows(UnsupportedOperationException.class, () -> ctx.stack().add(base));
  }

  @Test
  void modeAttributeValues() {
    assertEquals(IncludeMode.CODE, IncludeMode.fromAttribute("code").orElseThrow());
    assertTrue(IncludeMode.fromAttribute("CODE").isEmpty());
    assertTrue(IncludeMode.fromAttribute(null).isEmpty());
  }
}
