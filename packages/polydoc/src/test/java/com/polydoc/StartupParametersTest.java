package com.polydoc;

import static org.junit.jupiter.api.Assertions.*;

import com.polydoc.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StartupParameters")
class StartupParametersTest {

  @Test
  void defaults() {
    StartupParameters params = new StartupParameters(new String[] {"filter", "--type", "include"});

    assertEquals("filter", params.command());
    assertEquals("include", params.getParameter("type"));
    assertEquals("-", params.getParameter("input"));
    assertEquals("-", params.getParameter("output"));
    assertEquals("classpath:application.yaml", params.configFile());
    assertTrue(params.getOptionalParameter("source").isEmpty());
  }

  @Test
  void shortAliasesAndStdio() {
    StartupParameters params =
        new StartupParameters(
            new String[] {"filter", "-t", "all", "-i", "-", "-o", "out.json", "-s", "doc.md"});

    assertEquals("all", params.getParameter("type"));
    assertEquals("-", params.getParameter("input"));
    assertEquals("out.json", params.getParameter("output"));
    assertEquals("doc.md", params.getOptionalParameter("source").orElseThrow());
  }

  @Test
  void noArgumentsMeansHelp() {
    assertEquals("help", new StartupParameters(new String[0]).command());
    assertEquals("help", new StartupParameters(new String[] {"--help"}).command());
  }

  @Test
  void invalidArguments() {
    assertThrows(ValidationException.class, () -> new StartupParameters(new String[] {"render"}));
    assertThrows(ValidationException.class, () -> new StartupParameters(new String[] {"filter"}));
    assertThrows(
        ValidationException.class,
        () -> new StartupParameters(new String[] {"filter", "--type"}));
    assertThrows(
        ValidationException.class,
        () -> new StartupParameters(new String[] {"filter", "-x", "1", "--type", "all"}));
    assertThrows(
        ValidationException.class,
        () -> new StartupParameters(new String[] {"filter", "extra", "--type", "all"}));
  }
}
