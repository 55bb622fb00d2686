package com.polydoc.filter;

import static org.junit.jupiter.api.Assertions.*;

import com.polydoc.PolydocSettings;
import com.polydoc.exception.ValidationException;
import com.polydoc.filter.exec.JavaExecFilter;
import com.polydoc.filter.include.IncludeFilter;
import com.polydoc.filter.plantuml.PlantUmlFilter;
import com.polydoc.filter.sql.SqliteExecFilter;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FilterRegistry")
class FilterRegistryTest {

  private final FilterRegistry registry = new FilterRegistry(PolydocSettings.defaults(), null);

  private static AstFilter unwrap(AstFilter filter) {
    return assertInstanceOf(SafeFilter.class, filter).delegate();
  }

  @Test
  @DisplayName("every named filter is wrapped by the safety decorator")
  void namedFiltersAreSafe() {
    assertInstanceOf(IncludeFilter.class, unwrap(registry.create("include")));
    assertInstanceOf(JavaExecFilter.class, unwrap(registry.create("java-exec")));
    assertInstanceOf(SqliteExecFilter.class, unwrap(registry.create("sqlite-exec")));
    assertInstanceOf(SqliteExecFilter.class, unwrap(registry.create("sqlite")));
    assertInstanceOf(PlantUmlFilter.class, unwrap(registry.create("plantuml")));
    assertInstanceOf(PlantUmlFilter.class, unwrap(registry.create("uml")));
  }

  @Test
  @DisplayName("all composes include, java-exec, sqlite-exec and plantuml in that order")
  void allIsFixedComposition() {
    CompositeFilter all = assertInstanceOf(CompositeFilter.class, registry.create("all"));

    List<AstFilter> stages = all.filters();
    assertEquals(4, stages.size());
    assertInstanceOf(IncludeFilter.class, unwrap(stages.get(0)));
    assertInstanceOf(JavaExecFilter.class, unwrap(stages.get(1)));
    assertInstanceOf(SqliteExecFilter.class, unwrap(stages.get(2)));
    assertInstanceOf(PlantUmlFilter.class, unwrap(stages.get(3)));
  }

  @Test
  void unknownNameIsRejected() {
    ValidationException e =
        assertThrows(ValidationException.class, () -> registry.create("pdf-exec"));

    assertTrue(e.getMessage().contains("pdf-exec"));
    assertThrows(ValidationException.class, () -> registry.create(null));
  }
}
