package com.polydoc;

import static org.junit.jupiter.api.Assertions.*;

import com.polydoc.exception.ConfigException;
import com.polydoc.filter.plantuml.DiagramFormat;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("Configuration loading")
class PolydocSettingsTest {

  @Test
  @DisplayName("the bundled application.yaml yields the documented defaults")
  void bundledDefaults() {
    Configuration cfg = new ConfigurationProvider(ConfigurationProvider.DEFAULT_LOCATION).config();

    PolydocSettings settings = PolydocSettings.from(cfg);

    assertEquals(PolydocSettings.defaults(), settings);
  }

  @Test
  @DisplayName("values from a classpath resource override the defaults")
  void classpathOverrides() {
    Configuration cfg = new ConfigurationProvider("classpath:polydoc-test.yaml").config();

    PolydocSettings settings = PolydocSettings.from(cfg);

    assertEquals(3, settings.includeMaxDepth());
    assertEquals("docs", settings.includeBaseDir());
    assertEquals("/opt/pandoc/bin/pandoc", settings.pandocCommand());
    assertEquals("markdown", settings.pandocFrom());
    assertEquals(DiagramFormat.PNG, settings.plantumlDefaultFormat());
    assertEquals("test.db", settings.sqliteDefaultDb());
  }

  @Test
  @DisplayName("a YAML file is loaded from a plain path or a file URI")
  void loadsFromFile(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("polydoc.yaml");
    Files.writeString(file, "polydoc:\n  pandoc:\n    from: commonmark\n");

    assertEquals(
        "commonmark",
        PolydocSettings.from(new ConfigurationProvider(file.toString()).config()).pandocFrom());
    assertEquals(
        "commonmark",
        PolydocSettings.from(new ConfigurationProvider(file.toUri().toString()).config())
            .pandocFrom());
  }

  @Test
  @DisplayName("a missing configuration file is a configuration error")
  void missingFile(@TempDir Path dir) {
    String location = dir.resolve("absent.yaml").toString();

    assertThrows(ConfigException.class, () -> new ConfigurationProvider(location));
  }

  @Test
  @DisplayName("${env:NAME} placeholders read the supplied environment")
  void environmentPlaceholders() {
    Configuration cfg = new BaseConfiguration();
    cfg.setProperty("polydoc.pandoc.command", "${env:PANDOC_BIN}");
    ConfigurationProvider.withEnvironment(cfg, Map.of("PANDOC_BIN", "/usr/local/bin/pandoc"));

    assertEquals("/usr/local/bin/pandoc", PolydocSettings.from(cfg).pandocCommand());
  }

  @Test
  @DisplayName("a blank location falls back to the bundled defaults")
  void blankLocation() {
    assertEquals(ConfigurationProvider.DEFAULT_LOCATION, new ConfigurationProvider(" ").location());
  }

  @Test
  @DisplayName("invalid values are rejected")
  void invalidValues() {
    Configuration negative = new BaseConfiguration();
    negative.setProperty("polydoc.include.max-depth", -1);
    Configuration notANumber = new BaseConfiguration();
    notANumber.setProperty("polydoc.include.max-depth", "deep");
    Configuration badFormat = new BaseConfiguration();
    badFormat.setProperty("polydoc.plantuml.default-format", "gif");

    assertThrows(ConfigException.class, () -> PolydocSettings.from(negative));
    assertThrows(ConfigException.class, () -> PolydocSettings.from(notANumber));
    assertThrows(ConfigException.class, () -> PolydocSettings.from(badFormat));
  }

  @Test
  void asMapMirrorsYamlLayout() {
    @SuppressWarnings("unchecked")
    Map<String, Object> polydoc =
        (Map<String, Object>) PolydocSettings.defaults().asMap().get("polydoc");

    assertEquals(Map.of("command", "plantuml", "default-format", "svg"), polydoc.get("plantuml"));
  }
}
