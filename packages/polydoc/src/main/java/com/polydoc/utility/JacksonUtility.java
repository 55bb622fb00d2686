package com.polydoc.utility;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.polydoc.exception.SerializationException;

/** Shared Jackson mappers: one for document trees, one for printing settings as YAML. */
public final class JacksonUtility {
  // numbers kept exactly as pandoc wrote them; trailing garbage after the tree is an error
  private static final ObjectMapper AST_MAPPER =
      new ObjectMapper()
          .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
          .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

  private static final ObjectMapper SETTINGS_MAPPER =
      new ObjectMapper(
          YAMLFactory.builder()
              .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
              .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
              .build());

  private JacksonUtility() {}

  public static ObjectMapper astMapper() {
    return AST_MAPPER;
  }

  public static String toYaml(Object value) {
    try {
      return SETTINGS_MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Could not render settings as YAML", e);
    }
  }
}
