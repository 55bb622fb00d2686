package com.polydoc.ast;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.polydoc.exception.IoException;
import com.polydoc.exception.SerializationException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AstIOTest {

  private static final String DOC =
      "{\"pandoc-api-version\":[1,23,1],\"meta\":{},\"blocks\":"
          + "[{\"t\":\"Para\",\"c\":[{\"t\":\"Str\",\"c\":\"x\"}]},{\"t\":\"HorizontalRule\"}]}";

  @Test
  void writesCompactJsonAndKeepsStreamOpen() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();

    AstIO.write(AstIO.parse(DOC), out);
    out.write('\n');

    assertEquals(DOC + "\n", out.toString(StandardCharsets.UTF_8));
  }

  @Test
  void readsFromStreamAndFile(@TempDir Path dir) {
    JsonNode fromStream =
        AstIO.read(new ByteArrayInputStream(DOC.getBytes(StandardCharsets.UTF_8)));
    String file = dir.resolve("doc.json").toString();

    AstIO.write(fromStream, file);

    assertEquals(fromStream, AstIO.read(file));
  }

  @Test
  void rejectsInvalidInput(@TempDir Path dir) {
    assertThrows(
        SerializationException.class,
        () -> AstIO.read(new ByteArrayInputStream("{\"blocks\": [".getBytes())));
    assertThrows(
        SerializationException.class, () -> AstIO.read(new ByteArrayInputStream(new byte[0])));
    assertThrows(SerializationException.class, () -> AstIO.parse("{} trailing"));
    assertThrows(IoException.class, () -> AstIO.read(dir.resolve("missing.json").toString()));
  }

  @Test
  void documentBuilder() {
    JsonNode doc = AstNodes.document(AstNodes.text("hi"));

    assertEquals("[1,23,1]", doc.get("pandoc-api-version").toString());
    assertTrue(doc.get("meta").isObject());
    assertEquals("hi", doc.get("blocks").get(0).get("c").asText());
  }
}
