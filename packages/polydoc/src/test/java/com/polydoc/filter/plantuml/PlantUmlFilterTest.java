package com.polydoc.filter.plantuml;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.polydoc.ast.Attr;
import com.polydoc.ast.CodeBlock;
import com.polydoc.ast.Image;
import com.polydoc.ast.NodeCodec;
import com.polydoc.ast.Para;
import com.polydoc.converter.ProcessResult;
import com.polydoc.converter.ProcessRunner;
import com.polydoc.exception.IoException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("PlantUmlFilter")
class PlantUmlFilterTest {

  private static final String DIAGRAM = "@startuml\nAlice -> Bob: Hello\n@enduml";

  @Mock private ProcessRunner runner;

  private PlantUmlFilter filter;

  @BeforeEach
  void setUp() {
    filter = new PlantUmlFilter(runner, "plantuml", DiagramFormat.SVG);
  }

  private static CodeBlock diagram(String... keyValues) {
    List<Map.Entry<String, String>> attrs =
        keyValues.length == 0 ? List.of() : List.of(Map.entry(keyValues[0], keyValues[1]));
    return new CodeBlock(new Attr("", List.of("plantuml"), attrs), DIAGRAM);
  }

  private static byte[] utf8(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  @Test
  @DisplayName("image formats become a paragraph with a data URI image")
  void svgBecomesDataUriImage() {
    when(runner.run(eq(List.of("plantuml", "-pipe", "-tsvg")), any()))
        .thenReturn(new ProcessResult(0, utf8("<svg/>"), ""));

    Para para = assertInstanceOf(Para.class, filter.transform(diagram()));

    Image image = assertInstanceOf(Image.class, NodeCodec.decode(para.inlines().get(0)));
    assertTrue(image.attr().hasClass("plantuml"));
    assertEquals(
        "data:image/svg+xml;base64," + Base64.getEncoder().encodeToString(utf8("<svg/>")),
        image.url());
    assertEquals("", image.title());
    assertEquals(0, image.caption().size());
    verify(runner).run(anyList(), eq(utf8(DIAGRAM)));
  }

  @Test
  @DisplayName("the format attribute selects the output type")
  void pngFormat() {
    byte[] png = {(byte) 0x89, 'P', 'N', 'G'};
    when(runner.run(eq(List.of("plantuml", "-pipe", "-tpng")), any()))
        .thenReturn(new ProcessResult(0, png, ""));

    Para para = assertInstanceOf(Para.class, filter.transform(diagram("format", "png")));

    Image image = (Image) NodeCodec.decode(para.inlines().get(0));
    assertTrue(image.url().startsWith("data:image/png;base64,"));
  }

  @Test
  @DisplayName("text formats become a plantuml-output code block")
  void textFormat() {
    when(runner.run(eq(List.of("plantuml", "-pipe", "-tutxt")), any()))
        .thenReturn(new ProcessResult(0, utf8("Alice -> Bob"), ""));

    CodeBlock out = assertInstanceOf(CodeBlock.class, filter.transform(diagram("format", "utxt")));

    assertEquals(List.of("plantuml-output"), out.attr().classes());
    assertEquals("Alice -> Bob", out.text());
  }

  @Test
  @DisplayName("unknown formats fall back to the default")
  void unknownFormatFallsBack() {
    when(runner.run(eq(List.of("plantuml", "-pipe", "-tsvg")), any()))
        .thenReturn(new ProcessResult(0, utf8("<svg/>"), ""));

    assertInstanceOf(Para.class, filter.transform(diagram("format", "gif")));
  }

  @Test
  @DisplayName("a non-zero exit becomes an error block with the original code")
  void nonZeroExit() {
    when(runner.run(anyList(), any()))
        .thenReturn(new ProcessResult(1, new byte[0], "Syntax Error?\n"));

    CodeBlock out = assertInstanceOf(CodeBlock.class, filter.transform(diagram()));

    assertEquals(List.of("plantuml-error"), out.attr().classes());
    assertEquals(
        "ERROR rendering PlantUML:\nPlantUML exited with code 1\nSyntax Error?\n\nOriginal code:\n"
            + DIAGRAM,
        out.text());
  }

  @Test
  @DisplayName("a missing executable becomes an error block")
  void launchFailure() {
    when(runner.run(anyList(), any())).thenThrow(new IoException("Failed to launch 'plantuml'"));

    CodeBlock out = assertInstanceOf(CodeBlock.class, filter.transform(diagram()));

    assertTrue(
        out.text()
            .startsWith("ERROR rendering PlantUML:\nFailed to execute PlantUML: Failed to launch"));
  }

  @Test
  void matchesPlantumlAndUml() {
    assertTrue(filter.matches(new CodeBlock(Attr.ofClasses("uml"), "")));
    assertTrue(filter.matches(diagram()));
    assertFalse(filter.matches(new CodeBlock(Attr.ofClasses("mermaid"), "")));
    verifyNoInteractions(runner);
  }

  @Test
  void formatMetadata() {
    assertEquals("-tlatex", DiagramFormat.LATEX.flag());
    assertTrue(DiagramFormat.TXT.isText());
    assertEquals("application/postscript", DiagramFormat.EPS.mimeType());
    assertEquals(DiagramFormat.PDF, DiagramFormat.fromAttribute(" PDF ").orElseThrow());
    assertTrue(DiagramFormat.fromAttribute("").isEmpty());
  }
}
