package com.polydoc.filter.plantuml;

import java.util.Locale;
import java.util.Optional;

/** Output formats PlantUML can render in pipe mode. */
public enum DiagramFormat {
  SVG("image/svg+xml", false),
  PNG("image/png", false),
  PDF("application/pdf", false),
  EPS("application/postscript", false),
  TXT(null, true),
  UTXT(null, true),
  LATEX(null, true);

  private final String mimeType;
  private final boolean text;

  DiagramFormat(String mimeType, boolean text) {
    this.mimeType = mimeType;
    this.text = text;
  }

  /** MIME type of the rendered bytes; {@code null} for text formats. */
  public String mimeType() {
    return mimeType;
  }

  /** Whether the output is text to show verbatim rather than an image to embed. */
  public boolean isText() {
    return text;
  }

  /** PlantUML's {@code -t} option value. */
  public String flag() {
    return "-t" + name().toLowerCase(Locale.ROOT);
  }

  public static Optional<DiagramFormat> fromAttribute(String value) {
    if (value == null || value.isBlank()) return Optional.empty();
    try {
      return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
