package com.polydoc.ast;

import com.fasterxml.jackson.databind.node.ArrayNode;
import java.util.Objects;

/** An inline image: {@code {"t": "Image", "c": [attr, [inline, ...], [url, title]]}}. */
public record Image(Attr attr, ArrayNode caption, String url, String title) implements Node {
  public static final String TYPE = "Image";

  public Image {
    Objects.requireNonNull(attr, "attr must not be null");
    Objects.requireNonNull(caption, "caption must not be null");
    Objects.requireNonNull(url, "url must not be null");
    Objects.requireNonNull(title, "title must not be null");
  }

  @Override
  public String type() {
    return TYPE;
  }
}
