package com.polydoc.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The {@code [identifier, [class, ...], [[key, value], ...]]} attribute triple.
 *
 * <p>Class membership is an exact string match. Keys are not guaranteed unique; lookups return the
 * first match.
 */
public record Attr(String id, List<String> classes, List<Map.Entry<String, String>> attributes) {

  public static final Attr EMPTY = new Attr("", List.of(), List.of());

  public Attr {
    Objects.requireNonNull(id, "id must not be null");
    classes = List.copyOf(Objects.requireNonNull(classes, "classes must not be null"));
    attributes = List.copyOf(Objects.requireNonNull(attributes, "attributes must not be null"));
  }

  public static Attr ofClasses(String... classes) {
    return new Attr("", List.of(classes), List.of());
  }

  public boolean hasClass(String className) {
    return classes.contains(className);
  }

  public boolean hasAnyClass(String... classNames) {
    for (String c : classNames) {
      if (hasClass(c)) return true;
    }
    return false;
  }

  public Optional<String> attribute(String key) {
    return attributes.stream()
        .filter(e -> e.getKey().equals(key))
        .map(Map.Entry::getValue)
        .findFirst();
  }
}
