package com.gentoro.urltree.mermaid;

import java.util.Optional;

/**
 * Mermaid class definitions keyed by operation set. Constant names are the sorted, uppercased,
 * underscore-joined operation keys a node must expose to be drawn in that colour; declaration
 * order is the order the classes are written to the graph header.
 */
public enum MermaidColorScheme {
  GET("lightSteelBlue"),
  POST("SteelBlue"),
  GET_POST("forestGreen"),
  DELETE_GET_PATCH("yellowGreen"),
  DELETE_GET_PUT("olive"),
  DELETE_GET("DarkSeaGreen"),
  DELETE("tomato"),
  OTHER("white");

  private final String color;

  MermaidColorScheme(String color) {
    this.color = color;
  }

  public String getColor() {
    return color;
  }

  /** The {@code classDef} statement declaring this class. */
  public String classDefinition() {
    return "classDef " + name() + " fill:" + color + ",stroke:#333,stroke-width:4px";
  }

  /** Exact match of a classification token against the table. */
  public static Optional<MermaidColorScheme> fromToken(String token) {
    if (token == null) return Optional.empty();
    for (MermaidColorScheme scheme : values()) {
      if (scheme.name().equals(token)) {
        return Optional.of(scheme);
      }
    }
    return Optional.empty();
  }

  /** Colour for {@code token}, or the {@link #OTHER} colour when the table has no such class. */
  public static String colorOf(String token) {
    return fromToken(token).orElse(OTHER).getColor();
  }
}
