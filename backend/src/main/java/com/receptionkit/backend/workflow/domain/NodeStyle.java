package com.receptionkit.backend.workflow.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Per-node visual override. Any field left {@code null} falls back to the template default for
 * the node type, then to the renderer's own default.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeStyle(
    String bgColor,
    String textColor,
    String borderColor,
    Integer borderWidth,
    Integer radius,
    String fontWeight,
    String theme,
    Integer width,
    Integer height) {

  public static final int MIN_WIDTH = 300;
  public static final int MIN_HEIGHT = 200;

  public static NodeStyle colours(String bgColor, String textColor, String borderColor) {
    return new NodeStyle(bgColor, textColor, borderColor, null, null, null, null, null, null);
  }

  /** Overlays {@code incoming} on this style and clamps dimensions to their minimums. */
  public NodeStyle mergedWith(NodeStyle incoming) {
    if (incoming == null) {
      return clamp();
    }
    return new NodeStyle(
            pick(incoming.bgColor, bgColor),
            pick(incoming.textColor, textColor),
            pick(incoming.borderColor, borderColor),
            pick(incoming.borderWidth, borderWidth),
            pick(incoming.radius, radius),
            pick(incoming.fontWeight, fontWeight),
            pick(incoming.theme, theme),
            pick(incoming.width, width),
            pick(incoming.height, height))
        .clamp();
  }

  public NodeStyle clamp() {
    return new NodeStyle(
        bgColor,
        textColor,
        borderColor,
        borderWidth,
        radius,
        fontWeight,
        theme,
        width != null ? Math.max(width, MIN_WIDTH) : null,
        height != null ? Math.max(height, MIN_HEIGHT) : null);
  }

  public boolean hasColours() {
    return bgColor != null || textColor != null || borderColor != null;
  }

  private static <T> T pick(T preferred, T fallback) {
    return preferred != null ? preferred : fallback;
  }
}
