package com.consullo.bbstext.ansi;

import org.apache.commons.lang3.Validate;

/**
 * Screen position of a field and the style active there.
 *
 * @param row 1-based row
 * @param col 1-based column
 * @param style escape sequence restoring the template's style at this position
 * @since 1.0
 */
public record FieldPosition(int row, int col, String style) {

  public FieldPosition {
    Validate.isTrue(row >= 1, "row must be positive");
    Validate.isTrue(col >= 1, "col must be positive");
    Validate.notNull(style, "style must not be null");
  }

  /**
   * Cursor-addressing sequence that moves to this position.
   *
   * @return {@code ESC [ row ; col H}
   */
  public String cursorAddress() {
    return "\u001b[" + row + ";" + col + "H";
  }

  /**
   * Sequence that draws {@code text} over the field without losing the
   * template's coloring: move, restore style, then the text.
   *
   * @param text value to draw
   * @return overlay sequence
   */
  public String overlay(String text) {
    Validate.notNull(text, "text must not be null");
    return cursorAddress() + style + text;
  }
}
