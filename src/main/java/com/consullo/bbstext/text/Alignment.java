package com.consullo.bbstext.text;

/**
 * Horizontal alignment of a value inside a fixed-width field.
 *
 * @since 1.0
 */
public enum Alignment {
  LEFT,
  RIGHT,
  CENTER;

  /**
   * Parses a one-letter alignment code. {@code L}, {@code R} and {@code C} map
   * to their alignment; anything else, including null or empty, is LEFT.
   *
   * @param code alignment code
   * @return alignment
   */
  public static Alignment parse(String code) {
    if (code == null || code.length() != 1) {
      return LEFT;
    }
    return fromCode(code.charAt(0));
  }

  /**
   * Character form of {@link #parse(String)}.
   *
   * @param code alignment code
   * @return alignment
   */
  public static Alignment fromCode(char code) {
    switch (code) {
      case 'R':
        return RIGHT;
      case 'C':
        return CENTER;
      default:
        return LEFT;
    }
  }
}
