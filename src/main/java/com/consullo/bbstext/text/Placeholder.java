package com.consullo.bbstext.text;

/**
 * One placeholder found in a template.
 *
 * <p>
 * Grammar: {@code @<code>[|<align><digits>?][:<digits> | <hash-run>]@} where
 * the code is an uppercase letter or {@code #} and the alignment is
 * {@code L}, {@code R} or {@code C}. Examples: {@code @T@}, {@code @T:8@},
 * {@code @T####@}, {@code @T|R@}, {@code @T|R8@}, {@code @T|C:10@},
 * {@code @T|L#####@}.
 * </p>
 *
 * <p>
 * The width comes from the digits after the alignment, else the colon width,
 * else the length of the whole placeholder when it is written with a hash run
 * (so the placeholder occupies exactly the cells its value will fill), else
 * zero for unconstrained.
 * </p>
 *
 * @param code field code
 * @param alignment value alignment, LEFT when not given
 * @param width field width, 0 when unconstrained
 * @param start index of the opening {@code @}
 * @param end index just past the closing {@code @}
 * @since 1.0
 */
public record Placeholder(char code, Alignment alignment, int width, int start, int end) {

  private static final int MAX_WIDTH = 1_000;

  /**
   * Parses the placeholder that starts at {@code start}, without backtracking.
   *
   * @param text template text
   * @param start index of a candidate opening {@code @}
   * @return the placeholder, or null when none starts there
   */
  public static Placeholder parseAt(CharSequence text, int start) {
    final int n = text.length();
    if (start + 2 >= n || text.charAt(start) != '@' || !isCode(text.charAt(start + 1))) {
      return null;
    }
    final char code = text.charAt(start + 1);
    int i = start + 2;

    Alignment alignment = Alignment.LEFT;
    int alignWidth = 0;
    if (text.charAt(i) == '|') {
      if (i + 1 >= n || !isAlignment(text.charAt(i + 1))) {
        return null;
      }
      alignment = Alignment.fromCode(text.charAt(i + 1));
      i += 2;
      int digitsStart = i;
      while (i < n && isDigit(text.charAt(i))) {
        i++;
      }
      alignWidth = number(text, digitsStart, i);
    }

    int colonWidth = 0;
    boolean hashRun = false;
    if (i < n && text.charAt(i) == ':') {
      int digitsStart = i + 1;
      i = digitsStart;
      while (i < n && isDigit(text.charAt(i))) {
        i++;
      }
      if (i == digitsStart) {
        return null;
      }
      colonWidth = number(text, digitsStart, i);
    } else if (i < n && text.charAt(i) == '#') {
      while (i < n && text.charAt(i) == '#') {
        i++;
      }
      hashRun = true;
    }

    if (i >= n || text.charAt(i) != '@') {
      return null;
    }
    final int end = i + 1;

    int width = 0;
    if (alignWidth > 0) {
      width = alignWidth;
    } else if (colonWidth > 0) {
      width = colonWidth;
    } else if (hashRun) {
      width = end - start;
    }
    return new Placeholder(code, alignment, width, start, end);
  }

  /**
   * Source length of the placeholder.
   *
   * @return number of characters between start and end
   */
  public int length() {
    return end - start;
  }

  private static boolean isCode(char c) {
    return (c >= 'A' && c <= 'Z') || c == '#';
  }

  private static boolean isAlignment(char c) {
    return c == 'L' || c == 'R' || c == 'C';
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static int number(CharSequence text, int from, int to) {
    int value = 0;
    for (int k = from; k < to; k++) {
      value = Math.min(MAX_WIDTH, value * 10 + (text.charAt(k) - '0'));
    }
    return value;
  }
}
