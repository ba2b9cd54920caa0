package com.consullo.bbstext.text;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Width-aware operations over text that may contain terminal escape sequences.
 *
 * <p>
 * An escape sequence is ESC followed by {@code [}, any parameter and
 * intermediate characters (0x20-0x3F) and a final character in the range
 * {@code @}-{@code ~}. Such sequences have zero width, are never split and are
 * always copied. A sequence broken by any other character ends just before
 * it, and that character is measured normally. A bare ESC that is not
 * followed by {@code [} is itself zero width; the character after it is
 * measured normally.
 * </p>
 *
 * <p>
 * A sequence still open at the end of the text would absorb anything appended
 * to it, so padding drops such a trailing fragment first.
 * </p>
 *
 * <p>
 * Widths are counted in code points. The code page text this is used with has
 * one cell per character.
 * </p>
 */
public final class StyledText {

  private static final char ESC = 0x1B;

  private StyledText() {
  }

  /**
   * Counts the characters that occupy a screen cell.
   *
   * @param text styled text
   * @return number of visible characters
   */
  public static int visibleLength(String text) {
    Validate.notNull(text, "text must not be null");
    int count = 0;
    int i = 0;
    int n = text.length();
    while (i < n) {
      char c = text.charAt(i);
      if (c == ESC) {
        i = skipEscape(text, i);
        continue;
      }
      count++;
      i += Character.charCount(text.codePointAt(i));
    }
    return count;
  }

  /**
   * Keeps at most {@code max} visible characters. Every escape sequence in the
   * input is kept intact regardless of where it appears, so colors set after
   * the cut still take effect.
   *
   * @param text styled text
   * @param max maximum visible characters; negative is treated as zero
   * @return truncated text
   */
  public static String truncate(String text, int max) {
    Validate.notNull(text, "text must not be null");
    if (visibleLength(text) <= max) {
      return text;
    }
    StringBuilder sb = new StringBuilder(text.length());
    int copied = 0;
    int i = 0;
    int n = text.length();
    while (i < n) {
      char c = text.charAt(i);
      if (c == ESC) {
        int end = skipEscape(text, i);
        sb.append(text, i, end);
        i = end;
        continue;
      }
      int step = Character.charCount(text.codePointAt(i));
      if (copied < max) {
        sb.append(text, i, i + step);
        copied++;
      }
      i += step;
    }
    return sb.toString();
  }

  /**
   * Appends pad characters until the text is {@code width} cells wide. Never truncates.
   *
   * @param text styled text
   * @param width target width
   * @param padChar pad character
   * @return padded text
   */
  public static String pad(String text, int width, char padChar) {
    int missing = width - visibleLength(text);
    if (missing <= 0) {
      return text;
    }
    return dropOpenEscape(text) + StringUtils.repeat(padChar, missing);
  }

  /**
   * Truncates then space-pads to exactly {@code width} cells. A width of zero
   * or less leaves the text unchanged.
   *
   * @param text styled text
   * @param width field width
   * @return constrained text
   */
  public static String applyWidthConstraint(String text, int width) {
    Validate.notNull(text, "text must not be null");
    if (width <= 0) {
      return text;
    }
    return pad(truncate(text, width), width, ' ');
  }

  /**
   * Truncates then space-pads to exactly {@code width} cells, placing the
   * padding according to {@code alignment}. For CENTER an odd pad cell goes
   * to the right. A width of zero or less leaves the text unchanged.
   *
   * @param text styled text
   * @param width field width
   * @param alignment value alignment
   * @return constrained text
   */
  public static String applyWidthConstraintAligned(String text, int width, Alignment alignment) {
    Validate.notNull(text, "text must not be null");
    Validate.notNull(alignment, "alignment must not be null");
    if (width <= 0) {
      return text;
    }
    String value = truncate(text, width);
    int totalPad = width - visibleLength(value);
    if (totalPad <= 0) {
      return value;
    }
    value = dropOpenEscape(value);
    switch (alignment) {
      case RIGHT:
        return StringUtils.repeat(' ', totalPad) + value;
      case CENTER:
        int leftPad = totalPad / 2;
        return StringUtils.repeat(' ', leftPad) + value + StringUtils.repeat(' ', totalPad - leftPad);
      default:
        return value + StringUtils.repeat(' ', totalPad);
    }
  }

  /**
   * Removes CSI escape sequences, leaving only visible text.
   *
   * @param text styled text
   * @return plain text
   */
  public static String stripEscapes(String text) {
    Validate.notNull(text, "text must not be null");
    StringBuilder sb = new StringBuilder(text.length());
    int i = 0;
    int n = text.length();
    while (i < n) {
      char c = text.charAt(i);
      if (c == ESC) {
        i = skipEscape(text, i);
        continue;
      }
      sb.append(c);
      i++;
    }
    return sb.toString();
  }

  /**
   * Returns the index just past the first {@code count} visible characters, or
   * the text length when it has fewer.
   *
   * @param text styled text
   * @param count number of visible characters
   * @return character index
   */
  public static int indexAfterVisible(String text, int count) {
    Validate.notNull(text, "text must not be null");
    int seen = 0;
    int i = 0;
    int n = text.length();
    while (i < n && seen < count) {
      char c = text.charAt(i);
      if (c == ESC) {
        i = skipEscape(text, i);
        continue;
      }
      seen++;
      i += Character.charCount(text.codePointAt(i));
    }
    return i;
  }

  /**
   * Removes an escape sequence left open at the end of the text, including a
   * lone trailing ESC.
   *
   * @param text styled text
   * @return text without a trailing unterminated sequence
   */
  static String dropOpenEscape(String text) {
    int n = text.length();
    int i = 0;
    while (i < n) {
      if (text.charAt(i) != ESC) {
        i++;
        continue;
      }
      if (i + 1 == n) {
        return text.substring(0, i);
      }
      if (text.charAt(i + 1) != '[') {
        i++;
        continue;
      }
      int j = i + 2;
      while (j < n && isParameterOrIntermediate(text.charAt(j))) {
        j++;
      }
      if (j == n) {
        return text.substring(0, i);
      }
      i = isFinal(text.charAt(j)) ? j + 1 : j;
    }
    return text;
  }

  private static int skipEscape(String text, int start) {
    int n = text.length();
    if (start + 1 >= n || text.charAt(start + 1) != '[') {
      return start + 1;
    }
    int j = start + 2;
    while (j < n) {
      char c = text.charAt(j);
      if (isFinal(c)) {
        return j + 1;
      }
      if (!isParameterOrIntermediate(c)) {
        return j;
      }
      j++;
    }
    return n;
  }

  private static boolean isParameterOrIntermediate(char c) {
    return c >= 0x20 && c <= 0x3F;
  }

  private static boolean isFinal(char c) {
    return c >= '@' && c <= '~';
  }
}
