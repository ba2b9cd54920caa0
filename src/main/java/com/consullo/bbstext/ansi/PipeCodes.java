package com.consullo.bbstext.ansi;

import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * Inline color and screen codes written as {@code |} followed by two or three
 * alphanumeric characters, e.g. {@code |14} (yellow) or {@code |B4} (blue
 * background).
 *
 * <p>
 * Matching is case-sensitive and tries the three-character form before the
 * two-character form, so {@code |B10} wins over {@code |B1}. {@code ||} is a
 * literal {@code |}. A {@code |} that starts no known code is copied as-is and
 * the characters after it are scanned normally.
 * </p>
 */
public final class PipeCodes {

  /** Delimiter that introduces an inline code. */
  public static final char DELIMITER = '|';

  private static final String ESC = "\u001b";

  private static final Map<String, String> TABLE = Map.ofEntries(
      Map.entry("00", ESC + "[0;30m"),
      Map.entry("01", ESC + "[0;34m"),
      Map.entry("02", ESC + "[0;32m"),
      Map.entry("03", ESC + "[0;36m"),
      Map.entry("04", ESC + "[0;31m"),
      Map.entry("05", ESC + "[0;35m"),
      Map.entry("06", ESC + "[0;33m"),
      Map.entry("07", ESC + "[0;37m"),
      Map.entry("08", ESC + "[1;30m"),
      Map.entry("09", ESC + "[1;34m"),
      Map.entry("10", ESC + "[1;32m"),
      Map.entry("11", ESC + "[1;36m"),
      Map.entry("12", ESC + "[1;31m"),
      Map.entry("13", ESC + "[1;35m"),
      Map.entry("14", ESC + "[1;33m"),
      Map.entry("15", ESC + "[1;37m"),
      Map.entry("B0", ESC + "[40m"),
      Map.entry("B1", ESC + "[41m"),
      Map.entry("B2", ESC + "[42m"),
      Map.entry("B3", ESC + "[43m"),
      Map.entry("B4", ESC + "[44m"),
      Map.entry("B5", ESC + "[45m"),
      Map.entry("B6", ESC + "[46m"),
      Map.entry("B7", ESC + "[47m"),
      Map.entry("B8", ESC + "[100m"),
      Map.entry("B9", ESC + "[101m"),
      Map.entry("B10", ESC + "[102m"),
      Map.entry("B11", ESC + "[103m"),
      Map.entry("B12", ESC + "[104m"),
      Map.entry("B13", ESC + "[105m"),
      Map.entry("B14", ESC + "[106m"),
      Map.entry("B15", ESC + "[107m"),
      Map.entry("CL", ESC + "[2J" + ESC + "[H"),
      Map.entry("DE", ESC + "[K"),
      Map.entry("SC", ESC + "[s"),
      Map.entry("RC", ESC + "[u"),
      Map.entry("PP", ESC + "[u"),
      Map.entry("23", ESC + "[0m"),
      Map.entry("CR", "\r\n"));

  private PipeCodes() {
  }

  /**
   * A matched inline code.
   *
   * @param code code without the delimiter
   * @param replacement escape sequence the code stands for
   * @param length number of source characters consumed, delimiter included
   */
  public record Match(String code, String replacement, int length) {
  }

  /**
   * Looks up a code without its delimiter.
   *
   * @param code e.g. {@code "14"} or {@code "B10"}
   * @return replacement escape sequence, or null when unknown
   */
  public static String replacement(String code) {
    return TABLE.get(code);
  }

  /**
   * Matches a code starting at the delimiter at {@code start}.
   *
   * @param text source text
   * @param start index of the delimiter
   * @return match, or null when no code starts there
   */
  public static Match matchAt(CharSequence text, int start) {
    for (int len = 3; len >= 2; len--) {
      if (start + len >= text.length()) {
        continue;
      }
      String candidate = text.subSequence(start + 1, start + 1 + len).toString();
      String replacement = TABLE.get(candidate);
      if (replacement != null) {
        return new Match(candidate, replacement, len + 1);
      }
    }
    return null;
  }

  /**
   * Byte form of {@link #matchAt(CharSequence, int)} for raw template bytes.
   *
   * @param data raw bytes
   * @param start index of the delimiter
   * @return match, or null when no code starts there
   */
  public static Match matchAt(byte[] data, int start) {
    for (int len = 3; len >= 2; len--) {
      if (start + len >= data.length) {
        continue;
      }
      char[] chars = new char[len];
      boolean ascii = true;
      for (int k = 0; k < len; k++) {
        int b = data[start + 1 + k] & 0xFF;
        if (b >= 0x80) {
          ascii = false;
          break;
        }
        chars[k] = (char) b;
      }
      if (!ascii) {
        continue;
      }
      String candidate = new String(chars);
      String replacement = TABLE.get(candidate);
      if (replacement != null) {
        return new Match(candidate, replacement, len + 1);
      }
    }
    return null;
  }

  /**
   * Replaces every inline code with its escape sequence.
   *
   * @param text text containing inline codes
   * @return text containing escape sequences
   */
  public static String translate(String text) {
    Validate.notNull(text, "text must not be null");
    if (text.indexOf(DELIMITER) < 0) {
      return text;
    }
    StringBuilder sb = new StringBuilder(text.length() + 16);
    int i = 0;
    int n = text.length();
    while (i < n) {
      char c = text.charAt(i);
      if (c != DELIMITER) {
        sb.append(c);
        i++;
        continue;
      }
      if (i + 1 < n && text.charAt(i + 1) == DELIMITER) {
        sb.append(DELIMITER);
        i += 2;
        continue;
      }
      Match match = matchAt(text, i);
      if (match != null) {
        sb.append(match.replacement());
        i += match.length();
      } else {
        sb.append(c);
        i++;
      }
    }
    return sb.toString();
  }

  /**
   * Removes the numeric color codes ({@code |00} to {@code |99}) from text, for
   * plain-text uses such as quoting a message.
   *
   * @param text text containing inline codes
   * @return text without numeric codes
   */
  public static String stripColorCodes(String text) {
    Validate.notNull(text, "text must not be null");
    StringBuilder sb = new StringBuilder(text.length());
    int i = 0;
    int n = text.length();
    while (i < n) {
      char c = text.charAt(i);
      if (c == DELIMITER && i + 2 < n && isDigit(text.charAt(i + 1)) && isDigit(text.charAt(i + 2))) {
        i += 3;
        continue;
      }
      sb.append(c);
      i++;
    }
    return sb.toString();
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
