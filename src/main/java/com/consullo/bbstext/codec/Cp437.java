package com.consullo.bbstext.codec;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;
import org.apache.commons.lang3.Validate;

/**
 * Code page 437 translation tables.
 *
 * <p>
 * The forward table maps every byte to a Unicode scalar value. The reverse
 * table is curated: it covers the ASCII range and the high bytes 0x80-0xFE.
 * Byte 0xFF (no-break space) is not reverse-mapped so that U+00A0 coming from
 * Unicode text is reported as unmappable instead of silently becoming an
 * invisible cell.
 * </p>
 *
 * <p>
 * All tables are immutable and safe for concurrent reads.
 * </p>
 *
 * @since 1.0
 */
public final class Cp437 {

  /** Glyph written in place of a code point the code page cannot represent. */
  public static final byte PLACEHOLDER = '?';

  static final int ESC = 0x1B;

  // Longest CSI sequence copied through before the scan gives up.
  private static final int MAX_CSI_LENGTH = 32;

  private static final int[] HIGH_HALF = {
    0x00C7, 0x00FC, 0x00E9, 0x00E2, 0x00E4, 0x00E0, 0x00E5, 0x00E7,
    0x00EA, 0x00EB, 0x00E8, 0x00EF, 0x00EE, 0x00EC, 0x00C4, 0x00C5,
    0x00C9, 0x00E6, 0x00C6, 0x00F4, 0x00F6, 0x00F2, 0x00FB, 0x00F9,
    0x00FF, 0x00D6, 0x00DC, 0x00A2, 0x00A3, 0x00A5, 0x20A7, 0x0192,
    0x00E1, 0x00ED, 0x00F3, 0x00FA, 0x00F1, 0x00D1, 0x00AA, 0x00BA,
    0x00BF, 0x2310, 0x00AC, 0x00BD, 0x00BC, 0x00A1, 0x00AB, 0x00BB,
    0x2591, 0x2592, 0x2593, 0x2502, 0x2524, 0x2561, 0x2562, 0x2556,
    0x2555, 0x2563, 0x2551, 0x2557, 0x255D, 0x255C, 0x255B, 0x2510,
    0x2514, 0x2534, 0x252C, 0x251C, 0x2500, 0x253C, 0x255E, 0x255F,
    0x255A, 0x2554, 0x2569, 0x2566, 0x2560, 0x2550, 0x256C, 0x2567,
    0x2568, 0x2564, 0x2565, 0x2559, 0x2558, 0x2552, 0x2553, 0x256B,
    0x256A, 0x2518, 0x250C, 0x2588, 0x2584, 0x258C, 0x2590, 0x2580,
    0x03B1, 0x00DF, 0x0393, 0x03C0, 0x03A3, 0x03C3, 0x00B5, 0x03C4,
    0x03A6, 0x0398, 0x03A9, 0x03B4, 0x221E, 0x03C6, 0x03B5, 0x2229,
    0x2261, 0x00B1, 0x2265, 0x2264, 0x2320, 0x2321, 0x00F7, 0x2248,
    0x00B0, 0x2219, 0x00B7, 0x221A, 0x207F, 0x00B2, 0x25A0, 0x00A0
  };

  private static final int[] TO_UNICODE = new int[256];
  private static final Map<Integer, Integer> FROM_UNICODE;

  static {
    for (int b = 0; b < 0x80; b++) {
      TO_UNICODE[b] = b;
    }
    for (int b = 0x80; b < 0x100; b++) {
      TO_UNICODE[b] = HIGH_HALF[b - 0x80];
    }
    Map<Integer, Integer> reverse = new HashMap<>(160);
    for (int b = 0x80; b < 0xFF; b++) {
      reverse.put(TO_UNICODE[b], b);
    }
    FROM_UNICODE = Map.copyOf(reverse);
  }

  private Cp437() {
  }

  /**
   * Decodes one code page byte.
   *
   * @param b byte value; only the low eight bits are used
   * @return the Unicode scalar value for the byte
   */
  public static int decode(int b) {
    return TO_UNICODE[b & 0xFF];
  }

  /**
   * Encodes one Unicode scalar value.
   *
   * @param codePoint Unicode scalar value
   * @return the code page byte (0-255), or empty when the code point has no curated mapping
   */
  public static OptionalInt encode(int codePoint) {
    if (codePoint >= 0 && codePoint < 0x80) {
      return OptionalInt.of(codePoint);
    }
    Integer b = FROM_UNICODE.get(codePoint);
    return b == null ? OptionalInt.empty() : OptionalInt.of(b);
  }

  /**
   * Encodes one Unicode scalar value, substituting {@link #PLACEHOLDER} when it is unmappable.
   *
   * @param codePoint Unicode scalar value
   * @return code page byte
   */
  public static byte encodeOrPlaceholder(int codePoint) {
    OptionalInt b = encode(codePoint);
    return b.isPresent() ? (byte) b.getAsInt() : PLACEHOLDER;
  }

  /**
   * Converts code page bytes to UTF-8 while copying escape sequences through
   * untouched.
   *
   * <p>
   * High bytes are decoded one at a time through the forward table. Adjacent
   * high bytes are never treated as an existing UTF-8 sequence: box-drawing runs
   * such as {@code C9 CD BB} would otherwise be corrupted.
   * </p>
   *
   * @param data code page bytes, possibly containing escape sequences
   * @return UTF-8 bytes
   */
  public static byte[] transcodeToUtf8(byte[] data) {
    Validate.notNull(data, "data must not be null");
    ByteArrayOutputStream out = new ByteArrayOutputStream(data.length + data.length / 2);
    int i = 0;
    while (i < data.length) {
      int b = data[i] & 0xFF;
      if (b == ESC) {
        int end = escapeEnd(data, i);
        out.write(data, i, end - i);
        i = end;
        continue;
      }
      if (b < 0x80) {
        out.write(b);
      } else {
        writeUtf8(out, TO_UNICODE[b]);
      }
      i++;
    }
    return out.toByteArray();
  }

  /**
   * Encodes Unicode text into code page bytes for a terminal without UTF-8
   * support. Escape sequences are plain ASCII and pass through unchanged;
   * unmappable characters become {@link #PLACEHOLDER}.
   *
   * @param text Unicode text
   * @return code page bytes
   */
  public static byte[] encodeString(String text) {
    Validate.notNull(text, "text must not be null");
    ByteArrayOutputStream out = new ByteArrayOutputStream(text.length());
    int i = 0;
    while (i < text.length()) {
      int cp = text.codePointAt(i);
      out.write(encodeOrPlaceholder(cp));
      i += Character.charCount(cp);
    }
    return out.toByteArray();
  }

  /**
   * Plain ASCII rendering of a code page byte, for terminals that can display
   * neither the code page nor UTF-8. Line-drawing characters collapse to
   * {@code | - +}; shade and block characters to {@code . # % @}.
   *
   * @param b byte value
   * @return ASCII character
   */
  public static char asciiFallback(int b) {
    int v = b & 0xFF;
    if (v < 0x80) {
      return (char) v;
    }
    switch (v) {
      case 0xB3:
      case 0xBA:
        return '|';
      case 0xC4:
      case 0xCD:
        return '-';
      case 0xB4: case 0xB5: case 0xB6: case 0xB7: case 0xB8: case 0xB9:
      case 0xBB: case 0xBC: case 0xBD: case 0xBE: case 0xBF:
      case 0xC0: case 0xC1: case 0xC2: case 0xC3: case 0xC5: case 0xC6:
      case 0xC7: case 0xC8: case 0xC9: case 0xCA: case 0xCB: case 0xCC:
      case 0xCE: case 0xCF: case 0xD0: case 0xD1: case 0xD2: case 0xD3:
      case 0xD4: case 0xD5: case 0xD6: case 0xD7: case 0xD8: case 0xD9:
      case 0xDA:
        return '+';
      case 0xB0:
        return '.';
      case 0xB1:
        return '#';
      case 0xB2:
        return '%';
      case 0xDB:
      case 0xDC:
      case 0xDD:
      case 0xDE:
      case 0xDF:
        return '@';
      case 0xFF:
        return ' ';
      default:
        return (char) PLACEHOLDER;
    }
  }

  /**
   * Returns the exclusive end of the escape sequence that starts at {@code start}.
   * CSI sequences end at their final byte (bounded by a safety limit); the
   * character-set designators {@code ESC ( x} and {@code ESC ) x} are three bytes;
   * any other escape is two bytes.
   */
  static int escapeEnd(byte[] data, int start) {
    int n = data.length;
    if (start + 1 >= n) {
      return n;
    }
    int next = data[start + 1] & 0xFF;
    if (next == '[') {
      int j = start + 2;
      while (j < n && j - start < MAX_CSI_LENGTH) {
        int c = data[j] & 0xFF;
        j++;
        if (c >= 0x40 && c <= 0x7E) {
          return j;
        }
      }
      return j;
    }
    if (next == '(' || next == ')') {
      return Math.min(start + 3, n);
    }
    return start + 2;
  }

  static void writeUtf8(ByteArrayOutputStream out, int cp) {
    byte[] encoded = new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8);
    out.write(encoded, 0, encoded.length);
  }
}
