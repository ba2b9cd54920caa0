package com.consullo.bbstext.ansi;

import com.consullo.bbstext.text.Placeholder;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-pass interpreter that turns raw template bytes into display bytes
 * while tracking the cursor and harvesting field markers.
 *
 * <p>
 * Checks run in a fixed order at each byte, and later checks rely on earlier
 * ones having consumed their bytes:
 * <ol>
 * <li>Escape sequences are copied through and applied to the cursor.</li>
 * <li>Placeholders ({@code @T|R8@}) are copied as plain text, so their
 * alignment suffix is not mistaken for a field marker.</li>
 * <li>Inline codes ({@code |14}, {@code |CL}, ...) are replaced by their escape
 * sequence, which is also applied to the cursor. {@code ||} is a literal bar.</li>
 * <li>Field markers are recorded and dropped from the output. They are
 * {@code |} or {@code ~} followed by two uppercase letters, or {@code |}
 * followed by a single uppercase letter that is not followed by another.</li>
 * <li>{@code $0}-{@code $7} select a foreground color; {@code ^G} (also
 * {@code ^g} and {@code ^7}) rings the bell.</li>
 * <li>Everything else is written out; bytes from the space up advance the
 * column.</li>
 * </ol>
 * CR LF pairs are collapsed to LF before scanning.
 * </p>
 *
 * <p>
 * Inline code names take precedence over field codes, so a field cannot be
 * called {@code CL}, {@code CR}, {@code DE}, {@code SC}, {@code RC} or
 * {@code PP}.
 * </p>
 */
public final class AnsiInterpreter {

  private static final Logger LOGGER = LoggerFactory.getLogger(AnsiInterpreter.class);

  private static final int ESC = 0x1B;
  private static final int BEL = 0x07;

  private final InterpreterConfig config;

  public AnsiInterpreter() {
    this(InterpreterConfig.defaults());
  }

  public AnsiInterpreter(InterpreterConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("config must not be null.");
    }
    this.config = config;
  }

  /**
   * Interprets raw template bytes.
   *
   * @param raw template bytes in the code page
   * @return display bytes and harvested fields
   */
  public InterpretResult interpret(byte[] raw) {
    Validate.notNull(raw, "raw must not be null");
    final byte[] data = normalizeLineEndings(raw);
    final CursorTracker tracker = new CursorTracker();
    final ByteArrayOutputStream out = new ByteArrayOutputStream(data.length + 64);
    final InterpretResult.Builder result = InterpretResult.builder();
    String text = null;

    int i = 0;
    while (i < data.length) {
      int b = data[i] & 0xFF;

      if (b == ESC) {
        int end = tracker.consumeEscape(data, i);
        out.write(data, i, end - i);
        i = end;
        continue;
      }

      if (b == '@') {
        if (text == null) {
          text = new String(data, StandardCharsets.ISO_8859_1);
        }
        Placeholder placeholder = Placeholder.parseAt(text, i);
        if (placeholder != null) {
          for (int k = placeholder.start(); k < placeholder.end(); k++) {
            writeByte(out, data[k] & 0xFF);
            tracker.advance(data[k] & 0xFF);
          }
          i = placeholder.end();
          continue;
        }
      }

      if (b == PipeCodes.DELIMITER) {
        i = interpretBar(data, i, tracker, out, result);
        continue;
      }

      if (b == '~' && isUpper(data, i + 1) && isUpper(data, i + 2)) {
        recordField(result, ascii(data, i + 1, 2), tracker);
        i += 3;
        continue;
      }

      if (b == '$' && i + 1 < data.length && data[i + 1] >= '0' && data[i + 1] <= '7') {
        writeCode(out, tracker, "\u001b[3" + (char) data[i + 1] + "m");
        i += 2;
        continue;
      }

      if (b == '^' && i + 1 < data.length && isBellCode(data[i + 1])) {
        out.write(BEL);
        i += 2;
        continue;
      }

      writeByte(out, b);
      tracker.advance(b);
      i++;
    }

    InterpretResult interpreted = result
        .displayBytes(out.toByteArray())
        .finalPosition(tracker.getRow(), tracker.getCol())
        .build();
    LOGGER.debug("interpret: {} raw bytes -> {} display bytes, {} fields",
        raw.length, out.size(), interpreted.getFields().size());
    return interpreted;
  }

  private int interpretBar(byte[] data, int i, CursorTracker tracker, ByteArrayOutputStream out,
      InterpretResult.Builder result) {
    if (i + 1 < data.length && data[i + 1] == PipeCodes.DELIMITER) {
      out.write(PipeCodes.DELIMITER);
      tracker.advance(PipeCodes.DELIMITER);
      return i + 2;
    }
    PipeCodes.Match match = PipeCodes.matchAt(data, i);
    if (match != null) {
      writeCode(out, tracker, match.replacement());
      return i + match.length();
    }
    if (isUpper(data, i + 1)) {
      if (isUpper(data, i + 2)) {
        recordField(result, ascii(data, i + 1, 2), tracker);
        return i + 3;
      }
      recordField(result, ascii(data, i + 1, 1), tracker);
      return i + 2;
    }
    out.write(PipeCodes.DELIMITER);
    tracker.advance(PipeCodes.DELIMITER);
    return i + 1;
  }

  private void writeByte(ByteArrayOutputStream out, int b) {
    if (b < 0x80) {
      out.write(b);
    } else {
      config.outputMode().writeHighByte(out, b);
    }
  }

  private static void writeCode(ByteArrayOutputStream out, CursorTracker tracker, String replacement) {
    byte[] bytes = replacement.getBytes(StandardCharsets.US_ASCII);
    out.write(bytes, 0, bytes.length);
    tracker.track(bytes);
  }

  private static void recordField(InterpretResult.Builder result, String code, CursorTracker tracker) {
    FieldPosition position = tracker.position();
    LOGGER.trace("field {} at row {} col {}", code, position.row(), position.col());
    result.field(code, position);
  }

  private static boolean isBellCode(byte b) {
    return b == 'G' || b == 'g' || b == '7';
  }

  private static boolean isUpper(byte[] data, int index) {
    return index < data.length && data[index] >= 'A' && data[index] <= 'Z';
  }

  private static String ascii(byte[] data, int start, int length) {
    return new String(data, start, length, StandardCharsets.US_ASCII);
  }

  static byte[] normalizeLineEndings(byte[] raw) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(raw.length);
    for (int i = 0; i < raw.length; i++) {
      if (raw[i] == '\r' && i + 1 < raw.length && raw[i + 1] == '\n') {
        continue;
      }
      out.write(raw[i]);
    }
    return out.toByteArray();
  }
}
