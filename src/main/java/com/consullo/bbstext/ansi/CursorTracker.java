package com.consullo.bbstext.ansi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the 1-based cursor position and text attributes produced by a byte
 * stream, the way a terminal would while drawing it.
 *
 * <p>
 * One tracker serves one scan pass; it is not reused across templates.
 * </p>
 *
 * <ul>
 * <li>{@code A}/{@code B}/{@code C}/{@code D} move relative to the cursor, clamped at 1.</li>
 * <li>{@code H}/{@code f} set an absolute position, clamped at 1.</li>
 * <li>{@code m} updates the attributes.</li>
 * <li>Other CSI sequences, including save and restore cursor, do not move the cursor.</li>
 * <li>CR moves to column 1, LF to column 1 of the next row, TAB to the next multiple-of-8 stop.</li>
 * </ul>
 */
public final class CursorTracker {

  private static final Logger LOGGER = LoggerFactory.getLogger(CursorTracker.class);

  static final int ESC = 0x1B;

  private int row = 1;
  private int col = 1;
  private final SgrState style = new SgrState();

  /**
   * Consumes the escape sequence starting at {@code start} and applies it.
   *
   * @param data input bytes
   * @param start index of an ESC byte
   * @return exclusive end of the consumed bytes; for a malformed CSI this is
   *     the offending byte, which the caller scans next
   */
  public int consumeEscape(byte[] data, int start) {
    if (start + 1 >= data.length) {
      return data.length;
    }
    int next = data[start + 1] & 0xFF;
    if (next == '[') {
      CsiSequence seq = CsiSequence.scan(data, start);
      if (seq.isComplete()) {
        apply(seq);
      } else if (seq.end() < data.length) {
        LOGGER.warn("Malformed escape sequence at offset {}: unexpected byte 0x{}",
            start, Integer.toHexString(data[seq.end()] & 0xFF));
      } else {
        LOGGER.debug("Incomplete escape sequence at offset {}", start);
      }
      return seq.end();
    }
    if (next == '(' || next == ')') {
      return Math.min(start + 3, data.length);
    }
    return start + 2;
  }

  /**
   * Applies a complete CSI sequence.
   *
   * @param seq scanned sequence
   */
  public void apply(CsiSequence seq) {
    switch (seq.finalByte()) {
      case 'A':
        row = Math.max(1, row - seq.param(0, 1));
        break;
      case 'B':
        row += seq.param(0, 1);
        break;
      case 'C':
        col += seq.param(0, 1);
        break;
      case 'D':
        col = Math.max(1, col - seq.param(0, 1));
        break;
      case 'H':
      case 'f':
        row = Math.max(1, seq.param(0, 1));
        col = Math.max(1, seq.param(1, 1));
        break;
      case 'm':
        style.apply(seq.params());
        break;
      default:
        LOGGER.trace("Ignoring CSI terminator '{}'", (char) seq.finalByte());
        break;
    }
  }

  /**
   * Advances over one non-escape byte.
   *
   * @param b byte value
   */
  public void advance(int b) {
    switch (b) {
      case '\r':
        col = 1;
        break;
      case '\n':
        row++;
        col = 1;
        break;
      case '\t':
        col = ((col - 1) / 8 + 1) * 8 + 1;
        break;
      default:
        if (b >= 0x20) {
          col++;
        }
        break;
    }
  }

  /**
   * Tracks a whole byte run, such as the expansion of an inline code.
   *
   * @param bytes bytes to track
   */
  public void track(byte[] bytes) {
    int i = 0;
    while (i < bytes.length) {
      int b = bytes[i] & 0xFF;
      if (b == ESC) {
        i = consumeEscape(bytes, i);
        continue;
      }
      advance(b);
      i++;
    }
  }

  /**
   * Current position and restoring style.
   *
   * @return field position at the cursor
   */
  public FieldPosition position() {
    return new FieldPosition(row, col, style.restoreSequence());
  }

  public int getRow() {
    return row;
  }

  public int getCol() {
    return col;
  }

  public SgrState getStyle() {
    return style;
  }
}
