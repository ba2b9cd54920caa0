package com.consullo.bbstext.codec;

import java.io.ByteArrayOutputStream;

/**
 * How high (0x80-0xFF) code page bytes are written to a terminal session.
 *
 * @since 1.0
 */
public enum OutputMode {

  /** Bytes are written unchanged for terminals that speak the code page natively. */
  CP437 {
    @Override
    public void writeHighByte(ByteArrayOutputStream out, int b) {
      out.write(b);
    }
  },

  /** Bytes are decoded through the code page and written as UTF-8. */
  UTF8 {
    @Override
    public void writeHighByte(ByteArrayOutputStream out, int b) {
      Cp437.writeUtf8(out, Cp437.decode(b));
    }
  },

  /** Bytes are replaced with a plain ASCII approximation. */
  ASCII {
    @Override
    public void writeHighByte(ByteArrayOutputStream out, int b) {
      out.write(Cp437.asciiFallback(b));
    }
  };

  /**
   * Writes a single high byte in this mode's encoding.
   *
   * @param out destination
   * @param b byte value in the range 0x80-0xFF
   */
  public abstract void writeHighByte(ByteArrayOutputStream out, int b);
}
