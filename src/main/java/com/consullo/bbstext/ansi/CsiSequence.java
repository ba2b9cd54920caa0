package com.consullo.bbstext.ansi;

import java.util.Arrays;
import org.apache.commons.lang3.Validate;

/**
 * A scanned CSI ({@code ESC [}) sequence.
 *
 * <p>
 * The scanner is a single forward pass: digits and {@code ;} build the
 * parameter list, the DEC private-mode prefixes {@code ? = > <} and the
 * intermediate bytes 0x20-0x2F are skipped, and a byte in 0x40-0x7E terminates
 * the sequence. Any other byte ends the scan early; the sequence is then
 * reported as malformed with {@link #end()} pointing at the offending byte so
 * that the caller can emit what was read and resume scanning there.
 * </p>
 *
 * <p>
 * Immutable: the parameter array is copied in and out, and equality compares
 * parameter values.
 * </p>
 *
 * @param params numeric parameters; an omitted parameter is stored as 0
 * @param finalByte terminating byte, or -1 when the sequence is malformed or incomplete
 * @param end exclusive end index of the bytes that belong to this sequence
 * @since 1.0
 */
public record CsiSequence(int[] params, int finalByte, int end) {

  private static final int MAX_PARAMS = 16;

  public CsiSequence {
    Validate.notNull(params, "params must not be null");
    params = params.clone();
  }

  @Override
  public int[] params() {
    return params.clone();
  }

  /**
   * Scans a CSI sequence.
   *
   * @param data input bytes
   * @param start index of the ESC byte; {@code data[start + 1]} must be {@code [}
   * @return scanned sequence
   */
  public static CsiSequence scan(byte[] data, int start) {
    int[] values = new int[MAX_PARAMS];
    int count = 0;
    int current = 0;
    boolean inParam = false;
    int j = start + 2;
    while (j < data.length) {
      int c = data[j] & 0xFF;
      if (c >= '0' && c <= '9') {
        if (current < 100_000) {
          current = current * 10 + (c - '0');
        }
        inParam = true;
      } else if (c == ';') {
        if (count < MAX_PARAMS) {
          values[count++] = current;
        }
        current = 0;
        inParam = true;
      } else if (c == '?' || c == '=' || c == '>' || c == '<' || (c >= 0x20 && c <= 0x2F)) {
        // Private-mode prefixes and intermediates carry no parameter value.
      } else if (c >= 0x40 && c <= 0x7E) {
        if (inParam && count < MAX_PARAMS) {
          values[count++] = current;
        }
        int[] params = new int[count];
        System.arraycopy(values, 0, params, 0, count);
        return new CsiSequence(params, c, j + 1);
      } else {
        return new CsiSequence(new int[0], -1, j);
      }
      j++;
    }
    return new CsiSequence(new int[0], -1, data.length);
  }

  /**
   * Returns true when the sequence has a terminating byte.
   *
   * @return true when well formed
   */
  public boolean isComplete() {
    return finalByte >= 0;
  }

  /**
   * Returns a parameter, substituting {@code defaultValue} when it is omitted or zero.
   *
   * @param index parameter index
   * @param defaultValue value used for a missing or zero parameter
   * @return parameter value
   */
  public int param(int index, int defaultValue) {
    if (index >= params.length || params[index] == 0) {
      return defaultValue;
    }
    return params[index];
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CsiSequence)) {
      return false;
    }
    CsiSequence other = (CsiSequence) o;
    return finalByte == other.finalByte && end == other.end && Arrays.equals(params, other.params);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * Arrays.hashCode(params) + finalByte) + end;
  }

  @Override
  public String toString() {
    return "CsiSequence[params=" + Arrays.toString(params) + ", finalByte=" + finalByte + ", end=" + end + "]";
  }
}
