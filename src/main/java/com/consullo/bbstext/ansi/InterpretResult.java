package com.consullo.bbstext.ansi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Output of one interpreter pass: the bytes to send to the terminal and the
 * named field table harvested from field markers.
 *
 * <p>
 * Immutable. The field table keeps the order in which fields first appeared.
 * </p>
 */
public final class InterpretResult {

  private final byte[] displayBytes;
  private final Map<String, FieldPosition> fields;
  private final int finalRow;
  private final int finalCol;

  private InterpretResult(Builder b) {
    this.displayBytes = b.displayBytes;
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(b.fields));
    this.finalRow = b.finalRow;
    this.finalCol = b.finalCol;
  }

  public byte[] getDisplayBytes() {
    return displayBytes.clone();
  }

  public Map<String, FieldPosition> getFields() {
    return fields;
  }

  public Optional<FieldPosition> getField(String code) {
    return Optional.ofNullable(fields.get(code));
  }

  /**
   * Row of the cursor after the last byte was drawn.
   *
   * @return 1-based row
   */
  public int getFinalRow() {
    return finalRow;
  }

  /**
   * Column of the cursor after the last byte was drawn.
   *
   * @return 1-based column
   */
  public int getFinalCol() {
    return finalCol;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private byte[] displayBytes;
    private final Map<String, FieldPosition> fields = new LinkedHashMap<>();
    private int finalRow = 1;
    private int finalCol = 1;

    private Builder() {
    }

    public Builder displayBytes(byte[] displayBytes) {
      this.displayBytes = displayBytes;
      return this;
    }

    /**
     * Records a field. A repeated code moves to the later marker's position but
     * keeps its place in the table order.
     *
     * @param code field code
     * @param position field position
     * @return this builder
     */
    public Builder field(String code, FieldPosition position) {
      this.fields.put(code, position);
      return this;
    }

    public Builder finalPosition(int row, int col) {
      this.finalRow = row;
      this.finalCol = col;
      return this;
    }

    public InterpretResult build() {
      if (displayBytes == null) {
        throw new IllegalArgumentException("displayBytes must not be null.");
      }
      return new InterpretResult(this);
    }
  }
}
