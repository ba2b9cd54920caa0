package com.consullo.bbstext.editor;

/**
 * Outcome of an editing operation.
 *
 * @param cursor cursor position after the operation
 * @param changed true when buffer content changed
 * @since 1.0
 */
public record EditResult(CursorPosition cursor, boolean changed) {

  public static EditResult changed(CursorPosition cursor) {
    return new EditResult(cursor, true);
  }

  public static EditResult unchanged(CursorPosition cursor) {
    return new EditResult(cursor, false);
  }
}
