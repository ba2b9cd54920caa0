package com.consullo.bbstext.editor.events;

/**
 * Range of buffer lines whose display must be refreshed after an edit.
 *
 * <p>
 * When the edit changed the number of lines, the range runs to the end of the
 * old or new content, whichever is longer, so lines that moved or vanished are
 * repainted too.
 * </p>
 *
 * @param firstLine first changed line (inclusive, 1-based)
 * @param endLine last changed line (exclusive)
 * @param fullRedraw true when the whole editing area must be repainted, e.g. after loading content
 * @since 1.0
 */
public record LineDamage(int firstLine, int endLine, boolean fullRedraw) {

  /**
   * Creates a full-redraw damage event.
   *
   * @return full redraw event
   */
  public static LineDamage createFullRedraw() {
    return new LineDamage(1, Integer.MAX_VALUE, true);
  }

  /**
   * Creates a partial damage event for the specified line range.
   *
   * @param firstLine first changed line (inclusive)
   * @param endLine last changed line (exclusive)
   * @return partial damage event
   */
  public static LineDamage lines(int firstLine, int endLine) {
    if (firstLine < 1 || endLine <= firstLine) {
      throw new IllegalArgumentException("line range must be non-empty and 1-based.");
    }
    return new LineDamage(firstLine, endLine, false);
  }

  public boolean contains(int line) {
    return line >= firstLine && line < endLine;
  }
}
