package com.consullo.bbstext.editor;

import org.apache.commons.lang3.Validate;

/**
 * Editor configuration values.
 *
 * @param maxLines line capacity of a message buffer
 * @param maxLineLength visible characters per line before text wraps
 * @since 1.0
 */
public record EditorConfig(int maxLines, int maxLineLength) {

  public static final int DEFAULT_MAX_LINES = 100;
  public static final int DEFAULT_MAX_LINE_LENGTH = 79;

  public EditorConfig {
    Validate.isTrue(maxLines > 0, "maxLines must be positive");
    Validate.isTrue(maxLineLength > 0, "maxLineLength must be positive");
  }

  /**
   * 100 lines of 79 characters, which leaves the last column of an 80-column
   * terminal free so the cursor never wraps on its own.
   *
   * @return default configuration
   */
  public static EditorConfig defaults() {
    return new EditorConfig(DEFAULT_MAX_LINES, DEFAULT_MAX_LINE_LENGTH);
  }
}
