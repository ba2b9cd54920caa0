package com.consullo.bbstext.editor;

/**
 * 1-based cursor position in a message buffer.
 *
 * @param line line number
 * @param col column number; one past the line's end is a valid position
 * @since 1.0
 */
public record CursorPosition(int line, int col) {
}
