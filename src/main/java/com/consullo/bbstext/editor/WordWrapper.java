package com.consullo.bbstext.editor;

import com.consullo.bbstext.text.StyledText;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paragraph-aware word wrapping over a {@link MessageBuffer}.
 *
 * <p>
 * A paragraph is the run of lines from a start line up to and including the
 * first hard line (or the last used line). Reflowing a paragraph joins its
 * lines into one stream, one space between non-empty lines, and cuts the
 * stream again at the last space that keeps each line within the configured
 * width. A word longer than the width is cut at exactly the width.
 * </p>
 *
 * <p>
 * The cursor survives reshaping as a character offset into the stream: it is
 * converted to an offset before the cut and back to a line and column after.
 * </p>
 *
 * <p>
 * When to reflow:
 * <ul>
 * <li>after inserting a character, only when the line became too long;</li>
 * <li>after deleting a character, when the line is too long or is tied to a
 * neighbor by a soft break, so words can move back up;</li>
 * <li>always after joining or splitting lines and on an explicit reformat.</li>
 * </ul>
 * </p>
 */
public final class WordWrapper {

  private static final Logger LOGGER = LoggerFactory.getLogger(WordWrapper.class);

  private final MessageBuffer buffer;
  private final int width;

  public WordWrapper(MessageBuffer buffer) {
    Validate.notNull(buffer, "buffer must not be null");
    this.buffer = buffer;
    this.width = buffer.getConfig().maxLineLength();
  }

  /**
   * Reflows the paragraph starting at {@code startLine}.
   *
   * @param startLine first line of the range
   * @param cursorLine cursor line before the reflow
   * @param cursorCol cursor column before the reflow
   * @return cursor position after the reflow
   */
  public CursorPosition reflowRange(int startLine, int cursorLine, int cursorCol) {
    return reflow(startLine, cursorLine, cursorCol).cursor();
  }

  /**
   * Reflows the whole paragraph containing {@code line}, including soft lines above it.
   *
   * @param line any line of the paragraph
   * @return last line of the reflowed paragraph
   */
  public int reformatParagraph(int line) {
    if (line < 1 || line > buffer.getLineCount()) {
      return line;
    }
    return reflow(paragraphStart(line), line, 1).lastLine();
  }

  /**
   * Finds the first line of the paragraph containing {@code line} by walking up
   * over soft predecessors.
   *
   * @param line any line of the paragraph
   * @return first line of the paragraph
   */
  public int paragraphStart(int line) {
    int start = Math.min(Math.max(line, 1), buffer.getLineCount());
    while (start > 1 && !buffer.isHardNewline(start - 1)) {
      start--;
    }
    return start;
  }

  /**
   * Wraps after a character was inserted at {@code col - 1}, when the line is now too long.
   *
   * @param line line the character went into
   * @param col cursor column after the insert
   * @return cursor position after wrapping
   */
  public CursorPosition wrapAfterInsert(int line, int col) {
    if (StyledText.visibleLength(buffer.getLine(line)) <= width) {
      return new CursorPosition(line, col);
    }
    return reflowRange(line, line, col);
  }

  /**
   * Deletes the character before the cursor. At the start of a line the line is
   * joined onto the previous one.
   *
   * @param line cursor line
   * @param col cursor column
   * @return new cursor and whether the buffer changed
   */
  public EditResult handleBackspace(int line, int col) {
    if (col > 1) {
      if (!buffer.deleteChar(line, col - 1)) {
        return EditResult.unchanged(new CursorPosition(line, col - 1));
      }
      return EditResult.changed(reflowAfterDelete(line, col - 1));
    }
    if (line > 1) {
      int joinCol = buffer.getLineLength(line - 1) + 1;
      buffer.joinLines(line - 1);
      return EditResult.changed(reflowRange(line - 1, line - 1, joinCol));
    }
    return EditResult.unchanged(new CursorPosition(line, col));
  }

  /**
   * Deletes the character under the cursor. At the end of a line the next line
   * is joined onto this one.
   *
   * @param line cursor line
   * @param col cursor column
   * @return new cursor and whether the buffer changed
   */
  public EditResult handleDelete(int line, int col) {
    if (buffer.deleteChar(line, col)) {
      return EditResult.changed(reflowAfterDelete(line, col));
    }
    if (line < buffer.getLineCount() && col > buffer.getLineLength(line)) {
      buffer.setLine(line, StringUtils.rightPad(buffer.getLine(line), col - 1));
      buffer.joinLines(line);
      return EditResult.changed(reflowRange(line, line, col));
    }
    return EditResult.unchanged(new CursorPosition(line, col));
  }

  /**
   * Deletes from the cursor through the end of the next word: any spaces under
   * and after the cursor, then the word characters that follow. At the end of
   * a line this joins the next line.
   *
   * @param line cursor line
   * @param col cursor column
   * @return new cursor and whether the buffer changed
   */
  public EditResult deleteWord(int line, int col) {
    String text = buffer.getLine(line);
    int pos = col - 1;
    if (pos < 0 || pos >= text.length()) {
      return handleDelete(line, Math.max(col, 1));
    }
    int end = pos;
    while (end < text.length() && text.charAt(end) == ' ') {
      end++;
    }
    while (end < text.length() && text.charAt(end) != ' ') {
      end++;
    }
    buffer.setLine(line, text.substring(0, pos) + text.substring(end));
    return EditResult.changed(reflowAfterDelete(line, col));
  }

  /**
   * Column of the start of the word left of the cursor.
   *
   * @param line cursor line
   * @param col cursor column
   * @return 1-based column
   */
  public int findWordLeft(int line, int col) {
    String text = buffer.getLine(line);
    int pos = Math.min(col - 1, text.length());
    if (pos <= 0) {
      return 1;
    }
    pos--;
    while (pos > 0 && text.charAt(pos) == ' ') {
      pos--;
    }
    while (pos > 0 && text.charAt(pos - 1) != ' ') {
      pos--;
    }
    return pos + 1;
  }

  /**
   * Column of the start of the word right of the cursor, or one past the end of
   * the line when there is none.
   *
   * @param line cursor line
   * @param col cursor column
   * @return 1-based column
   */
  public int findWordRight(int line, int col) {
    String text = buffer.getLine(line);
    int pos = Math.max(col - 1, 0);
    if (pos >= text.length()) {
      return text.length() + 1;
    }
    while (pos < text.length() && text.charAt(pos) != ' ') {
      pos++;
    }
    while (pos < text.length() && text.charAt(pos) == ' ') {
      pos++;
    }
    return pos + 1;
  }

  /**
   * True when the cursor is at a line edge or between a space and a non-space.
   * Positions inside a run of spaces are not boundaries.
   *
   * @param line cursor line
   * @param col cursor column
   * @return true at a word boundary
   */
  public boolean isAtWordBoundary(int line, int col) {
    String text = buffer.getLine(line);
    if (col <= 1 || col > text.length()) {
      return true;
    }
    boolean spaceBefore = text.charAt(col - 2) == ' ';
    boolean spaceAt = text.charAt(col - 1) == ' ';
    return spaceBefore != spaceAt;
  }

  private CursorPosition reflowAfterDelete(int line, int col) {
    boolean tooLong = StyledText.visibleLength(buffer.getLine(line)) > width;
    boolean softWithFollower = !buffer.isHardNewline(line) && line < buffer.getLineCount();
    boolean softAbove = line > 1 && !buffer.isHardNewline(line - 1);
    if (!tooLong && !softWithFollower && !softAbove) {
      return new CursorPosition(line, col);
    }
    // A shortened first word may now fit on the soft line above.
    int start = softAbove ? line - 1 : line;
    return reflowRange(start, line, col);
  }

  private Reflow reflow(int startLine, int cursorLine, int cursorCol) {
    final int count = buffer.getLineCount();
    if (startLine < 1 || startLine > count) {
      return new Reflow(new CursorPosition(cursorLine, cursorCol), startLine);
    }
    int endLine = startLine;
    while (endLine < count && !buffer.isHardNewline(endLine)) {
      endLine++;
    }
    final boolean terminatingHard = buffer.isHardNewline(endLine);
    final int oldLineCount = endLine - startLine + 1;

    StringBuilder stream = new StringBuilder(oldLineCount * (width + 1));
    int cursorOffset = -1;
    for (int ln = startLine; ln <= endLine; ln++) {
      String text = buffer.getLine(ln);
      if (!text.isEmpty() && stream.length() > 0) {
        stream.append(' ');
      }
      if (ln == cursorLine) {
        cursorOffset = stream.length() + Math.min(Math.max(cursorCol - 1, 0), text.length());
      }
      stream.append(text);
    }

    List<String> pieces = new ArrayList<>();
    List<Integer> starts = new ArrayList<>();
    segment(stream.toString(), pieces, starts);

    int placed = writeBack(startLine, oldLineCount, pieces);
    int lastLine = startLine + placed - 1;
    buffer.setHardNewline(lastLine, terminatingHard);
    LOGGER.debug("reflow: lines {}-{} -> {} lines", startLine, endLine, placed);

    CursorPosition cursor;
    if (cursorOffset >= 0) {
      cursor = mapOffset(Math.min(cursorOffset, stream.length()), startLine, placed, pieces, starts);
    } else if (cursorLine > endLine) {
      cursor = new CursorPosition(cursorLine + placed - oldLineCount, cursorCol);
    } else {
      cursor = new CursorPosition(cursorLine, cursorCol);
    }
    return new Reflow(cursor, lastLine);
  }

  private void segment(String stream, List<String> pieces, List<Integer> starts) {
    String rest = stream;
    int offset = 0;
    while (true) {
      if (StyledText.visibleLength(rest) <= width) {
        pieces.add(rest);
        starts.add(offset);
        return;
      }
      int limit = StyledText.indexAfterVisible(rest, width);
      int space = rest.lastIndexOf(' ', limit);
      String piece = space > 0 ? StringUtils.stripEnd(rest.substring(0, space), " ") : "";
      if (!piece.isEmpty()) {
        int next = space;
        while (next < rest.length() && rest.charAt(next) == ' ') {
          next++;
        }
        pieces.add(piece);
        starts.add(offset);
        offset += next;
        rest = rest.substring(next);
      } else {
        pieces.add(rest.substring(0, limit));
        starts.add(offset);
        offset += limit;
        rest = rest.substring(limit);
      }
    }
  }

  private int writeBack(int startLine, int oldLineCount, List<String> pieces) {
    int placed = 0;
    for (int k = 0; k < pieces.size(); k++) {
      int ln = startLine + k;
      if (k >= oldLineCount && !buffer.insertLine(ln)) {
        String overflow = String.join(" ", pieces.subList(k, pieces.size()));
        int last = ln - 1;
        buffer.setLine(last, buffer.getLine(last) + " " + overflow);
        LOGGER.warn("reflow: buffer full, appended {} characters to line {}", overflow.length(), last);
        break;
      }
      buffer.setLine(ln, pieces.get(k));
      buffer.setHardNewline(ln, false);
      placed++;
    }
    for (int k = placed; k < oldLineCount; k++) {
      buffer.deleteLine(startLine + placed);
    }
    return placed;
  }

  private CursorPosition mapOffset(int offset, int startLine, int placed, List<String> pieces,
      List<Integer> starts) {
    int segment = pieces.size() - 1;
    for (int k = 0; k < pieces.size() - 1; k++) {
      if (offset < starts.get(k + 1)) {
        segment = k;
        break;
      }
    }
    int inner = offset - starts.get(segment);
    int lineIndex = Math.min(segment, placed - 1);
    int col;
    if (segment == lineIndex) {
      col = inner + 1;
    } else {
      // Pieces that did not fit were joined onto the last line with single spaces.
      col = pieces.get(lineIndex).length() + 1;
      for (int k = lineIndex + 1; k < segment; k++) {
        col += pieces.get(k).length() + 1;
      }
      col += Math.min(inner, pieces.get(segment).length()) + 1;
    }
    int line = startLine + lineIndex;
    col = Math.max(1, Math.min(col, buffer.getLineLength(line) + 1));
    return new CursorPosition(line, col);
  }

  private record Reflow(CursorPosition cursor, int lastLine) {
  }
}
