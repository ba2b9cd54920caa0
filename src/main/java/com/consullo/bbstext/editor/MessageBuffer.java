package com.consullo.bbstext.editor;

import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-capacity, 1-indexed line storage for the message editor.
 *
 * <p>
 * Each line carries a hard-newline flag: true when the line ends because the
 * user pressed Enter, false when it ends because the text wrapped. At least
 * one line is always in use. Slots past the used count are logically absent.
 * </p>
 *
 * <p>
 * Mutators report failure (bad line or column, buffer full) by returning
 * false and leave the buffer untouched; they never throw for out-of-range
 * positions.
 * </p>
 */
public final class MessageBuffer {

  private static final Logger LOGGER = LoggerFactory.getLogger(MessageBuffer.class);

  private final EditorConfig config;
  // Index 0 is unused so line numbers index directly.
  private final String[] lines;
  private final boolean[] hardNewline;
  private int lineCount;

  public MessageBuffer() {
    this(EditorConfig.defaults());
  }

  public MessageBuffer(EditorConfig config) {
    Validate.notNull(config, "config must not be null");
    this.config = config;
    this.lines = new String[config.maxLines() + 1];
    this.hardNewline = new boolean[config.maxLines() + 1];
    clear();
  }

  public EditorConfig getConfig() {
    return config;
  }

  /**
   * Empties the buffer to a single blank line.
   */
  public void clear() {
    for (int i = 0; i < lines.length; i++) {
      lines[i] = "";
      hardNewline[i] = false;
    }
    lineCount = 1;
  }

  /**
   * Replaces the buffer content with {@code content} split on line feeds.
   * Every loaded line is a hard line. Lines beyond capacity are dropped.
   *
   * @param content message text
   */
  public void loadContent(String content) {
    Validate.notNull(content, "content must not be null");
    clear();
    if (content.isEmpty()) {
      return;
    }
    String[] parts = StringUtils.splitPreserveAllTokens(content, '\n');
    int count = Math.min(parts.length, config.maxLines());
    if (parts.length > count) {
      LOGGER.warn("loadContent: dropping {} lines beyond capacity {}", parts.length - count, config.maxLines());
    }
    for (int i = 0; i < count; i++) {
      lines[i + 1] = StringUtils.removeEnd(parts[i], "\r");
      hardNewline[i + 1] = true;
    }
    lineCount = Math.max(1, count);
  }

  /**
   * Returns the content lines joined with line feeds; trailing blank lines are omitted.
   *
   * @return message text
   */
  public String getContent() {
    int count = getContentLineCount();
    StringBuilder sb = new StringBuilder(count * 40);
    for (int i = 1; i <= count; i++) {
      if (i > 1) {
        sb.append('\n');
      }
      sb.append(lines[i]);
    }
    return sb.toString();
  }

  public String getLine(int line) {
    if (!inCapacity(line)) {
      return "";
    }
    return lines[line];
  }

  /**
   * Sets a line's text. Setting a line past the used count extends the count.
   *
   * @param line 1-based line number
   * @param text new text
   * @return false when the line is outside the capacity
   */
  public boolean setLine(int line, String text) {
    Validate.notNull(text, "text must not be null");
    if (!inCapacity(line)) {
      return false;
    }
    lines[line] = text;
    if (line > lineCount) {
      lineCount = line;
    }
    return true;
  }

  public int getLineLength(int line) {
    return getLine(line).length();
  }

  /**
   * True when a line holds nothing but whitespace.
   *
   * @param line 1-based line number
   * @return true for blank or out-of-range lines
   */
  public boolean isLineEmpty(int line) {
    return StringUtils.isBlank(getLine(line));
  }

  /**
   * Character at a position, or a space when there is none.
   *
   * @param line 1-based line number
   * @param col 1-based column
   * @return character at the position
   */
  public char getCharAt(int line, int col) {
    String text = getLine(line);
    if (col < 1 || col > text.length()) {
      return ' ';
    }
    return text.charAt(col - 1);
  }

  public char getLastChar(int line) {
    String text = getLine(line);
    return text.isEmpty() ? ' ' : text.charAt(text.length() - 1);
  }

  public boolean isHardNewline(int line) {
    return inCapacity(line) && hardNewline[line];
  }

  public boolean setHardNewline(int line, boolean hard) {
    if (!inCapacity(line)) {
      return false;
    }
    hardNewline[line] = hard;
    return true;
  }

  /**
   * Number of lines the cursor may visit, trailing blank lines included.
   *
   * @return used line count, at least 1
   */
  public int getLineCount() {
    return lineCount;
  }

  /**
   * Number of lines worth storing: the used count without trailing blank lines.
   *
   * @return content line count, at least 1
   */
  public int getContentLineCount() {
    int count = lineCount;
    while (count > 1 && StringUtils.isBlank(lines[count])) {
      count--;
    }
    return count;
  }

  public boolean isFull() {
    return lineCount >= config.maxLines();
  }

  /**
   * Inserts a character, padding with spaces when the column is past the end.
   *
   * @param line 1-based line number
   * @param col 1-based column; values below 1 insert at the start
   * @param ch character
   * @return false when the line is outside the capacity
   */
  public boolean insertChar(int line, int col, char ch) {
    if (!inCapacity(line)) {
      return false;
    }
    String text = padTo(getLine(line), col);
    int at = Math.max(0, col - 1);
    setLine(line, text.substring(0, at) + ch + text.substring(at));
    return true;
  }

  /**
   * Deletes the character at a column.
   *
   * @param line 1-based line number
   * @param col 1-based column
   * @return false when there is no character at that position
   */
  public boolean deleteChar(int line, int col) {
    if (!inCapacity(line)) {
      return false;
    }
    String text = lines[line];
    if (col < 1 || col > text.length()) {
      return false;
    }
    lines[line] = text.substring(0, col - 1) + text.substring(col);
    return true;
  }

  /**
   * Replaces the character at a column, appending (after space padding) when
   * the column is past the end.
   *
   * @param line 1-based line number
   * @param col 1-based column
   * @param ch character
   * @return false when the position is invalid
   */
  public boolean overwriteChar(int line, int col, char ch) {
    if (!inCapacity(line) || col < 1) {
      return false;
    }
    String text = padTo(getLine(line), col);
    if (col <= text.length()) {
      text = text.substring(0, col - 1) + ch + text.substring(col);
    } else {
      text = text + ch;
    }
    setLine(line, text);
    return true;
  }

  /**
   * Inserts an empty soft line, shifting that line and all below it down.
   *
   * @param at 1-based position of the new line, up to one past the used count
   * @return false when the buffer is full or the position is invalid
   */
  public boolean insertLine(int at) {
    if (isFull() || at < 1 || at > lineCount + 1) {
      return false;
    }
    for (int i = lineCount; i >= at; i--) {
      lines[i + 1] = lines[i];
      hardNewline[i + 1] = hardNewline[i];
    }
    lines[at] = "";
    hardNewline[at] = false;
    lineCount++;
    return true;
  }

  /**
   * Deletes a line, shifting the lines below it up. Deleting the only line
   * clears it instead.
   *
   * @param at 1-based line number
   * @return false when the line is not in use
   */
  public boolean deleteLine(int at) {
    if (at < 1 || at > lineCount) {
      return false;
    }
    if (lineCount == 1) {
      lines[1] = "";
      hardNewline[1] = false;
      return true;
    }
    for (int i = at; i < lineCount; i++) {
      lines[i] = lines[i + 1];
      hardNewline[i] = hardNewline[i + 1];
    }
    lines[lineCount] = "";
    hardNewline[lineCount] = false;
    lineCount--;
    return true;
  }

  /**
   * Splits a line at a column. The text from the column on moves to a new line
   * below, which takes over the original hard-newline flag; the original line
   * becomes soft. Callers splitting for an explicit break mark it hard.
   *
   * @param line 1-based line number
   * @param col 1-based column of the first character to move
   * @return false when the line is not in use or the buffer is full
   */
  public boolean splitLine(int line, int col) {
    if (line < 1 || line > lineCount) {
      return false;
    }
    String text = lines[line];
    int at = Math.min(Math.max(col, 1), text.length() + 1) - 1;
    boolean hard = hardNewline[line];
    if (!insertLine(line + 1)) {
      return false;
    }
    lines[line] = text.substring(0, at);
    hardNewline[line] = false;
    lines[line + 1] = text.substring(at);
    hardNewline[line + 1] = hard;
    return true;
  }

  /**
   * Appends the next line to this one and removes the next line. The joined line
   * takes the next line's hard-newline flag.
   *
   * @param line 1-based line number
   * @return false when there is no next line
   */
  public boolean joinLines(int line) {
    if (line < 1 || line >= lineCount) {
      return false;
    }
    lines[line] = lines[line] + lines[line + 1];
    hardNewline[line] = hardNewline[line + 1];
    return deleteLine(line + 1);
  }

  /**
   * Removes trailing spaces from a line.
   *
   * @param line 1-based line number
   * @return false when the line is outside the capacity
   */
  public boolean removeTrailingSpaces(int line) {
    if (!inCapacity(line)) {
      return false;
    }
    lines[line] = StringUtils.stripEnd(lines[line], " ");
    return true;
  }

  /**
   * Copies the used lines, for comparing buffer states.
   *
   * @return lines 1 through the used count
   */
  public List<String> snapshot() {
    List<String> out = new ArrayList<>(lineCount);
    for (int i = 1; i <= lineCount; i++) {
      out.add(lines[i]);
    }
    return out;
  }

  private boolean inCapacity(int line) {
    return line >= 1 && line <= config.maxLines();
  }

  private static String padTo(String text, int col) {
    if (col - 1 > text.length()) {
      return StringUtils.rightPad(text, col - 1);
    }
    return text;
  }
}
