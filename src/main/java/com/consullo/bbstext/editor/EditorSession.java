package com.consullo.bbstext.editor;

import com.consullo.bbstext.editor.events.DamageListener;
import com.consullo.bbstext.editor.events.LineDamage;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One user's editing state: the message buffer, the word wrapper working on
 * it, the cursor and the insert/overwrite mode.
 *
 * <p>
 * Every operation that changes text compares the buffer before and after and
 * notifies the registered {@link DamageListener}s with the changed line range,
 * so the screen can be repainted partially. Operations that only move the
 * cursor notify nobody.
 * </p>
 *
 * <p>
 * Not thread-safe. A session is owned by one terminal connection.
 * </p>
 */
public final class EditorSession {

  private static final Logger LOGGER = LoggerFactory.getLogger(EditorSession.class);

  private final MessageBuffer buffer;
  private final WordWrapper wrapper;
  private final List<DamageListener> listeners = new ArrayList<>();

  private int line = 1;
  private int col = 1;
  private boolean insertMode = true;
  private boolean modified;

  public EditorSession() {
    this(EditorConfig.defaults());
  }

  public EditorSession(EditorConfig config) {
    Validate.notNull(config, "config must not be null");
    this.buffer = new MessageBuffer(config);
    this.wrapper = new WordWrapper(buffer);
  }

  public void addDamageListener(DamageListener listener) {
    Validate.notNull(listener, "listener must not be null");
    listeners.add(listener);
  }

  public void removeDamageListener(DamageListener listener) {
    listeners.remove(listener);
  }

  /**
   * Replaces the buffer content and puts the cursor at the top.
   *
   * @param content message text
   */
  public void load(String content) {
    buffer.loadContent(content);
    line = 1;
    col = 1;
    modified = false;
    fire(LineDamage.createFullRedraw());
  }

  /**
   * Message text with trailing blank lines removed.
   *
   * @return message text
   */
  public String export() {
    return buffer.getContent();
  }

  /**
   * Types a character at the cursor, inserting or overwriting according to the mode.
   *
   * @param ch printable character
   */
  public void insertCharacter(char ch) {
    Validate.isTrue(ch >= 0x20 && ch != 0x7F, "ch must be printable");
    List<String> before = buffer.snapshot();
    boolean written = insertMode ? buffer.insertChar(line, col, ch) : buffer.overwriteChar(line, col, ch);
    if (!written) {
      return;
    }
    applyCursor(wrapper.wrapAfterInsert(line, col + 1));
    commit(before);
  }

  /**
   * Breaks the line at the cursor with a hard newline.
   *
   * @return false when the buffer is full
   */
  public boolean newLine() {
    List<String> before = buffer.snapshot();
    if (!buffer.splitLine(line, col)) {
      LOGGER.debug("newLine: buffer full at line {}", line);
      return false;
    }
    buffer.setHardNewline(line, true);
    applyCursor(wrapper.reflowRange(line + 1, line + 1, 1));
    commit(before);
    return true;
  }

  public void backspace() {
    List<String> before = buffer.snapshot();
    EditResult result = wrapper.handleBackspace(line, col);
    applyCursor(result.cursor());
    if (result.changed()) {
      commit(before);
    }
  }

  public void delete() {
    List<String> before = buffer.snapshot();
    EditResult result = wrapper.handleDelete(line, col);
    applyCursor(result.cursor());
    if (result.changed()) {
      commit(before);
    }
  }

  public void deleteWord() {
    List<String> before = buffer.snapshot();
    EditResult result = wrapper.deleteWord(line, col);
    applyCursor(result.cursor());
    if (result.changed()) {
      commit(before);
    }
  }

  /**
   * Removes the cursor line.
   */
  public void deleteLine() {
    List<String> before = buffer.snapshot();
    buffer.deleteLine(line);
    line = Math.min(line, buffer.getLineCount());
    col = 1;
    commit(before);
  }

  /**
   * Joins the next line onto the cursor line and reflows the result.
   *
   * @return false when there is no next line
   */
  public boolean joinLines() {
    List<String> before = buffer.snapshot();
    if (!buffer.joinLines(line)) {
      return false;
    }
    applyCursor(wrapper.reflowRange(line, line, col));
    commit(before);
    return true;
  }

  /**
   * Re-wraps the paragraph around the cursor, keeping the cursor on the same character.
   */
  public void reformat() {
    List<String> before = buffer.snapshot();
    applyCursor(wrapper.reflowRange(wrapper.paragraphStart(line), line, col));
    commit(before);
  }

  public void moveLeft() {
    if (col > 1) {
      col--;
    } else if (line > 1) {
      line--;
      col = buffer.getLineLength(line) + 1;
    }
  }

  public void moveRight() {
    if (col <= buffer.getLineLength(line)) {
      col++;
    } else if (line < buffer.getLineCount()) {
      line++;
      col = 1;
    }
  }

  public void moveUp() {
    if (line > 1) {
      line--;
      clampColumn();
    }
  }

  public void moveDown() {
    if (line < buffer.getLineCount()) {
      line++;
      clampColumn();
    }
  }

  public void home() {
    col = 1;
  }

  public void end() {
    col = buffer.getLineLength(line) + 1;
  }

  public void wordLeft() {
    col = wrapper.findWordLeft(line, col);
  }

  public void wordRight() {
    col = wrapper.findWordRight(line, col);
  }

  /**
   * Moves the cursor, clamped to the used lines and one past the line's end.
   *
   * @param targetLine 1-based line
   * @param targetCol 1-based column
   */
  public void moveTo(int targetLine, int targetCol) {
    line = Math.max(1, Math.min(targetLine, buffer.getLineCount()));
    col = Math.max(1, targetCol);
    clampColumn();
  }

  public boolean toggleInsertMode() {
    insertMode = !insertMode;
    return insertMode;
  }

  public CursorPosition getCursor() {
    return new CursorPosition(line, col);
  }

  public boolean isInsertMode() {
    return insertMode;
  }

  public boolean isModified() {
    return modified;
  }

  public MessageBuffer getBuffer() {
    return buffer;
  }

  private void applyCursor(CursorPosition cursor) {
    line = Math.max(1, Math.min(cursor.line(), buffer.getLineCount()));
    col = Math.max(1, cursor.col());
  }

  private void clampColumn() {
    col = Math.min(col, buffer.getLineLength(line) + 1);
  }

  private void commit(List<String> before) {
    List<String> after = buffer.snapshot();
    int common = Math.min(before.size(), after.size());
    int first = 0;
    while (first < common && before.get(first).equals(after.get(first))) {
      first++;
    }
    if (first == common && before.size() == after.size()) {
      return;
    }
    modified = true;
    int end;
    if (before.size() != after.size()) {
      end = Math.max(before.size(), after.size());
    } else {
      end = common - 1;
      while (end > first && before.get(end).equals(after.get(end))) {
        end--;
      }
      end++;
    }
    fire(LineDamage.lines(first + 1, end + 1));
  }

  private void fire(LineDamage damage) {
    LOGGER.trace("damage: lines {}-{} full={}", damage.firstLine(), damage.endLine(), damage.fullRedraw());
    for (DamageListener listener : listeners) {
      listener.onDamage(this, damage);
    }
  }
}
