package com.consullo.bbstext.template;

import com.consullo.bbstext.ansi.CursorTracker;
import com.consullo.bbstext.ansi.FieldPosition;
import com.consullo.bbstext.text.Placeholder;
import com.consullo.bbstext.text.StyledText;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Substitutes {@link Placeholder placeholders} in a template and answers
 * position and style queries about the unsubstituted template.
 *
 * <p>
 * A placeholder whose code has no value is left exactly as written, so
 * templates can carry codes that only newer callers supply.
 * </p>
 *
 * <p>
 * The position queries replay the cursor over the raw bytes. A placeholder
 * written with a hash run or an explicit width is exactly as wide as its
 * substituted value, so positions found in the raw template hold on the
 * rendered screen as well.
 * </p>
 *
 * @since 1.0
 */
public final class PlaceholderTemplate {

  private static final Logger LOGGER = LoggerFactory.getLogger(PlaceholderTemplate.class);

  private static final int ESC = 0x1B;

  private PlaceholderTemplate() {
  }

  /**
   * Replaces every placeholder with a known code by its value, fitted to the
   * placeholder's width and alignment.
   *
   * @param template template text
   * @param values field code to value
   * @return substituted text
   */
  public static String process(String template, Map<Character, String> values) {
    Validate.notNull(template, "template must not be null");
    Validate.notNull(values, "values must not be null");
    StringBuilder sb = new StringBuilder(template.length() + 32);
    int i = 0;
    int n = template.length();
    int substituted = 0;
    while (i < n) {
      char c = template.charAt(i);
      Placeholder placeholder = c == '@' ? Placeholder.parseAt(template, i) : null;
      if (placeholder == null) {
        sb.append(c);
        i++;
        continue;
      }
      String value = values.get(placeholder.code());
      if (value == null) {
        sb.append(template, placeholder.start(), placeholder.end());
      } else {
        sb.append(StyledText.applyWidthConstraintAligned(value, placeholder.width(), placeholder.alignment()));
        substituted++;
      }
      i = placeholder.end();
    }
    LOGGER.debug("process: substituted {} placeholders", substituted);
    return sb.toString();
  }

  /**
   * Finds the first placeholder for {@code code} in raw template bytes.
   *
   * <p>
   * A placeholder is recognized by {@code @} and the code followed by one of
   * {@code @ : # |}; the full grammar is not required, so a position can be
   * found even for a placeholder the substitution pass would reject.
   * </p>
   *
   * @param raw raw template bytes
   * @param code field code
   * @return position and restoring style of the placeholder, or empty when absent
   */
  public static Optional<FieldPosition> findPlaceholder(byte[] raw, char code) {
    Validate.notNull(raw, "raw must not be null");
    final CursorTracker tracker = new CursorTracker();
    int i = 0;
    while (i < raw.length) {
      int b = raw[i] & 0xFF;
      if (b == '@' && i + 2 < raw.length && raw[i + 1] == code && isPlaceholderContinuation(raw[i + 2])) {
        return Optional.of(tracker.position());
      }
      if (b == ESC) {
        i = tracker.consumeEscape(raw, i);
        continue;
      }
      tracker.advance(b);
      i++;
    }
    return Optional.empty();
  }

  /**
   * Returns the restoring style active at an exact screen position of the raw
   * template.
   *
   * @param raw raw template bytes
   * @param row 1-based row
   * @param col 1-based column
   * @return restoring escape sequence, or empty when the template passes the row
   *     without drawing at that column
   */
  public static Optional<String> styleAt(byte[] raw, int row, int col) {
    Validate.notNull(raw, "raw must not be null");
    final CursorTracker tracker = new CursorTracker();
    int i = 0;
    while (i < raw.length) {
      int b = raw[i] & 0xFF;
      if (b == ESC) {
        i = tracker.consumeEscape(raw, i);
        continue;
      }
      if (tracker.getRow() == row && tracker.getCol() == col) {
        return Optional.of(tracker.getStyle().restoreSequence());
      }
      if (tracker.getRow() > row) {
        return Optional.empty();
      }
      tracker.advance(b);
      i++;
    }
    return Optional.empty();
  }

  private static boolean isPlaceholderContinuation(byte b) {
    return b == '@' || b == ':' || b == '#' || b == '|';
  }
}
