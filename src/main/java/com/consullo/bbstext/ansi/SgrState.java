package com.consullo.bbstext.ansi;

/**
 * Text attributes selected by SGR ({@code ESC [ ... m}) sequences.
 *
 * <p>
 * Colors are kept as the SGR parameter that selected them (30-37, 90-97 for
 * the foreground and 40-47, 100-107 for the background); -1 means the
 * terminal default.
 * </p>
 */
public final class SgrState {

  private boolean bold;
  private boolean faint;
  private boolean italic;
  private boolean underline;
  private boolean blink;
  private boolean reverse;
  private boolean hidden;
  private int foreground = -1;
  private int background = -1;

  public void reset() {
    bold = false;
    faint = false;
    italic = false;
    underline = false;
    blink = false;
    reverse = false;
    hidden = false;
    foreground = -1;
    background = -1;
  }

  /**
   * Folds the parameters of an SGR sequence into this state. An empty parameter
   * list is a reset.
   *
   * @param params SGR parameters
   */
  public void apply(int[] params) {
    if (params.length == 0) {
      reset();
      return;
    }
    for (int p : params) {
      applyOne(p);
    }
  }

  private void applyOne(int p) {
    switch (p) {
      case 0:
        reset();
        return;
      case 1:
        bold = true;
        return;
      case 2:
        faint = true;
        return;
      case 3:
        italic = true;
        return;
      case 4:
        underline = true;
        return;
      case 5:
        blink = true;
        return;
      case 7:
        reverse = true;
        return;
      case 8:
        hidden = true;
        return;
      case 22:
        bold = false;
        faint = false;
        return;
      case 23:
        italic = false;
        return;
      case 24:
        underline = false;
        return;
      case 25:
        blink = false;
        return;
      case 27:
        reverse = false;
        return;
      case 28:
        hidden = false;
        return;
      case 39:
        foreground = -1;
        return;
      case 49:
        background = -1;
        return;
      default:
        break;
    }
    if ((p >= 30 && p <= 37) || (p >= 90 && p <= 97)) {
      foreground = p;
    } else if ((p >= 40 && p <= 47) || (p >= 100 && p <= 107)) {
      background = p;
    }
  }

  /**
   * Builds the escape sequence that restores this state from any other state.
   * It always starts with a reset, e.g. {@code ESC[0;1;36;44m}; the default
   * state is {@code ESC[0m}.
   *
   * @return restoring escape sequence
   */
  public String restoreSequence() {
    StringBuilder sb = new StringBuilder(16);
    sb.append("\u001b[0");
    appendIf(sb, bold, 1);
    appendIf(sb, faint, 2);
    appendIf(sb, italic, 3);
    appendIf(sb, underline, 4);
    appendIf(sb, blink, 5);
    appendIf(sb, reverse, 7);
    appendIf(sb, hidden, 8);
    if (foreground >= 0) {
      sb.append(';').append(foreground);
    }
    if (background >= 0) {
      sb.append(';').append(background);
    }
    sb.append('m');
    return sb.toString();
  }

  private static void appendIf(StringBuilder sb, boolean flag, int code) {
    if (flag) {
      sb.append(';').append(code);
    }
  }

  public boolean isBold() {
    return bold;
  }

  public boolean isFaint() {
    return faint;
  }

  public boolean isBlink() {
    return blink;
  }

  public boolean isReverse() {
    return reverse;
  }

  public boolean isHidden() {
    return hidden;
  }

  public int getForeground() {
    return foreground;
  }

  public int getBackground() {
    return background;
  }
}
