package com.consullo.bbstext.editor.events;

import com.consullo.bbstext.editor.EditorSession;

/**
 * Listener interface for editor damage events.
 *
 * @since 1.0
 */
public interface DamageListener {

  /**
   * Called after an edit changed buffer content.
   *
   * @param session session whose buffer changed
   * @param damage lines to repaint
   */
  void onDamage(EditorSession session, LineDamage damage);
}
