package com.consullo.bbstext.ansi;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for CSI scanning, attribute folding and cursor tracking.
 */
public class CursorTrackerTest {

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.US_ASCII);
  }

  @Test
  @DisplayName("Should scan parameters and default omitted or zero values")
  void scan_Parameters_DefaultsApplied() {
    final CsiSequence seq = CsiSequence.scan(bytes("\u001b[;0;7Hx"), 0);

    assertThat(seq.isComplete()).isTrue();
    assertThat(seq.finalByte()).isEqualTo('H');
    assertThat(seq.end()).isEqualTo(7);
    assertThat(seq.param(0, 1)).isEqualTo(1);
    assertThat(seq.param(1, 1)).isEqualTo(1);
    assertThat(seq.param(2, 1)).isEqualTo(7);
    assertThat(seq.param(3, 4)).isEqualTo(4);
  }

  @Test
  @DisplayName("Should skip private-mode prefixes")
  void scan_PrivateMode_PrefixSkipped() {
    final CsiSequence seq = CsiSequence.scan(bytes("\u001b[?25l"), 0);

    assertThat(seq.finalByte()).isEqualTo('l');
    assertThat(seq.params()).containsExactly(25);
  }

  @Test
  @DisplayName("Should not expose its parameter array and compare by value")
  void scan_Parameters_CopiedAndComparedByValue() {
    final CsiSequence seq = CsiSequence.scan(bytes("\u001b[1;31m"), 0);
    final int[] params = seq.params();
    params[1] = 99;

    assertThat(seq.params()).containsExactly(1, 31);
    assertThat(seq.param(1, 0)).isEqualTo(31);
    assertThat(seq).isEqualTo(CsiSequence.scan(bytes("\u001b[1;31m"), 0));
    assertThat(seq).hasSameHashCodeAs(CsiSequence.scan(bytes("\u001b[1;31m"), 0));
    assertThat(seq).isNotEqualTo(CsiSequence.scan(bytes("\u001b[1;32m"), 0));
    assertThat(seq.toString()).contains("[1, 31]");
  }

  @Test
  @DisplayName("Should stop at a byte outside the sequence grammar")
  void scan_InvalidByte_Malformed() {
    final CsiSequence seq = CsiSequence.scan(new byte[] {0x1B, '[', '3', '\n', 'm'}, 0);

    assertThat(seq.isComplete()).isFalse();
    assertThat(seq.end()).isEqualTo(3);
  }

  @Test
  @DisplayName("Should fold SGR parameters and build a restoring sequence")
  void sgrState_Parameters_RestoreSequence() {
    final SgrState state = new SgrState();

    state.apply(new int[] {1, 5, 31, 104});
    assertThat(state.restoreSequence()).isEqualTo("\u001b[0;1;5;31;104m");

    state.apply(new int[] {22, 25, 39});
    assertThat(state.restoreSequence()).isEqualTo("\u001b[0;104m");

    state.apply(new int[] {2, 7, 8, 49, 93});
    assertThat(state.isFaint()).isTrue();
    assertThat(state.isReverse()).isTrue();
    assertThat(state.isHidden()).isTrue();
    assertThat(state.getForeground()).isEqualTo(93);
    assertThat(state.getBackground()).isEqualTo(-1);

    state.apply(new int[0]);
    assertThat(state.restoreSequence()).isEqualTo("\u001b[0m");
  }

  @Test
  @DisplayName("Should clamp relative motion at the top-left corner")
  void track_MotionPastOrigin_Clamped() {
    final CursorTracker tracker = new CursorTracker();

    tracker.track(bytes("ab\u001b[9A\u001b[9D"));

    assertThat(tracker.getRow()).isEqualTo(1);
    assertThat(tracker.getCol()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should not move on save, restore or erase sequences")
  void track_NonMotionSequences_CursorUnchanged() {
    final CursorTracker tracker = new CursorTracker();

    tracker.track(bytes("abc\u001b[s\u001b[K\u001b[u\u001b(B"));

    assertThat(tracker.position()).isEqualTo(new FieldPosition(1, 4, "\u001b[0m"));
  }

  @Test
  @DisplayName("Should handle carriage return, line feed and control bytes")
  void track_ControlBytes_Tracked() {
    final CursorTracker tracker = new CursorTracker();

    tracker.track(bytes("abc\rX\nY\u0007"));

    assertThat(tracker.getRow()).isEqualTo(2);
    assertThat(tracker.getCol()).isEqualTo(2);
  }

  @Test
  @DisplayName("Should build a cursor-addressed overlay for a field")
  void fieldPosition_Overlay_MovesStylesAndWrites() {
    final FieldPosition position = new FieldPosition(3, 12, "\u001b[0;1;36m");

    assertThat(position.overlay("Jane")).isEqualTo("\u001b[3;12H\u001b[0;1;36mJane");
  }
}
