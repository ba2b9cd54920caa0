package com.consullo.bbstext.ansi;

import com.consullo.bbstext.codec.OutputMode;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the cursor and style tracking interpreter.
 */
public class AnsiInterpreterTest {

  private final AnsiInterpreter interpreter = new AnsiInterpreter();

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.ISO_8859_1);
  }

  private static String text(byte[] b) {
    return new String(b, StandardCharsets.ISO_8859_1);
  }

  @Test
  @DisplayName("Should record field markers with position and drop them from the output")
  void interpret_FieldMarkers_RecordedAndRemoved() {
    final InterpretResult result = interpreter.interpret(bytes("Name: |NA\r\nAge:  ~AG end"));

    assertThat(text(result.getDisplayBytes())).isEqualTo("Name: \nAge:   end");
    assertThat(result.getField("NA")).contains(new FieldPosition(1, 7, "\u001b[0m"));
    assertThat(result.getField("AG")).contains(new FieldPosition(2, 7, "\u001b[0m"));
  }

  @Test
  @DisplayName("Should record a single-letter marker when no second letter follows")
  void interpret_SingleLetterMarker_Recorded() {
    final InterpretResult result = interpreter.interpret(bytes("ab|X1"));

    assertThat(text(result.getDisplayBytes())).isEqualTo("ab1");
    assertThat(result.getField("X")).map(FieldPosition::col).contains(3);
  }

  @Test
  @DisplayName("Should capture the active style at a field")
  void interpret_StyledField_RestoringSequence() {
    final InterpretResult result = interpreter.interpret(bytes("\u001b[0;44m  \u001b[1;36m|TI"));

    assertThat(result.getField("TI")).map(FieldPosition::style).contains("\u001b[0;1;36;44m");
    assertThat(result.getField("TI")).map(FieldPosition::col).contains(3);
  }

  @Test
  @DisplayName("Should translate inline codes and apply them to the cursor")
  void interpret_InlineCodes_TranslatedAndTracked() {
    final InterpretResult result = interpreter.interpret(bytes("junk|CL|14Hi|FN"));

    assertThat(text(result.getDisplayBytes())).isEqualTo("junk\u001b[2J\u001b[H\u001b[1;33mHi");
    assertThat(result.getField("FN")).contains(new FieldPosition(1, 3, "\u001b[0;1;33m"));
  }

  @Test
  @DisplayName("Should prefer inline codes over field markers with the same letters")
  void interpret_CodeNamedLikeField_TranslatesCode() {
    final InterpretResult result = interpreter.interpret(bytes("|B1|DE"));

    assertThat(result.getFields()).isEmpty();
    assertThat(text(result.getDisplayBytes())).isEqualTo("\u001b[41m\u001b[K");
  }

  @Test
  @DisplayName("Should keep the last occurrence of a repeated field")
  void interpret_RepeatedField_LastWins() {
    final InterpretResult result = interpreter.interpret(bytes("|AAx|BB\n|AA"));

    assertThat(result.getField("AA")).map(p -> p.row() + "," + p.col()).contains("2,1");
    assertThat(result.getFields().keySet()).containsExactly("AA", "BB");
  }

  @Test
  @DisplayName("Should follow cursor motion sequences")
  void interpret_CursorMotion_Tracked() {
    final InterpretResult result = interpreter.interpret(
        bytes("\u001b[5;10H|AA\u001b[2A|BB\u001b[3C|CC\u001b[20D|DD\u001b[H|EE\u001b[3B|FF"));

    assertThat(result.getField("AA")).map(p -> p.row() + "," + p.col()).contains("5,10");
    assertThat(result.getField("BB")).map(p -> p.row() + "," + p.col()).contains("3,10");
    assertThat(result.getField("CC")).map(p -> p.row() + "," + p.col()).contains("3,13");
    assertThat(result.getField("DD")).map(p -> p.row() + "," + p.col()).contains("3,1");
    assertThat(result.getField("EE")).map(p -> p.row() + "," + p.col()).contains("1,1");
    assertThat(result.getField("FF")).map(p -> p.row() + "," + p.col()).contains("4,1");
  }

  @Test
  @DisplayName("Should advance tabs to the next multiple-of-8 stop")
  void interpret_Tab_NextStop() {
    final InterpretResult result = interpreter.interpret(bytes("ab\t|T1\t\tz"));

    assertThat(result.getField("T")).map(FieldPosition::col).contains(9);
    assertThat(result.getFinalCol()).isEqualTo(26);
  }

  @Test
  @DisplayName("Should treat placeholders as plain text")
  void interpret_Placeholder_CopiedVerbatim() {
    final InterpretResult result = interpreter.interpret(bytes("To: @S|L10@ |NM"));

    assertThat(text(result.getDisplayBytes())).isEqualTo("To: @S|L10@ ");
    assertThat(result.getFields()).containsOnlyKeys("NM");
    assertThat(result.getField("NM")).map(FieldPosition::col).contains(13);
  }

  @Test
  @DisplayName("Should translate dollar colors and bell codes")
  void interpret_DollarAndCaretCodes_Translated() {
    final InterpretResult result = interpreter.interpret(bytes("$2go^G^x"));

    assertThat(text(result.getDisplayBytes())).isEqualTo("\u001b[32mgo\u0007^x");
    assertThat(result.getFinalCol()).isEqualTo(5);
  }

  @Test
  @DisplayName("Should emit a doubled bar as one literal bar")
  void interpret_DoubledBar_Literal() {
    final InterpretResult result = interpreter.interpret(bytes("a||b|"));

    assertThat(text(result.getDisplayBytes())).isEqualTo("a|b|");
    assertThat(result.getFinalCol()).isEqualTo(5);
  }

  @Test
  @DisplayName("Should emit a malformed escape up to the ambiguity and continue scanning")
  void interpret_MalformedEscape_Recovers() {
    final InterpretResult result = interpreter.interpret(bytes("\u001b[12\u0001x|AB"));

    assertThat(text(result.getDisplayBytes())).isEqualTo("\u001b[12\u0001x");
    assertThat(result.getField("AB")).map(FieldPosition::col).contains(2);
  }

  @Test
  @DisplayName("Should pass an incomplete trailing escape through")
  void interpret_IncompleteEscape_PassedThrough() {
    final InterpretResult result = interpreter.interpret(bytes("ok\u001b[3"));

    assertThat(text(result.getDisplayBytes())).isEqualTo("ok\u001b[3");
    assertThat(result.getFinalCol()).isEqualTo(3);
  }

  @Test
  @DisplayName("Should convert high bytes to UTF-8 when configured")
  void interpret_Utf8Mode_ConvertsHighBytes() {
    final AnsiInterpreter utf8 = new AnsiInterpreter(new InterpreterConfig(OutputMode.UTF8));
    final byte[] raw = {(byte) 0xC9, (byte) 0xCD, '|', 'A', 'B', (byte) 0xBB};

    final InterpretResult result = utf8.interpret(raw);

    assertThat(new String(result.getDisplayBytes(), StandardCharsets.UTF_8)).isEqualTo("╔═╗");
    assertThat(result.getField("AB")).map(FieldPosition::col).contains(3);
  }

  @Test
  @DisplayName("Should keep high bytes unchanged by default")
  void interpret_DefaultMode_KeepsHighBytes() {
    final byte[] raw = {(byte) 0xB0, (byte) 0xB1};

    assertThat(interpreter.interpret(raw).getDisplayBytes()).isEqualTo(raw);
  }

  @Test
  @DisplayName("Should reject a null configuration")
  void constructor_NullConfig_Throws() {
    assertThatThrownBy(() -> new AnsiInterpreter(null)).isInstanceOf(IllegalArgumentException.class);
  }
}
