package com.consullo.bbstext.codec;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.OptionalInt;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the code page tables and transcoding.
 */
public class Cp437Test {

  @Test
  @DisplayName("Should map ASCII bytes to themselves")
  void decode_AsciiRange_Identity() {
    for (int b = 0; b < 0x80; b++) {
      assertThat(Cp437.decode(b)).isEqualTo(b);
    }
  }

  @Test
  @DisplayName("Should decode box-drawing and accented bytes")
  void decode_HighBytes_ReturnsGlyphs() {
    assertThat(Cp437.decode(0x80)).isEqualTo(0x00C7);
    assertThat(Cp437.decode(0xB3)).isEqualTo(0x2502);
    assertThat(Cp437.decode(0xC9)).isEqualTo(0x2554);
    assertThat(Cp437.decode(0xDB)).isEqualTo(0x2588);
    assertThat(Cp437.decode(0xFF)).isEqualTo(0x00A0);
    assertThat(Cp437.decode((byte) 0xCD)).isEqualTo(0x2550);
  }

  @Test
  @DisplayName("Should return the original byte when encoding a decoded byte with a reverse entry")
  void encode_DecodedBytes_RoundTrip() {
    for (int b = 0; b < 0xFF; b++) {
      final OptionalInt encoded = Cp437.encode(Cp437.decode(b));
      assertThat(encoded).as("byte 0x%02X", b).hasValue(b);
    }
  }

  @Test
  @DisplayName("Should report no mapping for code points outside the curated table")
  void encode_Unmappable_Empty() {
    assertThat(Cp437.encode(0x20AC)).isEmpty();
    assertThat(Cp437.encode(0x00A0)).isEmpty();
    assertThat(Cp437.encodeOrPlaceholder(0x20AC)).isEqualTo((byte) '?');
  }

  @Test
  @DisplayName("Should transcode box-drawing runs byte by byte")
  void transcodeToUtf8_BoxDrawingRun_DecodesEachByte() {
    final byte[] input = {(byte) 0xC9, (byte) 0xCD, (byte) 0xBB};

    final byte[] output = Cp437.transcodeToUtf8(input);

    assertThat(new String(output, StandardCharsets.UTF_8)).isEqualTo("╔═╗");
  }

  @Test
  @DisplayName("Should emit well-formed UTF-8 for every high byte")
  void transcodeToUtf8_EveryHighByte_ValidUtf8() {
    for (int b = 0x80; b <= 0xFF; b++) {
      final byte[] output = Cp437.transcodeToUtf8(new byte[] {(byte) b});
      final String expected = new String(Character.toChars(Cp437.decode(b)));

      assertThat(output).isEqualTo(expected.getBytes(StandardCharsets.UTF_8));
      assertThat(new String(output, StandardCharsets.UTF_8)).isEqualTo(expected);
    }
  }

  @Test
  @DisplayName("Should copy escape sequences through untouched")
  void transcodeToUtf8_EscapeSequences_PassThrough() {
    final byte[] input = {0x1B, '[', '1', ';', '3', '1', 'm', (byte) 0xDB, 0x1B, '(', 'B', 'A'};

    final String output = new String(Cp437.transcodeToUtf8(input), StandardCharsets.UTF_8);

    assertThat(output).isEqualTo("\u001b[1;31m█\u001b(BA");
  }

  @Test
  @DisplayName("Should encode Unicode text into code page bytes with placeholders")
  void encodeString_MixedText_EncodesOrSubstitutes() {
    final byte[] output = Cp437.encodeString("╔═ café €");

    final byte[] expected = {(byte) 0xC9, (byte) 0xCD, ' ', 'c', 'a', 'f', (byte) 0x82, ' ', '?'};
    assertThat(output).isEqualTo(expected);
  }

  @Test
  @DisplayName("Should approximate line drawing with ASCII")
  void asciiFallback_LineDrawing_Approximates() {
    assertThat(Cp437.asciiFallback(0xB3)).isEqualTo('|');
    assertThat(Cp437.asciiFallback(0xC4)).isEqualTo('-');
    assertThat(Cp437.asciiFallback(0xDA)).isEqualTo('+');
    assertThat(Cp437.asciiFallback(0xB1)).isEqualTo('#');
    assertThat(Cp437.asciiFallback(0x82)).isEqualTo('?');
    assertThat(Cp437.asciiFallback('x')).isEqualTo('x');
  }

  @Test
  @DisplayName("Should write high bytes according to the output mode")
  void outputMode_HighByte_WritesPerMode() {
    final ByteArrayOutputStream cp437 = new ByteArrayOutputStream();
    final ByteArrayOutputStream utf8 = new ByteArrayOutputStream();
    final ByteArrayOutputStream ascii = new ByteArrayOutputStream();

    OutputMode.CP437.writeHighByte(cp437, 0xC4);
    OutputMode.UTF8.writeHighByte(utf8, 0xC4);
    OutputMode.ASCII.writeHighByte(ascii, 0xC4);

    assertThat(cp437.toByteArray()).containsExactly((byte) 0xC4);
    assertThat(new String(utf8.toByteArray(), StandardCharsets.UTF_8)).isEqualTo("─");
    assertThat(ascii.toByteArray()).containsExactly((byte) '-');
  }

  @Test
  @DisplayName("Should reject null input")
  void transcodeToUtf8_Null_Throws() {
    assertThatThrownBy(() -> Cp437.transcodeToUtf8(null)).isInstanceOf(NullPointerException.class);
  }
}
