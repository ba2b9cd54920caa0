package com.consullo.bbstext.template;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for template loading and SAUCE metadata removal.
 */
public class TemplateLoaderTest {

  @TempDir
  Path tempDir;

  private static byte[] sauceRecord() {
    final byte[] record = new byte[TemplateLoader.SAUCE_RECORD_LENGTH];
    Arrays.fill(record, (byte) ' ');
    System.arraycopy("SAUCE00".getBytes(StandardCharsets.US_ASCII), 0, record, 0, 7);
    return record;
  }

  private static byte[] concat(byte[]... parts) {
    int length = 0;
    for (byte[] part : parts) {
      length += part.length;
    }
    final byte[] out = new byte[length];
    int at = 0;
    for (byte[] part : parts) {
      System.arraycopy(part, 0, out, at, part.length);
      at += part.length;
    }
    return out;
  }

  private static byte[] ascii(String s) {
    return s.getBytes(StandardCharsets.US_ASCII);
  }

  @Test
  @DisplayName("Should return content without a record unchanged")
  void stripSauce_NoRecord_Unchanged() {
    final byte[] content = new byte[300];
    Arrays.fill(content, (byte) 'x');

    assertThat(TemplateLoader.stripSauce(content)).isSameAs(content);
  }

  @Test
  @DisplayName("Should return input shorter than a record unchanged")
  void stripSauce_TooSmall_Unchanged() {
    final byte[] content = ascii("SAUCE");

    assertThat(TemplateLoader.stripSauce(content)).isSameAs(content);
  }

  @Test
  @DisplayName("Should cut at the end-of-file marker before the record")
  void stripSauce_WithMarker_CutAtMarker() {
    final byte[] data = concat(ascii("Hello ANSI"), new byte[] {0x1A}, sauceRecord());

    assertThat(TemplateLoader.stripSauce(data)).isEqualTo(ascii("Hello ANSI"));
  }

  @Test
  @DisplayName("Should cut at the marker even when a comment block follows it")
  void stripSauce_CommentBlock_CutAtMarker() {
    final byte[] comment = concat(ascii("COMNT"), new byte[64]);
    final byte[] data = concat(ascii("Art"), new byte[] {0x1A}, comment, sauceRecord());

    assertThat(TemplateLoader.stripSauce(data)).isEqualTo(ascii("Art"));
  }

  @Test
  @DisplayName("Should cut at the record when there is no marker")
  void stripSauce_WithoutMarker_CutAtRecord() {
    final byte[] data = concat(ascii("Hello ANSI"), sauceRecord());

    assertThat(TemplateLoader.stripSauce(data)).isEqualTo(ascii("Hello ANSI"));
  }

  @Test
  @DisplayName("Should leave data alone when the signature is not at the record start")
  void stripSauce_SignatureMisplaced_Unchanged() {
    final byte[] record = sauceRecord();
    System.arraycopy(ascii("NOTASAUCE"), 0, record, 0, 9);
    final byte[] data = concat(ascii("Hello"), record);

    assertThat(TemplateLoader.stripSauce(data)).isEqualTo(data);
  }

  @Test
  @DisplayName("Should be idempotent")
  void stripSauce_AppliedTwice_SameResult() {
    final byte[] data = concat(ascii("Hello ANSI"), new byte[] {0x1A}, sauceRecord());

    final byte[] once = TemplateLoader.stripSauce(data);

    assertThat(TemplateLoader.stripSauce(once)).isEqualTo(once);
  }

  @Test
  @DisplayName("Should load a template by name and strip its metadata")
  void load_ExistingFile_ContentReturned() throws Exception {
    Files.write(tempDir.resolve("menu.ans"), concat(ascii("|07Main Menu"), new byte[] {0x1A}, sauceRecord()));
    final TemplateLoader loader = new TemplateLoader(tempDir);

    assertThat(loader.load("menu.ans")).isEqualTo(ascii("|07Main Menu"));
  }

  @Test
  @DisplayName("Should surface a missing file as a load failure")
  void load_MissingFile_Throws() {
    final TemplateLoader loader = new TemplateLoader(tempDir);

    assertThatThrownBy(() -> loader.load("missing.ans"))
        .isInstanceOf(TemplateLoadException.class)
        .hasMessageContaining("missing.ans")
        .hasCauseInstanceOf(java.nio.file.NoSuchFileException.class);
  }

  @Test
  @DisplayName("Should refuse names that leave the template directory")
  void load_PathTraversal_Rejected() {
    final TemplateLoader loader = new TemplateLoader(tempDir.resolve("menus"));

    assertThatThrownBy(() -> loader.load("../secret.ans")).isInstanceOf(IllegalArgumentException.class);
  }
}
