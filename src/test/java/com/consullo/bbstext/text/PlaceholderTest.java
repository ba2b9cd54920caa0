package com.consullo.bbstext.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the placeholder scanner shared by the interpreter and the
 * template layer.
 */
public class PlaceholderTest {

  @Test
  @DisplayName("Should parse the placeholder grammar")
  void parseAt_Grammar_FieldsResolved() {
    final Placeholder placeholder = Placeholder.parseAt("x@T|C#####@", 1);

    assertThat(placeholder).isNotNull();
    assertThat(placeholder.code()).isEqualTo('T');
    assertThat(placeholder.alignment()).isEqualTo(Alignment.CENTER);
    assertThat(placeholder.width()).isEqualTo(10);
    assertThat(placeholder.start()).isEqualTo(1);
    assertThat(placeholder.end()).isEqualTo(11);
    assertThat(placeholder.length()).isEqualTo(10);
  }

  @ParameterizedTest(name = "[{index}] {0} -> width {1}")
  @CsvSource({
      "@T@, 0",
      "@T:8@, 8",
      "@T####@, 7",
      "@T|R8:3@, 8",
      "@T|C:10@, 10"
  })
  @DisplayName("Should resolve the width by precedence")
  void parseAt_WidthForms_Resolved(String text, int width) {
    assertThat(Placeholder.parseAt(text, 0).width()).isEqualTo(width);
  }

  @Test
  @DisplayName("Should reject text that is not a complete placeholder")
  void parseAt_Malformed_Null() {
    assertThat(Placeholder.parseAt("@t@", 0)).isNull();
    assertThat(Placeholder.parseAt("@T", 0)).isNull();
    assertThat(Placeholder.parseAt("@T|X@", 0)).isNull();
    assertThat(Placeholder.parseAt("@T:@", 0)).isNull();
    assertThat(Placeholder.parseAt("x@T@", 0)).isNull();
  }
}
