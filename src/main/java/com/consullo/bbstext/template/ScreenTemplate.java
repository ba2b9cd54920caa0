package com.consullo.bbstext.template;

import com.consullo.bbstext.ansi.AnsiInterpreter;
import com.consullo.bbstext.ansi.FieldPosition;
import com.consullo.bbstext.ansi.InterpretResult;
import com.consullo.bbstext.codec.Cp437;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * A loaded screen template: its raw code page bytes and the field table
 * harvested from them.
 *
 * <p>
 * The template is interpreted twice, by two independent passes. The first pass
 * runs once, over the raw bytes, and only keeps the field table. The second runs
 * on every {@link #render(Map)}, over the substituted bytes, and produces what
 * is sent to the terminal.
 * </p>
 *
 * <p>
 * Not thread-safe for reload; each session owns its templates.
 * </p>
 */
public final class ScreenTemplate {

  private final byte[] raw;
  private final AnsiInterpreter interpreter;
  private final Map<String, FieldPosition> fields;

  public ScreenTemplate(byte[] raw, AnsiInterpreter interpreter) {
    Validate.notNull(raw, "raw must not be null");
    Validate.notNull(interpreter, "interpreter must not be null");
    this.raw = raw.clone();
    this.interpreter = interpreter;
    this.fields = interpreter.interpret(this.raw).getFields();
  }

  /**
   * Loads a template through a loader.
   *
   * @param loader template loader
   * @param name template name
   * @param interpreter interpreter used for both passes
   * @return loaded template
   * @throws TemplateLoadException when the file cannot be read
   */
  public static ScreenTemplate load(TemplateLoader loader, String name, AnsiInterpreter interpreter)
      throws TemplateLoadException {
    Validate.notNull(loader, "loader must not be null");
    return new ScreenTemplate(loader.load(name), interpreter);
  }

  /**
   * Substitutes placeholder values and interprets the result for display.
   * Values are encoded into the code page before substitution.
   *
   * @param values field code to value
   * @return display bytes
   */
  public byte[] render(Map<Character, String> values) {
    Validate.notNull(values, "values must not be null");
    Map<Character, String> encoded = new HashMap<>(values.size() * 2);
    for (Map.Entry<Character, String> e : values.entrySet()) {
      encoded.put(e.getKey(), new String(Cp437.encodeString(e.getValue()), StandardCharsets.ISO_8859_1));
    }
    String template = new String(raw, StandardCharsets.ISO_8859_1);
    String substituted = PlaceholderTemplate.process(template, encoded);
    InterpretResult result = interpreter.interpret(substituted.getBytes(StandardCharsets.ISO_8859_1));
    return result.getDisplayBytes();
  }

  /**
   * Field markers found in the raw template, by code.
   *
   * @return read-only field table
   */
  public Map<String, FieldPosition> getFields() {
    return fields;
  }

  public Optional<FieldPosition> getField(String code) {
    return Optional.ofNullable(fields.get(code));
  }

  public Optional<FieldPosition> placeholderPosition(char code) {
    return PlaceholderTemplate.findPlaceholder(raw, code);
  }

  public Optional<String> styleAt(int row, int col) {
    return PlaceholderTemplate.styleAt(raw, row, col);
  }

  public byte[] getRawBytes() {
    return raw.clone();
  }
}
