package com.consullo.bbstext.ansi;

import com.consullo.bbstext.codec.OutputMode;
import org.apache.commons.lang3.Validate;

/**
 * Interpreter configuration values.
 *
 * @param outputMode how high code page bytes are written to the display output
 * @since 1.0
 */
public record InterpreterConfig(OutputMode outputMode) {

  public InterpreterConfig {
    Validate.notNull(outputMode, "outputMode must not be null");
  }

  /**
   * Configuration for terminals that display the code page natively.
   *
   * @return default configuration
   */
  public static InterpreterConfig defaults() {
    return new InterpreterConfig(OutputMode.CP437);
  }
}
