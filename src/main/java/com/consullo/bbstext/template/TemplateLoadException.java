package com.consullo.bbstext.template;

import java.io.IOException;

/**
 * Thrown when a template file cannot be read.
 *
 * @since 1.0
 */
public class TemplateLoadException extends IOException {

  private static final long serialVersionUID = 1L;

  public TemplateLoadException(String message, Throwable cause) {
    super(message, cause);
  }

  public TemplateLoadException(String message) {
    super(message);
  }
}
