package com.consullo.bbstext.template;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads template files and removes trailing SAUCE metadata.
 *
 * <p>
 * A SAUCE record is the last 128 bytes of a file and starts with
 * {@code SAUCE}. Drawing tools write an end-of-file byte (0x1A) before it,
 * sometimes followed by a comment block, so the loader searches backward from
 * the record for the marker and cuts there; without a marker it cuts at the
 * record itself.
 * </p>
 */
public final class TemplateLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(TemplateLoader.class);

  static final int SAUCE_RECORD_LENGTH = 128;
  static final int MAX_MARKER_SEARCH = 65_536;
  private static final byte EOF_MARKER = 0x1A;
  private static final byte[] SAUCE_ID = "SAUCE".getBytes(StandardCharsets.US_ASCII);

  private final Path baseDirectory;

  /**
   * Creates a loader that resolves template names against a directory.
   *
   * @param baseDirectory template directory
   */
  public TemplateLoader(Path baseDirectory) {
    Validate.notNull(baseDirectory, "baseDirectory must not be null");
    this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
  }

  /**
   * Loads a template by name relative to the base directory.
   *
   * @param name file name, e.g. {@code "editor.ans"}
   * @return template bytes without SAUCE metadata
   * @throws TemplateLoadException when the file is missing or unreadable
   */
  public byte[] load(String name) throws TemplateLoadException {
    Validate.notBlank(name, "name must not be blank");
    Path path = baseDirectory.resolve(name).normalize();
    if (!path.startsWith(baseDirectory)) {
      throw new IllegalArgumentException("name must stay inside the template directory: " + name);
    }
    return load(path);
  }

  /**
   * Loads a template file.
   *
   * @param path file path
   * @return template bytes without SAUCE metadata
   * @throws TemplateLoadException when the file is missing or unreadable
   */
  public static byte[] load(Path path) throws TemplateLoadException {
    Validate.notNull(path, "path must not be null");
    final byte[] data;
    try {
      data = Files.readAllBytes(path);
    } catch (IOException e) {
      throw new TemplateLoadException("failed to read template " + path, e);
    }
    byte[] stripped = stripSauce(data);
    LOGGER.debug("load: {} ({} bytes, {} after metadata removal)", path, data.length, stripped.length);
    return stripped;
  }

  /**
   * Removes a trailing SAUCE record and the end-of-file marker before it.
   * Input without a record is returned unchanged.
   *
   * @param data file bytes
   * @return content bytes
   */
  public static byte[] stripSauce(byte[] data) {
    Validate.notNull(data, "data must not be null");
    if (data.length < SAUCE_RECORD_LENGTH) {
      return data;
    }
    int sauceStart = data.length - SAUCE_RECORD_LENGTH;
    for (int k = 0; k < SAUCE_ID.length; k++) {
      if (data[sauceStart + k] != SAUCE_ID[k]) {
        return data;
      }
    }
    int cut = sauceStart;
    int limit = Math.max(0, sauceStart - MAX_MARKER_SEARCH);
    for (int i = sauceStart - 1; i >= limit; i--) {
      if (data[i] == EOF_MARKER) {
        cut = i;
        break;
      }
    }
    LOGGER.trace("stripSauce: record at {}, content ends at {}", sauceStart, cut);
    return Arrays.copyOf(data, cut);
  }

  public Path getBaseDirectory() {
    return baseDirectory;
  }
}
