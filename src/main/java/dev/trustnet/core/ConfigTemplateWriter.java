/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Objects;

/** Keeps {@code trustnet.json5.example} in sync with the built-in template. */
final class ConfigTemplateWriter {

  private ConfigTemplateWriter() {}

  /**
   * Writes the example file if it is missing or stale. The file is replaced through a sibling
   * temp file so readers never see a half-written template.
   *
   * @param path destination path (usually {@code config/trustnet.json5.example})
   * @param contents template text
   * @return {@code true} if the file was (re)written
   */
  static boolean writeExample(Path path, String contents) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(contents, "contents");

    byte[] data = contents.getBytes(StandardCharsets.UTF_8);
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      if (Files.exists(path) && Arrays.equals(Files.readAllBytes(path), data)) {
        return false;
      }
      Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
      Files.write(tmp, data);
      Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
      return true;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write config template: " + path, e);
    }
  }
}
