/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.core;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;

/** Keeps the {@code plugbar.json5.example} snapshot in line with the bundled template. */
final class ConfigTemplateWriter {

  private ConfigTemplateWriter() {}

  /**
   * Writes the example file if missing or stale.
   *
   * @param path destination path (usually {@code config/plugbar.json5.example})
   * @param contents canonical template to persist
   * @return whether the file was written
   */
  static boolean writeExample(Path path, String contents) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(contents, "contents");

    byte[] data = contents.getBytes(StandardCharsets.UTF_8);
    try {
      if (Files.exists(path) && Arrays.equals(Files.readAllBytes(path), data)) {
        return false;
      }
      Path parent = path.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.write(path, data);
      return true;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write config template: " + path, e);
    }
  }
}
