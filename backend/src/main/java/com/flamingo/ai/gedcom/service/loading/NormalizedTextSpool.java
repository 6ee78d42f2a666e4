package com.flamingo.ai.gedcom.service.loading;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Temporary file holding normalized GEDCOM text for the duration of one build attempt.
 *
 * <p>Use with try-with-resources: the file is deleted on {@link #close()} whether or not the build
 * succeeded.
 */
@Slf4j
final class NormalizedTextSpool implements AutoCloseable {

  private final Path file;

  private NormalizedTextSpool(Path file) {
    this.file = file;
  }

  /**
   * Writes {@code lines} to a new temporary file.
   *
   * @throws UncheckedIOException if the file cannot be created or written
   */
  static NormalizedTextSpool write(List<String> lines) {
    Path file = null;
    try {
      file = Files.createTempFile("gedcom-normalized-", ".ged");
      Files.write(file, lines, StandardCharsets.UTF_8);
      return new NormalizedTextSpool(file);
    } catch (IOException e) {
      deleteQuietly(file);
      throw new UncheckedIOException("Failed to spool normalized text", e);
    }
  }

  Path path() {
    return file;
  }

  @Override
  public void close() {
    deleteQuietly(file);
  }

  private static void deleteQuietly(Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("Could not delete temporary file {}: {}", file, e.getMessage());
    }
  }
}
