/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.storage;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;
import org.whispersystems.peerbackup.util.SystemMapper;

/**
 * Reads and writes the JSON and blob files of the data directory. Writes go to a temporary sibling that is then moved
 * into place, so readers never see a partially written file.
 */
final class JsonFiles {

  private JsonFiles() {
  }

  static <T> Optional<T> read(final Path path, final Class<T> type) throws IOException {
    if (!Files.isRegularFile(path)) {
      return Optional.empty();
    }
    return Optional.of(SystemMapper.jsonMapper().readValue(path.toFile(), type));
  }

  static void write(final Path path, final Object value) throws IOException {
    writeBytes(path, SystemMapper.prettyWriter().writeValueAsBytes(value));
  }

  static void writeBytes(final Path path, final byte[] bytes) throws IOException {
    Files.createDirectories(path.getParent());

    final Path temporary = path.resolveSibling(path.getFileName() + ".tmp");
    Files.write(temporary, bytes);

    try {
      Files.move(temporary, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (final AtomicMoveNotSupportedException e) {
      Files.move(temporary, path, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  static Optional<byte[]> readBytes(final Path path) throws IOException {
    if (!Files.isRegularFile(path)) {
      return Optional.empty();
    }
    return Optional.of(Files.readAllBytes(path));
  }

  static void deleteRecursively(final Path directory) throws IOException {
    if (!Files.exists(directory)) {
      return;
    }

    try (final Stream<Path> paths = Files.walk(directory)) {
      for (final Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
        Files.delete(path);
      }
    }
  }
}
