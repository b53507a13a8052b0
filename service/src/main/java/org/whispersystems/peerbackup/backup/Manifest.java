/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.backup;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/**
 * The index of a snapshot. Stored on the provider only in encrypted form.
 */
public record Manifest(
    @JsonProperty("version") String version,
    @JsonProperty("snapshot_id") String snapshotId,
    @JsonProperty("client_npub") String clientPublicKey,
    @JsonProperty("client_callsign") String clientCallsign,
    @JsonProperty("files") List<FileEntry> files,
    @JsonProperty("total_files") int totalFiles,
    @JsonProperty("total_bytes") long totalBytes,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt) {

  public static final String CURRENT_VERSION = "1.0";

  public Manifest {
    files = files == null ? List.of() : List.copyOf(files);
  }

  public static Manifest of(final String snapshotId, final String clientPublicKey, final String clientCallsign,
      final List<FileEntry> files, final Instant startedAt, final Instant completedAt) {

    return new Manifest(CURRENT_VERSION, snapshotId, clientPublicKey, clientCallsign, files, files.size(),
        files.stream().mapToLong(FileEntry::plaintextSize).sum(), startedAt, completedAt);
  }
}
