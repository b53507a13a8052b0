/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import javax.annotation.Nullable;

/**
 * The provider's status record for one of a client's snapshots.
 */
public record Snapshot(
    @JsonProperty("snapshot_id") String snapshotId,
    @JsonProperty("status") SnapshotStatus status,
    @JsonProperty("total_files") int totalFiles,
    @JsonProperty("total_bytes") long totalBytes,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") @Nullable Instant completedAt) {

  public static Snapshot started(final String snapshotId, final Instant startedAt) {
    return new Snapshot(snapshotId, SnapshotStatus.IN_PROGRESS, 0, 0, startedAt, null);
  }

  public Snapshot completed(final int totalFiles, final long totalBytes, final Instant completedAt) {
    return new Snapshot(snapshotId, SnapshotStatus.COMPLETE, totalFiles, totalBytes, startedAt, completedAt);
  }
}
