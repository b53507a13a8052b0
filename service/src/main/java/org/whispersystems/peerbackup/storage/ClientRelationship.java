/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import javax.annotation.Nullable;

/**
 * A provider's record of one client that backs up to it.
 */
public record ClientRelationship(
    @JsonProperty("client_npub") String clientPublicKey,
    @JsonProperty("client_callsign") String clientCallsign,
    @JsonProperty("max_storage_bytes") long maxStorageBytes,
    @JsonProperty("max_snapshots") int maxSnapshots,
    @JsonProperty("current_storage_bytes") long currentStorageBytes,
    @JsonProperty("snapshot_count") int snapshotCount,
    @JsonProperty("status") RelationshipStatus status,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("last_backup_at") @Nullable Instant lastBackupAt,
    @JsonProperty("last_backup_status") @Nullable String lastBackupStatus) {

  public static ClientRelationship pending(final String clientPublicKey, final String clientCallsign,
      final long maxStorageBytes, final int maxSnapshots, final Instant createdAt) {

    return new ClientRelationship(clientPublicKey, clientCallsign, maxStorageBytes, maxSnapshots, 0, 0,
        RelationshipStatus.PENDING, createdAt, null, null);
  }

  public ClientRelationship withStatus(final RelationshipStatus status) {
    return new ClientRelationship(clientPublicKey, clientCallsign, maxStorageBytes, maxSnapshots, currentStorageBytes,
        snapshotCount, status, createdAt, lastBackupAt, lastBackupStatus);
  }

  public ClientRelationship withQuota(final long maxStorageBytes, final int maxSnapshots) {
    return new ClientRelationship(clientPublicKey, clientCallsign, maxStorageBytes, maxSnapshots, currentStorageBytes,
        snapshotCount, status, createdAt, lastBackupAt, lastBackupStatus);
  }

  public ClientRelationship withStorageAdded(final long bytes) {
    return new ClientRelationship(clientPublicKey, clientCallsign, maxStorageBytes, maxSnapshots,
        currentStorageBytes + bytes, snapshotCount, status, createdAt, lastBackupAt, lastBackupStatus);
  }

  public ClientRelationship withLastBackup(final int snapshotCount, final Instant lastBackupAt,
      final String lastBackupStatus) {
    return new ClientRelationship(clientPublicKey, clientCallsign, maxStorageBytes, maxSnapshots, currentStorageBytes,
        snapshotCount, status, createdAt, lastBackupAt, lastBackupStatus);
  }
}
