/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.time.Instant;
import javax.annotation.Nullable;

/**
 * A client's record of one provider that it backs up to. The provider's public key is unknown until the provider
 * answers the invitation.
 */
public record ProviderRelationship(
    @JsonProperty("provider_npub") String providerPublicKey,
    @JsonProperty("provider_callsign") String providerCallsign,
    @JsonProperty("backup_interval_days") int backupIntervalDays,
    @JsonProperty("status") RelationshipStatus status,
    @JsonProperty("max_storage_bytes") long maxStorageBytes,
    @JsonProperty("max_snapshots") int maxSnapshots,
    @JsonProperty("last_successful_backup") @Nullable Instant lastSuccessfulBackup,
    @JsonProperty("next_scheduled_backup") @Nullable Instant nextScheduledBackup,
    @JsonProperty("created_at") Instant createdAt) {

  public static ProviderRelationship pending(final String providerCallsign, final int backupIntervalDays,
      final Instant createdAt) {

    return new ProviderRelationship("", providerCallsign, backupIntervalDays, RelationshipStatus.PENDING, 0, 0, null,
        null, createdAt);
  }

  public ProviderRelationship withStatus(final RelationshipStatus status) {
    return new ProviderRelationship(providerPublicKey, providerCallsign, backupIntervalDays, status, maxStorageBytes,
        maxSnapshots, lastSuccessfulBackup, nextScheduledBackup, createdAt);
  }

  public ProviderRelationship withInviteResponse(final String providerPublicKey, final RelationshipStatus status,
      final long maxStorageBytes, final int maxSnapshots) {
    return new ProviderRelationship(providerPublicKey, providerCallsign, backupIntervalDays, status, maxStorageBytes,
        maxSnapshots, lastSuccessfulBackup, nextScheduledBackup, createdAt);
  }

  public ProviderRelationship withSuccessfulBackup(final Instant completedAt) {
    return new ProviderRelationship(providerPublicKey, providerCallsign, backupIntervalDays, status, maxStorageBytes,
        maxSnapshots, completedAt, completedAt.plus(Duration.ofDays(backupIntervalDays)), createdAt);
  }
}
