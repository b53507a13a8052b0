/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.discovery;

import com.fasterxml.jackson.annotation.JsonProperty;
import javax.annotation.Nullable;

/**
 * A peer that reported holding backups for the identity being recovered.
 */
public record DiscoveredProvider(
    @JsonProperty("callsign") String callsign,
    @JsonProperty("npub") String publicKey,
    @JsonProperty("max_storage_bytes") long maxStorageBytes,
    @JsonProperty("snapshot_count") int snapshotCount,
    @JsonProperty("latest_snapshot") @Nullable String latestSnapshotId) {
}
