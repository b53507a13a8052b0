/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Global settings for this device acting as a backup provider.
 */
public record ProviderSettings(
    @JsonProperty("enabled") boolean enabled,
    @JsonProperty("max_total_storage_bytes") long maxTotalStorageBytes,
    @JsonProperty("default_max_client_storage_bytes") long defaultMaxClientStorageBytes,
    @JsonProperty("default_max_snapshots") int defaultMaxSnapshots,
    @JsonProperty("auto_accept_from_contacts") boolean autoAcceptFromContacts,
    @JsonProperty("updated_at") Instant updatedAt) {

  public ProviderSettings withEnabled(final boolean enabled, final Instant updatedAt) {
    return new ProviderSettings(enabled, maxTotalStorageBytes, defaultMaxClientStorageBytes, defaultMaxSnapshots,
        autoAcceptFromContacts, updatedAt);
  }
}
