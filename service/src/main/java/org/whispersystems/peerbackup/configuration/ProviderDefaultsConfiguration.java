/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.util.DataSize;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import org.whispersystems.peerbackup.storage.ProviderSettings;

/**
 * Provider settings used until the user changes them. Provider mode starts disabled.
 */
public class ProviderDefaultsConfiguration {

  @JsonProperty
  @NotNull
  private DataSize maxTotalStorage = DataSize.gibibytes(10);

  @JsonProperty
  @NotNull
  private DataSize maxClientStorage = DataSize.gibibytes(1);

  @JsonProperty
  @Min(1)
  private int maxSnapshots = 10;

  @JsonProperty
  private boolean autoAcceptFromContacts = false;

  public DataSize getMaxTotalStorage() {
    return maxTotalStorage;
  }

  public DataSize getMaxClientStorage() {
    return maxClientStorage;
  }

  public int getMaxSnapshots() {
    return maxSnapshots;
  }

  public boolean isAutoAcceptFromContacts() {
    return autoAcceptFromContacts;
  }

  @AssertTrue(message = "maxClientStorage must be positive and no larger than maxTotalStorage")
  public boolean isClientStorageWithinTotal() {
    return maxTotalStorage == null || maxClientStorage == null
        || (maxClientStorage.toBytes() > 0 && maxClientStorage.toBytes() <= maxTotalStorage.toBytes());
  }

  public ProviderSettings toProviderSettings(final Instant now) {
    return new ProviderSettings(false, maxTotalStorage.toBytes(), maxClientStorage.toBytes(), maxSnapshots,
        autoAcceptFromContacts, now);
  }
}
