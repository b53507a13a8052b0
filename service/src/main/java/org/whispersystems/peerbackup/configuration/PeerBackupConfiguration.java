/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public class PeerBackupConfiguration {

  @JsonProperty
  @NotNull
  @Valid
  private StorageConfiguration storage = new StorageConfiguration();

  @JsonProperty
  @NotNull
  @Valid
  private ProtocolConfiguration protocol = new ProtocolConfiguration();

  @JsonProperty
  @NotNull
  @Valid
  private ExecutorConfiguration executor = new ExecutorConfiguration();

  @JsonProperty
  @NotNull
  @Valid
  private ProviderDefaultsConfiguration providerDefaults = new ProviderDefaultsConfiguration();

  public StorageConfiguration getStorageConfiguration() {
    return storage;
  }

  public ProtocolConfiguration getProtocolConfiguration() {
    return protocol;
  }

  public ExecutorConfiguration getExecutorConfiguration() {
    return executor;
  }

  public ProviderDefaultsConfiguration getProviderDefaultsConfiguration() {
    return providerDefaults;
  }
}
