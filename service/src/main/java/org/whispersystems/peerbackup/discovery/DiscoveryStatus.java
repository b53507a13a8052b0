/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.discovery;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

public record DiscoveryStatus(
    @JsonProperty("discovery_id") String discoveryId,
    @JsonProperty("status") State state,
    @JsonProperty("devices_to_query") int devicesToQuery,
    @JsonProperty("devices_queried") int devicesQueried,
    @JsonProperty("devices_responded") int devicesResponded,
    @JsonProperty("providers_found") List<DiscoveredProvider> providersFound) {

  public enum State {
    @JsonProperty("in_progress")
    IN_PROGRESS,

    @JsonProperty("complete")
    COMPLETE
  }

  public DiscoveryStatus {
    providersFound = providersFound == null ? List.of() : List.copyOf(providersFound);
  }

  public static DiscoveryStatus started(final String discoveryId, final int devicesToQuery) {
    return new DiscoveryStatus(discoveryId, State.IN_PROGRESS, devicesToQuery, 0, 0, List.of());
  }

  public boolean isComplete() {
    return state == State.COMPLETE;
  }

  public DiscoveryStatus withDeviceQueried() {
    return new DiscoveryStatus(discoveryId, state, devicesToQuery, devicesQueried + 1, devicesResponded,
        providersFound);
  }

  /**
   * Records one response, and the provider it revealed, if any.
   */
  public DiscoveryStatus withResponse(@Nullable final DiscoveredProvider provider) {
    final List<DiscoveredProvider> providers = new ArrayList<>(providersFound);
    if (provider != null) {
      providers.add(provider);
    }

    return new DiscoveryStatus(discoveryId, state, devicesToQuery, devicesQueried, devicesResponded + 1, providers);
  }

  public DiscoveryStatus completed() {
    return new DiscoveryStatus(discoveryId, State.COMPLETE, devicesToQuery, devicesQueried, devicesResponded,
        providersFound);
  }
}
