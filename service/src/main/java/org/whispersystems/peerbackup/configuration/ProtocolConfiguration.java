/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

public class ProtocolConfiguration {

  /**
   * Maximum difference between a signed event's timestamp and the local clock, in either direction.
   */
  @JsonProperty
  @NotNull
  private Duration freshnessWindow = Duration.ofMinutes(5);

  /**
   * How long an invitation waits for the provider's answer.
   */
  @JsonProperty
  @NotNull
  private Duration inviteTimeout = Duration.ofSeconds(60);

  public Duration getFreshnessWindow() {
    return freshnessWindow;
  }

  public Duration getInviteTimeout() {
    return inviteTimeout;
  }
}
