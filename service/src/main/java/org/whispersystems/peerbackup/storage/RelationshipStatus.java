/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle of a backup relationship. A relationship starts {@link #PENDING} and only ever moves forward; nothing
 * returns to {@code PENDING}.
 */
public enum RelationshipStatus {
  @JsonProperty("pending")
  PENDING,

  @JsonProperty("active")
  ACTIVE,

  @JsonProperty("declined")
  DECLINED,

  @JsonProperty("terminated")
  TERMINATED;

  public boolean canTransitionTo(final RelationshipStatus next) {
    return switch (this) {
      case PENDING -> next == ACTIVE || next == DECLINED || next == TERMINATED;
      case ACTIVE -> next == TERMINATED;
      case DECLINED, TERMINATED -> false;
    };
  }

  public boolean isFinal() {
    return this == DECLINED || this == TERMINATED;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<RelationshipStatus> fromWireName(final String name) {
    return Arrays.stream(values())
        .filter(status -> status.wireName().equalsIgnoreCase(name))
        .findFirst();
  }
}
