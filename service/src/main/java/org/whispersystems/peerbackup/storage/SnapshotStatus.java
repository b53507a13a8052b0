/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Locale;

public enum SnapshotStatus {
  @JsonProperty("in_progress")
  IN_PROGRESS,

  @JsonProperty("complete")
  COMPLETE,

  @JsonProperty("failed")
  FAILED;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
