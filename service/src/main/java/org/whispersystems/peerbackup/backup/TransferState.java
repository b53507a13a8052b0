/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.backup;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TransferState {
  @JsonProperty("idle")
  IDLE,

  @JsonProperty("in_progress")
  IN_PROGRESS,

  @JsonProperty("complete")
  COMPLETE,

  @JsonProperty("failed")
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETE || this == FAILED;
  }
}
