/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.identity;

import org.whispersystems.peerbackup.backup.BackupException;
import org.whispersystems.peerbackup.backup.FailureReason;

public class IdentityUnavailableException extends BackupException {

  public IdentityUnavailableException() {
    super(FailureReason.IDENTITY_UNAVAILABLE, "Identity not available");
  }
}
