/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.backup;

/**
 * A failure that aborts a backup or restore. The reason is surfaced on the transfer's status.
 */
public class BackupException extends Exception {

  private final FailureReason reason;

  public BackupException(final FailureReason reason, final String message) {
    super(message);
    this.reason = reason;
  }

  public BackupException(final FailureReason reason, final String message, final Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public FailureReason getReason() {
    return reason;
  }
}
