/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.backup;

public class DownloadFailedException extends BackupException {

  public DownloadFailedException(final String message) {
    super(FailureReason.DOWNLOAD_FAILED, message);
  }

  public DownloadFailedException(final String message, final Throwable cause) {
    super(FailureReason.DOWNLOAD_FAILED, message, cause);
  }

  protected DownloadFailedException(final FailureReason reason, final String message, final Throwable cause) {
    super(reason, message, cause);
  }
}
