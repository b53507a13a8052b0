/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.backup;

public class UploadFailedException extends BackupException {

  public UploadFailedException(final String message) {
    super(FailureReason.UPLOAD_FAILED, message);
  }

  public UploadFailedException(final String message, final Throwable cause) {
    super(FailureReason.UPLOAD_FAILED, message, cause);
  }
}
