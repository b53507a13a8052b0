/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.backup;

import javax.annotation.Nullable;

public class ManifestDownloadFailedException extends DownloadFailedException {

  public ManifestDownloadFailedException(final String message, @Nullable final Throwable cause) {
    super(FailureReason.MANIFEST_DOWNLOAD_FAILED, message, cause);
  }
}
