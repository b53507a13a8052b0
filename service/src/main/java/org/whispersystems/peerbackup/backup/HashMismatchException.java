/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.backup;

public class HashMismatchException extends BackupException {

  private final String relativePath;

  public HashMismatchException(final String relativePath) {
    super(FailureReason.HASH_MISMATCH, "Hash mismatch for file: " + relativePath);
    this.relativePath = relativePath;
  }

  /**
   * A blob that no longer decrypts was altered after upload, which is reported the same way as a hash mismatch.
   */
  public HashMismatchException(final String relativePath, final Throwable cause) {
    super(FailureReason.HASH_MISMATCH, "Hash mismatch for file: " + relativePath, cause);
    this.relativePath = relativePath;
  }

  public String getRelativePath() {
    return relativePath;
  }
}
