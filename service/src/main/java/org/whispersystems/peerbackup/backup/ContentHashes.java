/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.backup;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import javax.annotation.Nullable;

public final class ContentHashes {

  private ContentHashes() {
  }

  /**
   * @return the lowercase hex SHA-256 digest of the given bytes
   */
  public static String sha256(final byte[] content) {
    try {
      return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
    } catch (final NoSuchAlgorithmException e) {
      throw new AssertionError("Every implementation of the Java platform is required to support SHA-256", e);
    }
  }

  public static boolean matches(final byte[] content, @Nullable final String expectedHash) {
    if (expectedHash == null) {
      return false;
    }

    final byte[] expected;
    try {
      expected = HexFormat.of().parseHex(expectedHash);
    } catch (final IllegalArgumentException e) {
      return false;
    }

    return MessageDigest.isEqual(HexFormat.of().parseHex(sha256(content)), expected);
  }
}
