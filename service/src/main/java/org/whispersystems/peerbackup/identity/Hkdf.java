/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.identity;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HKDF-SHA256 (RFC 5869).
 */
final class Hkdf {

  private static final String HMAC_SHA_256 = "HmacSHA256";
  private static final int HASH_LENGTH = 32;

  private Hkdf() {
  }

  static byte[] deriveSecrets(final byte[] inputKeyMaterial, final byte[] salt, final String info, final int length) {
    if (length > 255 * HASH_LENGTH) {
      throw new IllegalArgumentException("Requested output is too long");
    }

    final byte[] pseudoRandomKey = hmac(salt.length == 0 ? new byte[HASH_LENGTH] : salt, inputKeyMaterial);
    final byte[] infoBytes = info.getBytes(StandardCharsets.UTF_8);

    final byte[] output = new byte[length];
    byte[] block = new byte[0];
    int offset = 0;

    for (int counter = 1; offset < length; counter++) {
      final Mac mac = initializeMac(pseudoRandomKey);
      mac.update(block);
      mac.update(infoBytes);
      mac.update((byte) counter);
      block = mac.doFinal();

      final int toCopy = Math.min(block.length, length - offset);
      System.arraycopy(block, 0, output, offset, toCopy);
      offset += toCopy;
    }

    return output;
  }

  private static byte[] hmac(final byte[] key, final byte[] input) {
    return initializeMac(key).doFinal(input);
  }

  private static Mac initializeMac(final byte[] key) {
    try {
      final Mac mac = Mac.getInstance(HMAC_SHA_256);
      mac.init(new SecretKeySpec(key, HMAC_SHA_256));
      return mac;
    } catch (final NoSuchAlgorithmException e) {
      throw new AssertionError(e);
    } catch (final InvalidKeyException e) {
      throw new IllegalArgumentException(e);
    }
  }
}
