/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.identity;

import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.X509EncodedKeySpec;
import java.util.HexFormat;

/**
 * Encoding of P-256 public keys as they appear on the wire: hex-encoded X.509 SubjectPublicKeyInfo.
 */
final class EcKeys {

  static final String KEY_ALGORITHM = "EC";
  static final String CURVE = "secp256r1";
  static final String SIGNATURE_ALGORITHM = "SHA256withECDSA";

  private EcKeys() {
  }

  static String encodePublicKey(final PublicKey publicKey) {
    return HexFormat.of().formatHex(publicKey.getEncoded());
  }

  static PublicKey decodePublicKey(final String encoded) throws InvalidKeySpecException {
    final byte[] keyBytes;
    try {
      keyBytes = HexFormat.of().parseHex(encoded);
    } catch (final IllegalArgumentException e) {
      throw new InvalidKeySpecException("Public key is not valid hex", e);
    }

    return decodePublicKey(keyBytes);
  }

  static PublicKey decodePublicKey(final byte[] encoded) throws InvalidKeySpecException {
    try {
      return KeyFactory.getInstance(KEY_ALGORITHM).generatePublic(new X509EncodedKeySpec(encoded));
    } catch (final NoSuchAlgorithmException e) {
      throw new AssertionError(e);
    }
  }
}
