/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.identity;

import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.List;

/**
 * The local device's cryptographic identity: the key pair that signs outbound events and decrypts data that was
 * encrypted for it.
 */
public interface Identity {

  /**
   * @return the callsign under which this device is reachable on the peer network
   */
  String callsign();

  /**
   * @return the encoded public key that other peers use to verify this identity's events and encrypt data for it
   */
  String publicKey();

  /**
   * Create a signed event authored by this identity.
   */
  SignedEvent sign(int kind, List<List<String>> tags, String content, Instant createdAt);

  /**
   * Encrypt a payload so that only the holder of the private key matching {@code recipientPublicKey} can read it.
   */
  byte[] encrypt(byte[] plaintext, String recipientPublicKey) throws GeneralSecurityException;

  /**
   * Decrypt a payload produced by {@link #encrypt} for this identity's public key.
   */
  byte[] decrypt(byte[] ciphertext) throws GeneralSecurityException;

  /**
   * Encrypt a manifest with a key derived from this identity's private key, so that only this identity can read it
   * later.
   */
  byte[] encryptManifest(String manifest) throws GeneralSecurityException;

  String decryptManifest(byte[] encryptedManifest) throws GeneralSecurityException;
}
