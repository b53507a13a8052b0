/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.identity;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.InvalidAlgorithmParameterException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.KeyAgreement;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.apache.commons.lang3.StringUtils;

/**
 * An {@link Identity} backed by a P-256 key pair.
 * <p>
 * Payload encryption is ECIES: an ephemeral key pair is agreed with the recipient's public key via ECDH, the shared
 * secret is expanded with HKDF-SHA256, and the payload is sealed with AES-256-GCM. The output is
 * {@code ephemeral key length (2) || ephemeral public key || nonce (12) || ciphertext || tag (16)}.
 * <p>
 * Manifests are sealed with AES-256-GCM under a key derived from the private key, as
 * {@code nonce (12) || ciphertext || tag (16)}.
 */
public class EcIdentity implements Identity {

  private static final String CIPHER_ALGORITHM = "AES/GCM/NoPadding";
  private static final int NONCE_LENGTH = 12;
  private static final int TAG_LENGTH_BITS = 128;
  private static final int KEY_LENGTH = 32;

  private static final String FILE_KEY_INFO = "peer-backup-file";
  private static final String MANIFEST_KEY_INFO = "peer-backup-manifest";

  private final String callsign;
  private final KeyPair keyPair;
  private final String encodedPublicKey;
  private final SecureRandom secureRandom = new SecureRandom();

  public EcIdentity(final String callsign, final KeyPair keyPair) {
    if (StringUtils.isBlank(callsign)) {
      throw new IllegalArgumentException("Callsign must not be blank");
    }
    this.callsign = callsign.toUpperCase(Locale.ROOT);
    this.keyPair = keyPair;
    this.encodedPublicKey = EcKeys.encodePublicKey(keyPair.getPublic());
  }

  public static EcIdentity generate(final String callsign) {
    return new EcIdentity(callsign, generateKeyPair());
  }

  static KeyPair generateKeyPair() {
    try {
      final KeyPairGenerator generator = KeyPairGenerator.getInstance(EcKeys.KEY_ALGORITHM);
      generator.initialize(new ECGenParameterSpec(EcKeys.CURVE));
      return generator.generateKeyPair();
    } catch (final NoSuchAlgorithmException | InvalidAlgorithmParameterException e) {
      throw new AssertionError("P-256 is required by every Java platform", e);
    }
  }

  @Override
  public String callsign() {
    return callsign;
  }

  @Override
  public String publicKey() {
    return encodedPublicKey;
  }

  @Override
  public SignedEvent sign(final int kind, final List<List<String>> tags, final String content,
      final Instant createdAt) {

    final long createdAtSeconds = createdAt.getEpochSecond();
    final String id = SignedEvent.computeId(encodedPublicKey, createdAtSeconds, kind, tags, content);

    try {
      final Signature signature = Signature.getInstance(EcKeys.SIGNATURE_ALGORITHM);
      signature.initSign(keyPair.getPrivate());
      signature.update(HexFormat.of().parseHex(id));

      return new SignedEvent(id, encodedPublicKey, createdAtSeconds, kind, tags, content,
          HexFormat.of().formatHex(signature.sign()));
    } catch (final GeneralSecurityException e) {
      throw new IllegalStateException("Failed to sign event", e);
    }
  }

  @Override
  public byte[] encrypt(final byte[] plaintext, final String recipientPublicKey) throws GeneralSecurityException {
    final PublicKey recipient = EcKeys.decodePublicKey(recipientPublicKey);
    final KeyPair ephemeral = generateKeyPair();
    final byte[] ephemeralPublicKey = ephemeral.getPublic().getEncoded();

    final byte[] key = Hkdf.deriveSecrets(agree(ephemeral.getPrivate(), recipient), ephemeralPublicKey,
        FILE_KEY_INFO, KEY_LENGTH);

    final byte[] nonce = randomNonce();
    final byte[] ciphertext = seal(key, nonce, plaintext);

    return ByteBuffer.allocate(Short.BYTES + ephemeralPublicKey.length + nonce.length + ciphertext.length)
        .putShort((short) ephemeralPublicKey.length)
        .put(ephemeralPublicKey)
        .put(nonce)
        .put(ciphertext)
        .array();
  }

  @Override
  public byte[] decrypt(final byte[] ciphertext) throws GeneralSecurityException {
    final ByteBuffer buffer = ByteBuffer.wrap(ciphertext);
    if (buffer.remaining() < Short.BYTES) {
      throw new AEADBadTagException("Ciphertext is too short");
    }

    final int ephemeralKeyLength = Short.toUnsignedInt(buffer.getShort());
    if (buffer.remaining() < ephemeralKeyLength + NONCE_LENGTH + TAG_LENGTH_BITS / 8) {
      throw new AEADBadTagException("Ciphertext is too short");
    }

    final byte[] ephemeralPublicKey = new byte[ephemeralKeyLength];
    buffer.get(ephemeralPublicKey);

    final byte[] nonce = new byte[NONCE_LENGTH];
    buffer.get(nonce);

    final byte[] sealed = new byte[buffer.remaining()];
    buffer.get(sealed);

    final byte[] key = Hkdf.deriveSecrets(agree(keyPair.getPrivate(), EcKeys.decodePublicKey(ephemeralPublicKey)),
        ephemeralPublicKey, FILE_KEY_INFO, KEY_LENGTH);

    return open(key, nonce, sealed);
  }

  @Override
  public byte[] encryptManifest(final String manifest) throws GeneralSecurityException {
    final byte[] nonce = randomNonce();
    final byte[] ciphertext = seal(manifestKey(), nonce, manifest.getBytes(StandardCharsets.UTF_8));

    return ByteBuffer.allocate(nonce.length + ciphertext.length)
        .put(nonce)
        .put(ciphertext)
        .array();
  }

  @Override
  public String decryptManifest(final byte[] encryptedManifest) throws GeneralSecurityException {
    if (encryptedManifest.length < NONCE_LENGTH + TAG_LENGTH_BITS / 8) {
      throw new AEADBadTagException("Encrypted manifest is too short");
    }

    final ByteBuffer buffer = ByteBuffer.wrap(encryptedManifest);
    final byte[] nonce = new byte[NONCE_LENGTH];
    buffer.get(nonce);

    final byte[] sealed = new byte[buffer.remaining()];
    buffer.get(sealed);

    return new String(open(manifestKey(), nonce, sealed), StandardCharsets.UTF_8);
  }

  private byte[] manifestKey() {
    return Hkdf.deriveSecrets(keyPair.getPrivate().getEncoded(), keyPair.getPublic().getEncoded(),
        MANIFEST_KEY_INFO, KEY_LENGTH);
  }

  private static byte[] agree(final PrivateKey privateKey, final PublicKey publicKey) throws GeneralSecurityException {
    final KeyAgreement keyAgreement = KeyAgreement.getInstance("ECDH");
    keyAgreement.init(privateKey);
    keyAgreement.doPhase(publicKey, true);
    return keyAgreement.generateSecret();
  }

  private byte[] randomNonce() {
    final byte[] nonce = new byte[NONCE_LENGTH];
    secureRandom.nextBytes(nonce);
    return nonce;
  }

  private static byte[] seal(final byte[] key, final byte[] nonce, final byte[] plaintext)
      throws GeneralSecurityException {

    final Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
    cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
    return cipher.doFinal(plaintext);
  }

  private static byte[] open(final byte[] key, final byte[] nonce, final byte[] sealed)
      throws GeneralSecurityException {

    final Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
    cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
    return cipher.doFinal(sealed);
  }
}
