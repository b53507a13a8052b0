/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.identity;

import java.security.GeneralSecurityException;
import java.security.Signature;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies events signed by an {@link EcIdentity}.
 */
public class EcEventVerifier implements EventVerifier {

  private static final Logger log = LoggerFactory.getLogger(EcEventVerifier.class);

  @Override
  public boolean verify(final SignedEvent event) {
    if (event.id() == null || event.publicKey() == null || event.signature() == null || event.content() == null) {
      return false;
    }

    final String expectedId = SignedEvent.computeId(event.publicKey(), event.createdAt(), event.kind(), event.tags(),
        event.content());

    if (!expectedId.equals(event.id())) {
      return false;
    }

    try {
      final Signature signature = Signature.getInstance(EcKeys.SIGNATURE_ALGORITHM);
      signature.initVerify(EcKeys.decodePublicKey(event.publicKey()));
      signature.update(HexFormat.of().parseHex(event.id()));
      return signature.verify(HexFormat.of().parseHex(event.signature()));
    } catch (final GeneralSecurityException | IllegalArgumentException e) {
      log.debug("Could not verify event {}", event.id(), e);
      return false;
    }
  }
}
