/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.identity;

@FunctionalInterface
public interface EventVerifier {

  /**
   * @return {@code true} if the event's id matches its contents and its signature verifies against its embedded
   * public key
   */
  boolean verify(SignedEvent event);
}
