/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.identity;

import java.util.Optional;

/**
 * Supplies the local identity. The identity may be absent, for example before keys have been generated or while a
 * profile is locked.
 */
@FunctionalInterface
public interface IdentityProvider {

  Optional<Identity> currentIdentity();

  default Identity requireIdentity() throws IdentityUnavailableException {
    return currentIdentity().orElseThrow(IdentityUnavailableException::new);
  }
}
