/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.transport;

import java.util.List;

/**
 * Enumerates the peers this device knows about.
 */
public interface PeerDirectory {

  /**
   * @return the peers currently believed to be reachable
   */
  List<KnownPeer> onlinePeers();

  /**
   * @return {@code true} if the user has saved the given callsign as a contact
   */
  boolean isContact(String callsign);
}
