/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.transport;

import java.util.concurrent.CompletableFuture;
import javax.annotation.Nullable;

/**
 * The peer-messaging fabric over which backup control messages and transfers travel. Implementations are responsible
 * for addressing, framing and any per-call timeouts.
 */
public interface PeerTransport {

  /**
   * Deliver a JSON control message to the peer reachable under {@code targetCallsign}. The returned future completes
   * when the transport has accepted the message; delivery is not acknowledged by the peer.
   */
  CompletableFuture<Void> send(String targetCallsign, String json);

  /**
   * Perform a request/response call against the peer's backup storage endpoint.
   *
   * @param callsign the peer to call
   * @param method   {@code GET} or {@code PUT}
   * @param path     the logical path of the object
   * @param body     the request body, if any
   *
   * @return a future that yields the peer's response, or fails if the peer could not be reached
   */
  CompletableFuture<PeerResponse> request(String callsign, String method, String path, @Nullable String body);
}
