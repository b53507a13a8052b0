/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.protocol;

import static org.whispersystems.peerbackup.metrics.MetricsUtil.name;

import io.micrometer.core.instrument.Metrics;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.peerbackup.transport.PeerTransport;

/**
 * Encodes control messages and hands them to the peer transport.
 */
public class ControlMessageSender {

  private static final String SENT_COUNTER_NAME = name(ControlMessageSender.class, "sent");
  private static final String TYPE_TAG_NAME = "type";
  private static final String SUCCESS_TAG_NAME = "success";

  private static final Logger log = LoggerFactory.getLogger(ControlMessageSender.class);

  private final PeerTransport transport;

  public ControlMessageSender(final PeerTransport transport) {
    this.transport = transport;
  }

  /**
   * Send a control message to a peer. The returned future fails if the transport rejects the message.
   */
  public CompletableFuture<Void> send(final String targetCallsign, final ControlMessage message) {
    final CompletableFuture<Void> sendFuture;
    try {
      sendFuture = transport.send(targetCallsign, ControlMessageCodec.encode(message));
    } catch (final RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }

    return sendFuture.whenComplete((ignored, throwable) -> {
      Metrics.counter(SENT_COUNTER_NAME,
              TYPE_TAG_NAME, message.messageType().wireName(),
              SUCCESS_TAG_NAME, String.valueOf(throwable == null))
          .increment();

      if (throwable != null) {
        log.debug("Failed to send {} to {}", message.messageType().wireName(), targetCallsign, throwable);
      }
    });
  }
}
