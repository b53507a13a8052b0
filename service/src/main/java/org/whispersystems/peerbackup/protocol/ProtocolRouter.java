/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.protocol;

import static org.whispersystems.peerbackup.metrics.MetricsUtil.name;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.micrometer.core.instrument.Metrics;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.peerbackup.backup.BackupPaths;
import org.whispersystems.peerbackup.discovery.DiscoveryCoordinator;
import org.whispersystems.peerbackup.discovery.DiscoveryResponder;
import org.whispersystems.peerbackup.protocol.ControlMessage.BackupComplete;
import org.whispersystems.peerbackup.protocol.ControlMessage.BackupInvite;
import org.whispersystems.peerbackup.protocol.ControlMessage.BackupInviteResponse;
import org.whispersystems.peerbackup.protocol.ControlMessage.BackupStart;
import org.whispersystems.peerbackup.protocol.ControlMessage.DiscoveryChallenge;
import org.whispersystems.peerbackup.protocol.ControlMessage.DiscoveryResponse;
import org.whispersystems.peerbackup.protocol.ControlMessage.StatusChange;
import org.whispersystems.peerbackup.relationship.RelationshipManager;
import org.whispersystems.peerbackup.storage.RelationshipStatus;
import org.whispersystems.peerbackup.storage.RelationshipStore;
import org.whispersystems.peerbackup.storage.Snapshot;
import org.whispersystems.peerbackup.storage.SnapshotStatus;
import org.whispersystems.peerbackup.storage.SnapshotStore;

/**
 * Entry point for every backup control message delivered by the peer transport.
 * <p>
 * Messages that carry a signed event are dropped unless the signature verifies and the event is fresh. Dropped and
 * malformed messages are logged and counted but never reported to the sender.
 */
public class ProtocolRouter {

  private static final String DROPPED_COUNTER_NAME = name(ProtocolRouter.class, "dropped");
  private static final String RECEIVED_COUNTER_NAME = name(ProtocolRouter.class, "received");
  private static final String REASON_TAG_NAME = "reason";
  private static final String TYPE_TAG_NAME = "type";

  private static final Logger log = LoggerFactory.getLogger(ProtocolRouter.class);

  private final SignedEventValidator eventValidator;
  private final RelationshipManager relationshipManager;
  private final RelationshipStore relationshipStore;
  private final SnapshotStore snapshotStore;
  private final DiscoveryCoordinator discoveryCoordinator;
  private final DiscoveryResponder discoveryResponder;
  private final Clock clock;

  public ProtocolRouter(final SignedEventValidator eventValidator,
      final RelationshipManager relationshipManager,
      final RelationshipStore relationshipStore,
      final SnapshotStore snapshotStore,
      final DiscoveryCoordinator discoveryCoordinator,
      final DiscoveryResponder discoveryResponder,
      final Clock clock) {

    this.eventValidator = eventValidator;
    this.relationshipManager = relationshipManager;
    this.relationshipStore = relationshipStore;
    this.snapshotStore = snapshotStore;
    this.discoveryCoordinator = discoveryCoordinator;
    this.discoveryResponder = discoveryResponder;
    this.clock = clock;
  }

  /**
   * Handle a control message.
   *
   * @param senderCallsign the callsign of the peer that delivered the message, as reported by the transport
   * @param json           the message
   */
  public void onMessage(final String senderCallsign, final String json) {
    final ControlMessage message;
    try {
      message = ControlMessageCodec.decode(json);
    } catch (final JsonProcessingException e) {
      log.debug("Dropping malformed message from {}", senderCallsign, e);
      countDropped("malformed");
      return;
    }

    if (!BackupPaths.isValidCallsign(BackupPaths.normalizeCallsign(senderCallsign))) {
      log.debug("Dropping {} from invalid callsign {}", message.messageType().wireName(), senderCallsign);
      countDropped("invalid_sender");
      return;
    }

    if (message instanceof ControlMessage.Signed signed) {
      final SignedEventValidator.Result result = eventValidator.validate(signed.event());

      if (result != SignedEventValidator.Result.VALID) {
        log.warn("Dropping {} from {}: {}", message.messageType().wireName(), senderCallsign, result);
        countDropped(result.name().toLowerCase(Locale.ROOT));
        return;
      }
    }

    Metrics.counter(RECEIVED_COUNTER_NAME, TYPE_TAG_NAME, message.messageType().wireName()).increment();

    switch (message.messageType()) {
      case BACKUP_INVITE -> relationshipManager.handleInvite(senderCallsign, ((BackupInvite) message).event());
      case BACKUP_INVITE_RESPONSE ->
          relationshipManager.handleInviteResponse(senderCallsign, (BackupInviteResponse) message);
      case BACKUP_START -> handleBackupStart(senderCallsign, (BackupStart) message);
      case BACKUP_COMPLETE -> handleBackupComplete(senderCallsign, (BackupComplete) message);
      case DISCOVERY_CHALLENGE -> discoveryResponder.handleChallenge(senderCallsign, (DiscoveryChallenge) message);
      case DISCOVERY_RESPONSE -> discoveryCoordinator.handleResponse(senderCallsign, (DiscoveryResponse) message);
      case STATUS_CHANGE -> relationshipManager.handleStatusChange(senderCallsign, (StatusChange) message);
    }
  }

  private void handleBackupStart(final String clientCallsign, final BackupStart backupStart) {
    if (!isActiveClientSnapshot(clientCallsign, backupStart.snapshotId())) {
      return;
    }

    log.info("{} started snapshot {}", clientCallsign, backupStart.snapshotId());
    updateSnapshot(clientCallsign, Snapshot.started(backupStart.snapshotId(), clock.instant()));
  }

  private void handleBackupComplete(final String clientCallsign, final BackupComplete backupComplete) {
    if (!isActiveClientSnapshot(clientCallsign, backupComplete.snapshotId())) {
      return;
    }

    final Instant now = clock.instant();

    try {
      final Snapshot started = snapshotStore.getSnapshot(clientCallsign, backupComplete.snapshotId())
          .filter(snapshot -> snapshot.status() == SnapshotStatus.IN_PROGRESS)
          .orElseGet(() -> Snapshot.started(backupComplete.snapshotId(), now));

      log.info("{} completed snapshot {} with {} files", clientCallsign, backupComplete.snapshotId(),
          backupComplete.totalFiles());

      snapshotStore.updateSnapshotStatus(clientCallsign,
          started.completed(backupComplete.totalFiles(), backupComplete.totalBytes(), now));
    } catch (final IOException e) {
      log.warn("Failed to record completion of snapshot {} for {}", backupComplete.snapshotId(), clientCallsign, e);
    }
  }

  private boolean isActiveClientSnapshot(final String clientCallsign, final String snapshotId) {
    if (!BackupPaths.isValidSnapshotId(snapshotId)) {
      log.debug("Dropping snapshot notice from {} with invalid id {}", clientCallsign, snapshotId);
      countDropped("invalid_snapshot");
      return false;
    }

    if (relationshipStore.getClient(clientCallsign)
        .map(client -> client.status() != RelationshipStatus.ACTIVE)
        .orElse(true)) {

      log.debug("Dropping snapshot notice from {}, which is not an active client", clientCallsign);
      countDropped("inactive_client");
      return false;
    }

    return true;
  }

  private void updateSnapshot(final String clientCallsign, final Snapshot snapshot) {
    try {
      snapshotStore.updateSnapshotStatus(clientCallsign, snapshot);
    } catch (final IOException e) {
      log.warn("Failed to record snapshot {} for {}", snapshot.snapshotId(), clientCallsign, e);
    }
  }

  private static void countDropped(final String reason) {
    Metrics.counter(DROPPED_COUNTER_NAME, REASON_TAG_NAME, reason).increment();
  }
}
