/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.discovery;

import static org.whispersystems.peerbackup.protocol.EventTags.tag;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.peerbackup.identity.Identity;
import org.whispersystems.peerbackup.identity.IdentityProvider;
import org.whispersystems.peerbackup.identity.SignedEvent;
import org.whispersystems.peerbackup.protocol.ControlMessage.DiscoveryChallenge;
import org.whispersystems.peerbackup.protocol.ControlMessage.DiscoveryResponse;
import org.whispersystems.peerbackup.protocol.ControlMessageSender;
import org.whispersystems.peerbackup.protocol.EventTags;
import org.whispersystems.peerbackup.storage.ClientRelationship;
import org.whispersystems.peerbackup.storage.RelationshipStore;
import org.whispersystems.peerbackup.storage.Snapshot;
import org.whispersystems.peerbackup.storage.SnapshotStatus;
import org.whispersystems.peerbackup.storage.SnapshotStore;

/**
 * Answers discovery challenges. Every well-formed challenge gets a signed response of the same shape; storage details
 * are added only when this device holds an active relationship for the identity that signed the challenge.
 */
public class DiscoveryResponder {

  private static final String RESPONSE_CONTENT = "Backup discovery response";

  private static final Logger log = LoggerFactory.getLogger(DiscoveryResponder.class);

  private final IdentityProvider identityProvider;
  private final RelationshipStore relationshipStore;
  private final SnapshotStore snapshotStore;
  private final ControlMessageSender messageSender;
  private final Clock clock;

  public DiscoveryResponder(final IdentityProvider identityProvider,
      final RelationshipStore relationshipStore,
      final SnapshotStore snapshotStore,
      final ControlMessageSender messageSender,
      final Clock clock) {

    this.identityProvider = identityProvider;
    this.relationshipStore = relationshipStore;
    this.snapshotStore = snapshotStore;
    this.messageSender = messageSender;
    this.clock = clock;
  }

  /**
   * Answers a challenge whose signature and freshness were already checked.
   */
  public void handleChallenge(final String senderCallsign, final DiscoveryChallenge challenge) {
    final Optional<Identity> maybeIdentity = identityProvider.currentIdentity();
    if (maybeIdentity.isEmpty()) {
      log.debug("Cannot answer discovery challenge from {}; no identity available", senderCallsign);
      return;
    }

    final SignedEvent challengeEvent = challenge.event();
    final Optional<String> maybeChallenge = challengeEvent.tagValue(EventTags.CHALLENGE);
    final Optional<String> maybeTarget = challengeEvent.tagValue(EventTags.TARGET);

    if (maybeChallenge.isEmpty() || maybeTarget.isEmpty()) {
      log.debug("Ignoring malformed discovery challenge from {}", senderCallsign);
      return;
    }

    // Only the identity being looked up may learn where its backups are
    final Optional<ClientRelationship> maybeClient = maybeTarget.get().equals(challengeEvent.publicKey())
        ? relationshipStore.findActiveClientByPublicKey(maybeTarget.get())
        : Optional.empty();

    final boolean hasBackups = maybeClient.isPresent();

    final SignedEvent responseEvent = maybeIdentity.get().sign(SignedEvent.TEXT_NOTE_KIND, List.of(
            tag(EventTags.ACTION, EventTags.DISCOVERY_RESPONSE_ACTION),
            tag(EventTags.CHALLENGE, maybeChallenge.get()),
            tag(EventTags.HAS_BACKUPS, String.valueOf(hasBackups))),
        RESPONSE_CONTENT, clock.instant());

    final DiscoveryResponse response = maybeClient
        .map(client -> positiveResponse(responseEvent, challenge.discoveryId(), client))
        .orElseGet(() -> DiscoveryResponse.negative(responseEvent, challenge.discoveryId()));

    messageSender.send(senderCallsign, response);
  }

  private DiscoveryResponse positiveResponse(final SignedEvent event, final String discoveryId,
      final ClientRelationship client) {

    List<Snapshot> snapshots;
    try {
      snapshots = snapshotStore.getSnapshots(client.clientCallsign());
    } catch (final IOException e) {
      log.warn("Could not list snapshots of {} for discovery", client.clientCallsign(), e);
      snapshots = List.of();
    }

    final String latestSnapshotId = snapshots.stream()
        .filter(snapshot -> snapshot.status() == SnapshotStatus.COMPLETE)
        .map(Snapshot::snapshotId)
        .findFirst()
        .orElse(null);

    return new DiscoveryResponse(event, discoveryId, true, client.maxStorageBytes(),
        snapshots.isEmpty() ? client.snapshotCount() : snapshots.size(), latestSnapshotId);
  }
}
