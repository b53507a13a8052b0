/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.whispersystems.peerbackup.discovery.DiscoveryCoordinator;
import org.whispersystems.peerbackup.discovery.DiscoveryResponder;
import org.whispersystems.peerbackup.identity.EcIdentity;
import org.whispersystems.peerbackup.identity.SignedEvent;
import org.whispersystems.peerbackup.relationship.RelationshipManager;
import org.whispersystems.peerbackup.storage.ClientRelationship;
import org.whispersystems.peerbackup.storage.RelationshipStatus;
import org.whispersystems.peerbackup.storage.RelationshipStore;
import org.whispersystems.peerbackup.storage.Snapshot;
import org.whispersystems.peerbackup.storage.SnapshotStatus;
import org.whispersystems.peerbackup.storage.SnapshotStore;
import org.whispersystems.peerbackup.util.SystemMapper;
import org.whispersystems.peerbackup.util.TestClock;

class ProtocolRouterTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private SignedEventValidator eventValidator;
  private RelationshipManager relationshipManager;
  private RelationshipStore relationshipStore;
  private SnapshotStore snapshotStore;
  private DiscoveryCoordinator discoveryCoordinator;
  private DiscoveryResponder discoveryResponder;

  private ProtocolRouter protocolRouter;

  @BeforeEach
  void setUp() {
    eventValidator = mock(SignedEventValidator.class);
    relationshipManager = mock(RelationshipManager.class);
    relationshipStore = mock(RelationshipStore.class);
    snapshotStore = mock(SnapshotStore.class);
    discoveryCoordinator = mock(DiscoveryCoordinator.class);
    discoveryResponder = mock(DiscoveryResponder.class);

    protocolRouter = new ProtocolRouter(eventValidator, relationshipManager, relationshipStore, snapshotStore,
        discoveryCoordinator, discoveryResponder, TestClock.pinned(NOW));
  }

  @Test
  void validInviteIsDispatched() {
    final SignedEvent event = signedEvent();
    when(eventValidator.validate(event)).thenReturn(SignedEventValidator.Result.VALID);

    protocolRouter.onMessage("ALFA", ControlMessageCodec.encode(new ControlMessage.BackupInvite(event)));

    verify(relationshipManager).handleInvite("ALFA", event);
  }

  @Test
  void invalidSignedMessagesAreDropped() {
    final SignedEvent event = signedEvent();
    when(eventValidator.validate(event)).thenReturn(SignedEventValidator.Result.STALE);

    protocolRouter.onMessage("ALFA", ControlMessageCodec.encode(new ControlMessage.BackupInvite(event)));
    protocolRouter.onMessage("ALFA",
        ControlMessageCodec.encode(new ControlMessage.DiscoveryChallenge(event, "discovery")));

    verifyNoInteractions(relationshipManager, discoveryResponder);
  }

  @Test
  void malformedMessagesAreDropped() {
    protocolRouter.onMessage("ALFA", "{\"type\":\"backup_invite\"");
    protocolRouter.onMessage("ALFA", "{\"type\":\"backup_unknown\"}");
    protocolRouter.onMessage("ALFA", "null");
    protocolRouter.onMessage("ALFA", "{\"type\":\"backup_start\"}");
    protocolRouter.onMessage("ALFA", "{\"type\":\"backup_status_change\",\"status\":\"\"}");
    protocolRouter.onMessage("../ALFA", ControlMessageCodec.encode(new ControlMessage.StatusChange("terminated")));

    verifyNoInteractions(eventValidator, relationshipManager, relationshipStore, snapshotStore, discoveryCoordinator,
        discoveryResponder);
  }

  @Test
  void discoveryResponseWithoutDiscoveryIdIsDropped() throws JsonProcessingException {
    final SignedEvent event = signedEvent();
    when(eventValidator.validate(event)).thenReturn(SignedEventValidator.Result.VALID);

    final ObjectNode response = (ObjectNode) SystemMapper.jsonMapper()
        .readTree(ControlMessageCodec.encode(ControlMessage.DiscoveryResponse.negative(event, "discovery")));
    response.remove("discovery_id");

    protocolRouter.onMessage("BASE1", SystemMapper.jsonMapper().writeValueAsString(response));

    verifyNoInteractions(eventValidator, discoveryCoordinator);
  }

  @Test
  void unsignedMessagesSkipValidation() {
    final ControlMessage.StatusChange statusChange = new ControlMessage.StatusChange("terminated");
    protocolRouter.onMessage("BASE1", ControlMessageCodec.encode(statusChange));

    final ControlMessage.BackupInviteResponse response =
        new ControlMessage.BackupInviteResponse(true, "npub-base1", 1_000, 5);
    protocolRouter.onMessage("BASE1", ControlMessageCodec.encode(response));

    verify(relationshipManager).handleStatusChange("BASE1", statusChange);
    verify(relationshipManager).handleInviteResponse("BASE1", response);
    verifyNoInteractions(eventValidator);
  }

  @Test
  void discoveryMessagesAreDispatched() {
    final SignedEvent event = signedEvent();
    when(eventValidator.validate(event)).thenReturn(SignedEventValidator.Result.VALID);

    final ControlMessage.DiscoveryChallenge challenge = new ControlMessage.DiscoveryChallenge(event, "discovery");
    final ControlMessage.DiscoveryResponse response = ControlMessage.DiscoveryResponse.negative(event, "discovery");

    protocolRouter.onMessage("ALFA", ControlMessageCodec.encode(challenge));
    protocolRouter.onMessage("BASE1", ControlMessageCodec.encode(response));

    verify(discoveryResponder).handleChallenge("ALFA", challenge);
    verify(discoveryCoordinator).handleResponse("BASE1", response);
  }

  @Test
  void backupStartFromActiveClient() throws IOException {
    when(relationshipStore.getClient("ALFA")).thenReturn(Optional.of(client(RelationshipStatus.ACTIVE)));

    protocolRouter.onMessage("ALFA", ControlMessageCodec.encode(new ControlMessage.BackupStart("2026-03-01")));

    verify(snapshotStore).updateSnapshotStatus("ALFA", Snapshot.started("2026-03-01", NOW));
  }

  @Test
  void backupNoticesFromInactiveClientsAreDropped() throws IOException {
    when(relationshipStore.getClient("ALFA")).thenReturn(Optional.of(client(RelationshipStatus.PENDING)));

    protocolRouter.onMessage("ALFA", ControlMessageCodec.encode(new ControlMessage.BackupStart("2026-03-01")));
    protocolRouter.onMessage("BRAVO", ControlMessageCodec.encode(new ControlMessage.BackupStart("2026-03-01")));
    protocolRouter.onMessage("ALFA",
        ControlMessageCodec.encode(new ControlMessage.BackupComplete("2026-03-01", 1, 1)));

    verify(snapshotStore, never()).updateSnapshotStatus(any(), any());
  }

  @Test
  void backupNoticesWithInvalidSnapshotIdsAreDropped() throws IOException {
    when(relationshipStore.getClient("ALFA")).thenReturn(Optional.of(client(RelationshipStatus.ACTIVE)));

    protocolRouter.onMessage("ALFA", ControlMessageCodec.encode(new ControlMessage.BackupStart("../../etc")));

    verify(snapshotStore, never()).updateSnapshotStatus(any(), any());
  }

  @Test
  void backupCompleteKeepsStartTime() throws IOException {
    final Instant startedAt = NOW.minusSeconds(120);

    when(relationshipStore.getClient("ALFA")).thenReturn(Optional.of(client(RelationshipStatus.ACTIVE)));
    when(snapshotStore.getSnapshot("ALFA", "2026-03-01"))
        .thenReturn(Optional.of(Snapshot.started("2026-03-01", startedAt)));

    protocolRouter.onMessage("ALFA",
        ControlMessageCodec.encode(new ControlMessage.BackupComplete("2026-03-01", 3, 35)));

    final ArgumentCaptor<Snapshot> snapshotCaptor = ArgumentCaptor.forClass(Snapshot.class);
    verify(snapshotStore).updateSnapshotStatus(eq("ALFA"), snapshotCaptor.capture());

    final Snapshot snapshot = snapshotCaptor.getValue();
    assertEquals(SnapshotStatus.COMPLETE, snapshot.status());
    assertEquals(startedAt, snapshot.startedAt());
    assertEquals(NOW, snapshot.completedAt());
    assertEquals(3, snapshot.totalFiles());
    assertEquals(35, snapshot.totalBytes());
  }

  @Test
  void backupCompleteWithoutStart() throws IOException {
    when(relationshipStore.getClient("ALFA")).thenReturn(Optional.of(client(RelationshipStatus.ACTIVE)));
    when(snapshotStore.getSnapshot("ALFA", "2026-03-01")).thenReturn(Optional.empty());

    protocolRouter.onMessage("ALFA",
        ControlMessageCodec.encode(new ControlMessage.BackupComplete("2026-03-01", 0, 0)));

    verify(snapshotStore).updateSnapshotStatus(eq("ALFA"),
        argThat(snapshot -> snapshot.status() == SnapshotStatus.COMPLETE && NOW.equals(snapshot.startedAt())));
  }

  private static SignedEvent signedEvent() {
    return EcIdentity.generate("ALFA").sign(SignedEvent.TEXT_NOTE_KIND, List.of(List.of("action", "test")), "test",
        NOW);
  }

  private static ClientRelationship client(final RelationshipStatus status) {
    return ClientRelationship.pending("npub-alfa", "ALFA", 1_000, 5, NOW).withStatus(status);
  }
}
