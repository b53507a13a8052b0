/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.relationship;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.whispersystems.peerbackup.identity.EcIdentity;
import org.whispersystems.peerbackup.identity.SignedEvent;
import org.whispersystems.peerbackup.protocol.ControlMessage;
import org.whispersystems.peerbackup.protocol.ControlMessage.BackupInviteResponse;
import org.whispersystems.peerbackup.protocol.ControlMessage.StatusChange;
import org.whispersystems.peerbackup.protocol.ControlMessageSender;
import org.whispersystems.peerbackup.storage.ClientRelationship;
import org.whispersystems.peerbackup.storage.ProviderRelationship;
import org.whispersystems.peerbackup.storage.ProviderSettings;
import org.whispersystems.peerbackup.storage.RelationshipStatus;
import org.whispersystems.peerbackup.storage.RelationshipStore;
import org.whispersystems.peerbackup.transport.PeerDirectory;
import org.whispersystems.peerbackup.util.TestClock;

class RelationshipManagerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private static final long DEFAULT_CLIENT_STORAGE = 500_000;
  private static final int DEFAULT_SNAPSHOTS = 4;

  @TempDir
  Path dataDirectory;

  private EcIdentity providerIdentity;
  private EcIdentity clientIdentity;
  private RelationshipStore relationshipStore;
  private PeerDirectory peerDirectory;
  private ControlMessageSender messageSender;
  private TestClock clock;

  private RelationshipManager relationshipManager;

  @BeforeEach
  void setUp() throws IOException {
    providerIdentity = EcIdentity.generate("BASE1");
    clientIdentity = EcIdentity.generate("ALFA");

    relationshipStore = new RelationshipStore(dataDirectory,
        new ProviderSettings(true, 10_000_000, DEFAULT_CLIENT_STORAGE, DEFAULT_SNAPSHOTS, false, NOW));
    relationshipStore.load();

    peerDirectory = mock(PeerDirectory.class);
    messageSender = mock(ControlMessageSender.class);
    when(messageSender.send(any(), any())).thenReturn(CompletableFuture.completedFuture(null));

    clock = TestClock.pinned(NOW);

    relationshipManager = buildManager(Duration.ofSeconds(10));
  }

  private RelationshipManager buildManager(final Duration inviteTimeout) {
    return new RelationshipManager(() -> Optional.of(providerIdentity), relationshipStore, peerDirectory,
        messageSender, clock, inviteTimeout);
  }

  @Test
  void inviteAwaitsDecision() {
    relationshipManager.handleInvite("ALFA", invite(clientIdentity, "BASE1", "ALFA"));

    final ClientRelationship client = relationshipStore.getClient("ALFA").orElseThrow();
    assertEquals(RelationshipStatus.PENDING, client.status());
    assertEquals(clientIdentity.publicKey(), client.clientPublicKey());
    assertEquals(DEFAULT_CLIENT_STORAGE, client.maxStorageBytes());
    assertEquals(DEFAULT_SNAPSHOTS, client.maxSnapshots());

    verifyNoInteractions(messageSender);
  }

  @Test
  void inviteForAnotherDeviceIsIgnored() {
    relationshipManager.handleInvite("ALFA", invite(clientIdentity, "CHARLIE", "ALFA"));
    relationshipManager.handleInvite("ALFA", invite(clientIdentity, "BASE1", "BRAVO"));

    assertTrue(relationshipStore.getClients().isEmpty());
    verifyNoInteractions(messageSender);
  }

  @Test
  void inviteIsDeclinedWhenProviderModeIsDisabled() {
    assertTrue(relationshipManager.disableProviderMode());

    relationshipManager.handleInvite("ALFA", invite(clientIdentity, "BASE1", "ALFA"));

    assertEquals(RelationshipStatus.DECLINED, relationshipStore.getClient("ALFA").orElseThrow().status());
    verify(messageSender).send("ALFA", new BackupInviteResponse(false, providerIdentity.publicKey(), 0, 0));
  }

  @Test
  void inviteFromContactIsAutoAccepted() {
    relationshipManager.updateProviderSettings(10_000_000, DEFAULT_CLIENT_STORAGE, DEFAULT_SNAPSHOTS, true);
    when(peerDirectory.isContact("ALFA")).thenReturn(true);

    relationshipManager.handleInvite("ALFA", invite(clientIdentity, "BASE1", "ALFA"));

    assertEquals(RelationshipStatus.ACTIVE, relationshipStore.getClient("ALFA").orElseThrow().status());
    verify(messageSender).send("ALFA", new BackupInviteResponse(true, providerIdentity.publicKey(),
        DEFAULT_CLIENT_STORAGE, DEFAULT_SNAPSHOTS));
  }

  @Test
  void acceptancePersistsBeforeNotifying() {
    relationshipManager.handleInvite("ALFA", invite(clientIdentity, "BASE1", "ALFA"));

    final AtomicReference<RelationshipStatus> statusWhenSent = new AtomicReference<>();
    when(messageSender.send(eq("ALFA"), any())).thenAnswer(invocation -> {
      statusWhenSent.set(relationshipStore.getClient("ALFA").orElseThrow().status());
      return CompletableFuture.completedFuture(null);
    });

    assertTrue(relationshipManager.acceptInvite("ALFA", 1_073_741_824L, 10));

    assertEquals(RelationshipStatus.ACTIVE, statusWhenSent.get());

    final ClientRelationship client = relationshipStore.getClient("ALFA").orElseThrow();
    assertEquals(1_073_741_824L, client.maxStorageBytes());
    assertEquals(10, client.maxSnapshots());
  }

  @Test
  void decisionsRequireAPendingInvite() {
    assertFalse(relationshipManager.acceptInvite("ALFA"));
    assertFalse(relationshipManager.declineInvite("ALFA"));
    assertFalse(relationshipManager.removeClient("ALFA", false));

    relationshipManager.handleInvite("ALFA", invite(clientIdentity, "BASE1", "ALFA"));
    assertTrue(relationshipManager.declineInvite("ALFA"));
    assertFalse(relationshipManager.acceptInvite("ALFA"));

    assertThrows(IllegalArgumentException.class, () -> relationshipManager.acceptInvite("ALFA", 0, 10));
  }

  @Test
  void reinviteFromActiveClientRepeatsAcceptance() {
    relationshipManager.handleInvite("ALFA", invite(clientIdentity, "BASE1", "ALFA"));
    relationshipManager.acceptInvite("ALFA", 1_000_000, 3);

    relationshipManager.handleInvite("ALFA", invite(clientIdentity, "BASE1", "ALFA"));

    verify(messageSender, times(2))
        .send("ALFA", new BackupInviteResponse(true, providerIdentity.publicKey(), 1_000_000, 3));

    // A different key may not take over an active relationship
    relationshipManager.handleInvite("ALFA", invite(EcIdentity.generate("ALFA"), "BASE1", "ALFA"));
    assertEquals(clientIdentity.publicKey(), relationshipStore.getClient("ALFA").orElseThrow().clientPublicKey());
  }

  @Test
  void reinviteAfterTerminationStartsOver() throws IOException {
    relationshipStore.saveClient(ClientRelationship.pending(clientIdentity.publicKey(), "ALFA", 1_000, 2, NOW)
        .withStatus(RelationshipStatus.TERMINATED)
        .withStorageAdded(700));

    relationshipManager.handleInvite("ALFA", invite(clientIdentity, "BASE1", "ALFA"));

    final ClientRelationship client = relationshipStore.getClient("ALFA").orElseThrow();
    assertEquals(RelationshipStatus.PENDING, client.status());
    assertEquals(700, client.currentStorageBytes());
  }

  @Test
  void removeClientTerminates() {
    relationshipManager.handleInvite("ALFA", invite(clientIdentity, "BASE1", "ALFA"));
    relationshipManager.acceptInvite("ALFA");

    assertTrue(relationshipManager.removeClient("ALFA", false));

    assertEquals(RelationshipStatus.TERMINATED, relationshipStore.getClient("ALFA").orElseThrow().status());
    verify(messageSender).send("ALFA", new StatusChange("terminated"));
  }

  @Test
  void removeClientErases() {
    relationshipManager.handleInvite("ALFA", invite(clientIdentity, "BASE1", "ALFA"));
    relationshipManager.acceptInvite("ALFA");

    assertTrue(relationshipManager.removeClient("ALFA", true));

    assertTrue(relationshipStore.getClient("ALFA").isEmpty());
    verify(messageSender).send("ALFA", new StatusChange("terminated"));
  }

  @Test
  void inviteAcceptedByProvider() throws Exception {
    final CompletableFuture<InviteResult> resultFuture = relationshipManager.sendInvite("charlie", 3);

    final ArgumentCaptor<ControlMessage> messageCaptor = ArgumentCaptor.forClass(ControlMessage.class);
    verify(messageSender).send(eq("CHARLIE"), messageCaptor.capture());

    final SignedEvent event = ((ControlMessage.BackupInvite) messageCaptor.getValue()).event();
    assertEquals(Optional.of("CHARLIE"), event.tagValue("target"));
    assertEquals(Optional.of("BASE1"), event.tagValue("callsign"));
    assertEquals(Optional.of("3"), event.tagValue("interval_days"));
    assertEquals(RelationshipStatus.PENDING, relationshipStore.getProvider("CHARLIE").orElseThrow().status());

    relationshipManager.handleInviteResponse("CHARLIE", new BackupInviteResponse(true, "npub-charlie", 2_000, 7));

    final InviteResult result = resultFuture.get(1, TimeUnit.SECONDS);
    assertEquals(InviteResult.Outcome.ACCEPTED, result.outcome());

    final ProviderRelationship provider = relationshipStore.getProvider("CHARLIE").orElseThrow();
    assertEquals(RelationshipStatus.ACTIVE, provider.status());
    assertEquals("npub-charlie", provider.providerPublicKey());
    assertEquals(2_000, provider.maxStorageBytes());
    assertEquals(7, provider.maxSnapshots());
    assertEquals(3, provider.backupIntervalDays());

    assertFalse(relationshipManager.hasPendingInvite("CHARLIE"));

    // An active provider is not invited again
    assertTrue(relationshipManager.sendInvite("CHARLIE", 3).get(1, TimeUnit.SECONDS).isAccepted());
  }

  @Test
  void inviteDeclinedByProvider() throws Exception {
    final CompletableFuture<InviteResult> resultFuture = relationshipManager.sendInvite("CHARLIE", 3);
    relationshipManager.handleInviteResponse("CHARLIE", new BackupInviteResponse(false, "npub-charlie", 0, 0));

    assertEquals(InviteResult.Outcome.DECLINED, resultFuture.get(1, TimeUnit.SECONDS).outcome());
    assertEquals(RelationshipStatus.DECLINED, relationshipStore.getProvider("CHARLIE").orElseThrow().status());
  }

  @Test
  void inviteTimesOut() throws Exception {
    relationshipManager = buildManager(Duration.ofMillis(100));

    final InviteResult result = relationshipManager.sendInvite("CHARLIE", 3).get(5, TimeUnit.SECONDS);

    assertEquals(InviteResult.Outcome.TIMED_OUT, result.outcome());
    assertEquals(RelationshipStatus.PENDING, relationshipStore.getProvider("CHARLIE").orElseThrow().status());
    assertFalse(relationshipManager.hasPendingInvite("CHARLIE"));
  }

  @Test
  void undeliverableInviteFails() throws Exception {
    when(messageSender.send(eq("CHARLIE"), any()))
        .thenReturn(CompletableFuture.failedFuture(new IOException("unreachable")));

    final InviteResult result = relationshipManager.sendInvite("CHARLIE", 3).get(1, TimeUnit.SECONDS);

    assertEquals(InviteResult.Outcome.FAILED, result.outcome());
    assertEquals("Could not deliver invitation: unreachable", result.error());
  }

  @Test
  void invalidInvitesFail() throws Exception {
    assertEquals(InviteResult.Outcome.FAILED, relationshipManager.sendInvite("BASE1", 3).get().outcome());
    assertEquals(InviteResult.Outcome.FAILED, relationshipManager.sendInvite("not a callsign", 3).get().outcome());
    assertEquals(InviteResult.Outcome.FAILED, relationshipManager.sendInvite("CHARLIE", 0).get().outcome());

    verifyNoInteractions(messageSender);
  }

  @Test
  void unsolicitedInviteResponseIsIgnored() {
    relationshipManager.handleInviteResponse("CHARLIE", new BackupInviteResponse(true, "npub-charlie", 2_000, 7));

    assertTrue(relationshipStore.getProvider("CHARLIE").isEmpty());
  }

  @Test
  void statusChangeCannotActivate() throws IOException {
    relationshipStore.saveProvider(ProviderRelationship.pending("CHARLIE", 3, NOW));
    relationshipStore.saveClient(ClientRelationship.pending("npub-charlie", "CHARLIE", 1_000, 2, NOW));

    relationshipManager.handleStatusChange("CHARLIE", new StatusChange("active"));
    relationshipManager.handleStatusChange("CHARLIE", new StatusChange("bogus"));

    assertEquals(RelationshipStatus.PENDING, relationshipStore.getProvider("CHARLIE").orElseThrow().status());
    assertEquals(RelationshipStatus.PENDING, relationshipStore.getClient("CHARLIE").orElseThrow().status());
  }

  @Test
  void statusChangeTerminatesBothRoles() throws IOException {
    relationshipStore.saveProvider(ProviderRelationship.pending("CHARLIE", 3, NOW)
        .withInviteResponse("npub-charlie", RelationshipStatus.ACTIVE, 1_000, 2));
    relationshipStore.saveClient(ClientRelationship.pending("npub-charlie", "CHARLIE", 1_000, 2, NOW)
        .withStatus(RelationshipStatus.DECLINED));

    relationshipManager.handleStatusChange("charlie", new StatusChange("terminated"));

    assertEquals(RelationshipStatus.TERMINATED, relationshipStore.getProvider("CHARLIE").orElseThrow().status());
    // Declined is final
    assertEquals(RelationshipStatus.DECLINED, relationshipStore.getClient("CHARLIE").orElseThrow().status());
  }

  @Test
  void removeProviderNotifiesProvider() throws Exception {
    final CompletableFuture<InviteResult> resultFuture = relationshipManager.sendInvite("CHARLIE", 3);

    assertTrue(relationshipManager.removeProvider("CHARLIE"));

    assertEquals(InviteResult.Outcome.FAILED, resultFuture.get(1, TimeUnit.SECONDS).outcome());
    assertEquals(RelationshipStatus.TERMINATED, relationshipStore.getProvider("CHARLIE").orElseThrow().status());
    verify(messageSender).send("CHARLIE", new StatusChange("terminated"));

    assertFalse(relationshipManager.removeProvider("DELTA"));
  }

  @Test
  void providerSettings() {
    assertTrue(relationshipManager.enableProviderMode(5_000, 1_000, 2));

    final ProviderSettings settings = relationshipManager.getProviderSettings();
    assertTrue(settings.enabled());
    assertEquals(5_000, settings.maxTotalStorageBytes());
    assertEquals(1_000, settings.defaultMaxClientStorageBytes());
    assertEquals(2, settings.defaultMaxSnapshots());

    assertThrows(IllegalArgumentException.class, () -> relationshipManager.enableProviderMode(0, 1_000, 2));
    verify(messageSender, never()).send(any(), any());
  }

  private SignedEvent invite(final EcIdentity inviter, final String target, final String callsign) {
    return inviter.sign(SignedEvent.TEXT_NOTE_KIND, List.of(
            List.of("action", "backup_invite"),
            List.of("target", target),
            List.of("callsign", callsign),
            List.of("interval_days", "3")),
        "Backup provider invitation", clock.instant());
  }
}
