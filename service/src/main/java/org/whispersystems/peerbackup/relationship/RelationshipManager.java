/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.relationship;

import static org.whispersystems.peerbackup.metrics.MetricsUtil.name;
import static org.whispersystems.peerbackup.protocol.EventTags.tag;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.micrometer.core.instrument.Metrics;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.peerbackup.backup.BackupPaths;
import org.whispersystems.peerbackup.identity.Identity;
import org.whispersystems.peerbackup.identity.IdentityProvider;
import org.whispersystems.peerbackup.identity.SignedEvent;
import org.whispersystems.peerbackup.protocol.ControlMessage.BackupInvite;
import org.whispersystems.peerbackup.protocol.ControlMessage.BackupInviteResponse;
import org.whispersystems.peerbackup.protocol.ControlMessage.StatusChange;
import org.whispersystems.peerbackup.protocol.ControlMessageSender;
import org.whispersystems.peerbackup.protocol.EventTags;
import org.whispersystems.peerbackup.storage.ClientRelationship;
import org.whispersystems.peerbackup.storage.ProviderRelationship;
import org.whispersystems.peerbackup.storage.ProviderSettings;
import org.whispersystems.peerbackup.storage.RelationshipStatus;
import org.whispersystems.peerbackup.storage.RelationshipStore;
import org.whispersystems.peerbackup.transport.PeerDirectory;
import org.whispersystems.peerbackup.util.ExceptionUtils;

/**
 * Runs the relationship lifecycle in both roles: as a provider it handles invitations from clients, and as a client it
 * invites providers and waits for their answer.
 * <p>
 * Every change is persisted through the {@link RelationshipStore} before the peer is told about it. Operations on a
 * callsign with no relationship return {@code false} rather than throwing.
 */
public class RelationshipManager {

  private static final String INVITE_CONTENT = "Backup provider invitation";

  private static final String INVITE_COUNTER_NAME = name(RelationshipManager.class, "invites");
  private static final String OUTCOME_TAG_NAME = "outcome";

  private static final Logger log = LoggerFactory.getLogger(RelationshipManager.class);

  private final IdentityProvider identityProvider;
  private final RelationshipStore relationshipStore;
  private final PeerDirectory peerDirectory;
  private final ControlMessageSender messageSender;
  private final Clock clock;
  private final Duration inviteTimeout;

  private final Map<String, CompletableFuture<InviteResult>> pendingInvites = new ConcurrentHashMap<>();

  public RelationshipManager(final IdentityProvider identityProvider,
      final RelationshipStore relationshipStore,
      final PeerDirectory peerDirectory,
      final ControlMessageSender messageSender,
      final Clock clock,
      final Duration inviteTimeout) {

    this.identityProvider = identityProvider;
    this.relationshipStore = relationshipStore;
    this.peerDirectory = peerDirectory;
    this.messageSender = messageSender;
    this.clock = clock;
    this.inviteTimeout = inviteTimeout;
  }

  // Provider settings

  public ProviderSettings getProviderSettings() {
    return relationshipStore.getProviderSettings();
  }

  public boolean enableProviderMode(final long maxTotalStorageBytes, final long defaultMaxClientStorageBytes,
      final int defaultMaxSnapshots) {

    final ProviderSettings current = relationshipStore.getProviderSettings();
    return saveProviderSettings(new ProviderSettings(true, maxTotalStorageBytes, defaultMaxClientStorageBytes,
        defaultMaxSnapshots, current.autoAcceptFromContacts(), clock.instant()));
  }

  public boolean disableProviderMode() {
    return saveProviderSettings(relationshipStore.getProviderSettings().withEnabled(false, clock.instant()));
  }

  public boolean updateProviderSettings(final long maxTotalStorageBytes, final long defaultMaxClientStorageBytes,
      final int defaultMaxSnapshots, final boolean autoAcceptFromContacts) {

    final ProviderSettings current = relationshipStore.getProviderSettings();
    return saveProviderSettings(new ProviderSettings(current.enabled(), maxTotalStorageBytes,
        defaultMaxClientStorageBytes, defaultMaxSnapshots, autoAcceptFromContacts, clock.instant()));
  }

  private boolean saveProviderSettings(final ProviderSettings settings) {
    Preconditions.checkArgument(settings.maxTotalStorageBytes() > 0, "Total storage must be positive");
    Preconditions.checkArgument(settings.defaultMaxClientStorageBytes() > 0, "Client storage must be positive");
    Preconditions.checkArgument(settings.defaultMaxSnapshots() > 0, "Snapshot limit must be positive");

    try {
      relationshipStore.saveProviderSettings(settings);
      log.info("Provider mode {}", settings.enabled() ? "enabled" : "disabled");
      return true;
    } catch (final IOException e) {
      log.warn("Failed to save provider settings", e);
      return false;
    }
  }

  // Provider role

  /**
   * Handles an invitation whose signature and freshness were already checked. The invitation must name this device as
   * its target and the inviter's callsign must match the peer that delivered it.
   */
  public void handleInvite(final String senderCallsign, final SignedEvent event) {
    final Optional<Identity> maybeIdentity = identityProvider.currentIdentity();
    if (maybeIdentity.isEmpty()) {
      log.debug("Ignoring invite from {}; no identity available", senderCallsign);
      return;
    }

    final String clientCallsign = BackupPaths.normalizeCallsign(senderCallsign);
    final String ownCallsign = BackupPaths.normalizeCallsign(maybeIdentity.get().callsign());

    if (!BackupPaths.isValidCallsign(clientCallsign)) {
      log.warn("Ignoring invite from invalid callsign {}", senderCallsign);
      return;
    }

    if (!event.tagValue(EventTags.TARGET).map(BackupPaths::normalizeCallsign).orElse("").equals(ownCallsign)) {
      log.warn("Ignoring invite from {} addressed to another device", clientCallsign);
      return;
    }

    if (!event.tagValue(EventTags.CALLSIGN).map(BackupPaths::normalizeCallsign).orElse("").equals(clientCallsign)) {
      log.warn("Ignoring invite delivered by {} on behalf of another callsign", clientCallsign);
      return;
    }

    final ProviderSettings settings = relationshipStore.getProviderSettings();
    final Optional<ClientRelationship> maybeExisting = relationshipStore.getClient(clientCallsign);

    if (maybeExisting.isPresent() && maybeExisting.get().status() == RelationshipStatus.ACTIVE) {
      final ClientRelationship existing = maybeExisting.get();

      if (existing.clientPublicKey().equals(event.publicKey())) {
        log.info("Repeating acceptance for active client {}", clientCallsign);
        sendInviteResponse(maybeIdentity.get(), clientCallsign, true, existing.maxStorageBytes(),
            existing.maxSnapshots());
      } else {
        log.warn("Ignoring invite from {} signed by a different key than its active relationship", clientCallsign);
      }
      return;
    }

    final boolean samePendingInvite = maybeExisting
        .filter(existing -> existing.status() == RelationshipStatus.PENDING)
        .filter(existing -> existing.clientPublicKey().equals(event.publicKey()))
        .isPresent();

    if (!samePendingInvite) {
      // A declined or terminated relationship is replaced by a new one; its stored data still counts against storage
      final long retainedBytes = maybeExisting.map(ClientRelationship::currentStorageBytes).orElse(0L);

      try {
        relationshipStore.saveClient(ClientRelationship.pending(event.publicKey(), clientCallsign,
                settings.defaultMaxClientStorageBytes(), settings.defaultMaxSnapshots(), clock.instant())
            .withStorageAdded(retainedBytes));
      } catch (final IOException e) {
        log.warn("Failed to record invite from {}", clientCallsign, e);
        return;
      }
    }

    if (!settings.enabled()) {
      log.info("Declining invite from {}; provider mode is disabled", clientCallsign);
      declineInvite(clientCallsign);
    } else if (settings.autoAcceptFromContacts() && peerDirectory.isContact(clientCallsign)) {
      log.info("Accepting invite from contact {}", clientCallsign);
      acceptInvite(clientCallsign);
    } else {
      log.info("Invite from {} is awaiting a decision", clientCallsign);
    }
  }

  /**
   * Accept a pending invitation with the default quotas from the provider settings.
   */
  public boolean acceptInvite(final String clientCallsign) {
    final ProviderSettings settings = relationshipStore.getProviderSettings();
    return acceptInvite(clientCallsign, settings.defaultMaxClientStorageBytes(), settings.defaultMaxSnapshots());
  }

  /**
   * Accept a pending invitation with the given quotas. Calling this for an active client updates its quotas and
   * repeats the acceptance.
   */
  public boolean acceptInvite(final String clientCallsign, final long maxStorageBytes, final int maxSnapshots) {
    Preconditions.checkArgument(maxStorageBytes > 0, "Storage quota must be positive");
    Preconditions.checkArgument(maxSnapshots > 0, "Snapshot quota must be positive");

    final Optional<Identity> maybeIdentity = identityProvider.currentIdentity();
    if (maybeIdentity.isEmpty()) {
      log.warn("Cannot accept invite from {}; no identity available", clientCallsign);
      return false;
    }

    final Optional<ClientRelationship> maybeUpdated;
    try {
      maybeUpdated = relationshipStore.updateClient(clientCallsign, client ->
          client.status() == RelationshipStatus.PENDING || client.status() == RelationshipStatus.ACTIVE
              ? client.withStatus(RelationshipStatus.ACTIVE).withQuota(maxStorageBytes, maxSnapshots)
              : client);
    } catch (final IOException e) {
      log.warn("Failed to accept invite from {}", clientCallsign, e);
      return false;
    }

    if (maybeUpdated.map(client -> client.status() != RelationshipStatus.ACTIVE).orElse(true)) {
      return false;
    }

    sendInviteResponse(maybeIdentity.get(), maybeUpdated.get().clientCallsign(), true, maxStorageBytes, maxSnapshots);
    return true;
  }

  public boolean declineInvite(final String clientCallsign) {
    final Optional<Identity> maybeIdentity = identityProvider.currentIdentity();
    if (maybeIdentity.isEmpty()) {
      log.warn("Cannot decline invite from {}; no identity available", clientCallsign);
      return false;
    }

    final Optional<ClientRelationship> maybeUpdated;
    try {
      maybeUpdated = relationshipStore.updateClient(clientCallsign, client ->
          client.status() == RelationshipStatus.PENDING ? client.withStatus(RelationshipStatus.DECLINED) : client);
    } catch (final IOException e) {
      log.warn("Failed to decline invite from {}", clientCallsign, e);
      return false;
    }

    if (maybeUpdated.map(client -> client.status() != RelationshipStatus.DECLINED).orElse(true)) {
      return false;
    }

    sendInviteResponse(maybeIdentity.get(), maybeUpdated.get().clientCallsign(), false, 0, 0);
    return true;
  }

  /**
   * Stop providing storage for a client. With {@code erase}, the relationship and every stored snapshot are deleted;
   * otherwise the relationship is terminated and its snapshots stay available for download.
   */
  public boolean removeClient(final String clientCallsign, final boolean erase) {
    final Optional<ClientRelationship> maybeExisting = relationshipStore.getClient(clientCallsign);
    if (maybeExisting.isEmpty()) {
      return false;
    }

    final boolean wasLive = maybeExisting.get().status().canTransitionTo(RelationshipStatus.TERMINATED);

    try {
      if (erase) {
        relationshipStore.eraseClient(clientCallsign);
      } else if (wasLive) {
        relationshipStore.updateClient(clientCallsign, client -> client.withStatus(RelationshipStatus.TERMINATED));
      }
    } catch (final IOException e) {
      log.warn("Failed to remove client {}", clientCallsign, e);
      return false;
    }

    log.info("Removed client {}{}", maybeExisting.get().clientCallsign(), erase ? " and erased its data" : "");

    if (wasLive) {
      notifyTerminated(maybeExisting.get().clientCallsign());
    }
    return true;
  }

  // Client role

  /**
   * Invite a peer to store this device's backups. The returned future completes when the peer answers, when the
   * invite timeout elapses, or when the invitation cannot be sent; it never completes exceptionally. A timed out
   * invitation leaves the provider relationship pending.
   */
  public CompletableFuture<InviteResult> sendInvite(final String providerCallsign, final int intervalDays) {
    final Optional<Identity> maybeIdentity = identityProvider.currentIdentity();
    if (maybeIdentity.isEmpty()) {
      return CompletableFuture.completedFuture(InviteResult.failed(null, "Identity not available"));
    }

    final Identity identity = maybeIdentity.get();
    final String callsign = BackupPaths.normalizeCallsign(providerCallsign);

    if (!BackupPaths.isValidCallsign(callsign) || callsign.equals(BackupPaths.normalizeCallsign(identity.callsign()))) {
      return CompletableFuture.completedFuture(InviteResult.failed(null, "Invalid provider callsign: " + callsign));
    }

    if (intervalDays <= 0) {
      return CompletableFuture.completedFuture(InviteResult.failed(null, "Backup interval must be positive"));
    }

    final Optional<ProviderRelationship> maybeExisting = relationshipStore.getProvider(callsign);
    if (maybeExisting.isPresent() && maybeExisting.get().status() == RelationshipStatus.ACTIVE) {
      return CompletableFuture.completedFuture(InviteResult.accepted(maybeExisting.get()));
    }

    final ProviderRelationship pending = ProviderRelationship.pending(callsign, intervalDays, clock.instant());

    try {
      relationshipStore.saveProvider(pending);
    } catch (final IOException e) {
      log.warn("Failed to record invitation to {}", callsign, e);
      return CompletableFuture.completedFuture(InviteResult.failed(null, "Could not record invitation"));
    }

    final CompletableFuture<InviteResult> responseFuture = new CompletableFuture<>();
    final CompletableFuture<InviteResult> superseded = pendingInvites.put(callsign, responseFuture);
    if (superseded != null) {
      superseded.complete(InviteResult.failed(pending, "Superseded by a newer invitation"));
    }

    final SignedEvent event = identity.sign(SignedEvent.TEXT_NOTE_KIND, List.of(
            tag(EventTags.ACTION, EventTags.INVITE_ACTION),
            tag(EventTags.TARGET, callsign),
            tag(EventTags.CALLSIGN, identity.callsign()),
            tag(EventTags.INTERVAL_DAYS, String.valueOf(intervalDays))),
        INVITE_CONTENT, clock.instant());

    messageSender.send(callsign, new BackupInvite(event)).whenComplete((ignored, throwable) -> {
      if (throwable != null) {
        responseFuture.complete(
            InviteResult.failed(pending, "Could not deliver invitation: " + ExceptionUtils.describe(throwable)));
      }
    });

    log.info("Invited {} to provide backups every {} days", callsign, intervalDays);

    return responseFuture
        .orTimeout(inviteTimeout.toMillis(), TimeUnit.MILLISECONDS)
        .exceptionally(throwable -> {
          if (ExceptionUtils.unwrap(throwable) instanceof TimeoutException) {
            log.info("Invitation to {} timed out", callsign);
            return InviteResult.timedOut(relationshipStore.getProvider(callsign).orElse(pending));
          }
          return InviteResult.failed(pending, ExceptionUtils.describe(throwable));
        })
        .whenComplete((result, throwable) -> {
          pendingInvites.remove(callsign, responseFuture);

          if (result != null) {
            Metrics.counter(INVITE_COUNTER_NAME,
                OUTCOME_TAG_NAME, result.outcome().name().toLowerCase(Locale.ROOT)).increment();
          }
        });
  }

  /**
   * Applies a provider's answer to an outstanding invitation. Answers from peers with no pending relationship are
   * ignored.
   */
  public void handleInviteResponse(final String senderCallsign, final BackupInviteResponse response) {
    final String callsign = BackupPaths.normalizeCallsign(senderCallsign);

    if (relationshipStore.getProvider(callsign)
        .map(provider -> provider.status() != RelationshipStatus.PENDING)
        .orElse(true)) {

      log.debug("Ignoring unsolicited invite response from {}", callsign);
      return;
    }

    final RelationshipStatus status = response.accepted() ? RelationshipStatus.ACTIVE : RelationshipStatus.DECLINED;

    final Optional<ProviderRelationship> maybeUpdated;
    try {
      maybeUpdated = relationshipStore.updateProvider(callsign, provider ->
          provider.status() == RelationshipStatus.PENDING
              ? provider.withInviteResponse(response.providerPublicKey(), status, response.maxStorageBytes(),
              response.maxSnapshots())
              : provider);
    } catch (final IOException e) {
      log.warn("Failed to record invite response from {}", callsign, e);
      completePendingInvite(callsign, InviteResult.failed(null, "Could not record invite response"));
      return;
    }

    maybeUpdated.ifPresent(provider -> {
      log.info("{} {} the backup invitation", callsign, response.accepted() ? "accepted" : "declined");
      completePendingInvite(callsign,
          response.accepted() ? InviteResult.accepted(provider) : InviteResult.declined(provider));
    });
  }

  /**
   * Stop backing up to a provider. The provider is told that the relationship ended.
   */
  public boolean removeProvider(final String providerCallsign) {
    final Optional<ProviderRelationship> maybeExisting = relationshipStore.getProvider(providerCallsign);
    if (maybeExisting.isEmpty()) {
      return false;
    }

    final boolean wasLive = maybeExisting.get().status().canTransitionTo(RelationshipStatus.TERMINATED);

    if (wasLive) {
      final Optional<ProviderRelationship> maybeUpdated;
      try {
        maybeUpdated = relationshipStore.updateProvider(providerCallsign,
            provider -> provider.withStatus(RelationshipStatus.TERMINATED));
      } catch (final IOException e) {
        log.warn("Failed to remove provider {}", providerCallsign, e);
        return false;
      }

      final String callsign = maybeExisting.get().providerCallsign();
      completePendingInvite(callsign, InviteResult.failed(maybeUpdated.orElse(null), "Invitation withdrawn"));
      notifyTerminated(callsign);
      log.info("Removed provider {}", callsign);
    }

    return true;
  }

  // Either role

  /**
   * Applies a peer's notice that it ended or declined the relationship. A peer can only move a relationship into a
   * final state; activation always goes through the invitation handshake.
   */
  public void handleStatusChange(final String senderCallsign, final StatusChange statusChange) {
    final Optional<RelationshipStatus> maybeStatus = RelationshipStatus.fromWireName(statusChange.status());
    if (maybeStatus.isEmpty() || !maybeStatus.get().isFinal()) {
      log.debug("Ignoring status change to {} from {}", statusChange.status(), senderCallsign);
      return;
    }

    final RelationshipStatus status = maybeStatus.get();
    final String callsign = BackupPaths.normalizeCallsign(senderCallsign);

    try {
      relationshipStore.updateClient(callsign,
          client -> client.status().canTransitionTo(status) ? client.withStatus(status) : client);

      relationshipStore.updateProvider(callsign,
              provider -> provider.status().canTransitionTo(status) ? provider.withStatus(status) : provider)
          .ifPresent(provider -> completePendingInvite(callsign, status == RelationshipStatus.DECLINED
              ? InviteResult.declined(provider)
              : InviteResult.failed(provider, "Relationship ended by provider")));
    } catch (final IOException e) {
      log.warn("Failed to apply status change from {}", callsign, e);
    }
  }

  @VisibleForTesting
  boolean hasPendingInvite(final String providerCallsign) {
    return pendingInvites.containsKey(BackupPaths.normalizeCallsign(providerCallsign));
  }

  private void completePendingInvite(final String providerCallsign, final InviteResult result) {
    final CompletableFuture<InviteResult> responseFuture = pendingInvites.remove(providerCallsign);
    if (responseFuture != null) {
      responseFuture.complete(result);
    }
  }

  private void sendInviteResponse(final Identity identity, final String clientCallsign, final boolean accepted,
      final long maxStorageBytes, final int maxSnapshots) {

    messageSender.send(clientCallsign,
        new BackupInviteResponse(accepted, identity.publicKey(), maxStorageBytes, maxSnapshots));
  }

  private void notifyTerminated(final String callsign) {
    messageSender.send(callsign, new StatusChange(RelationshipStatus.TERMINATED.wireName()));
  }
}
