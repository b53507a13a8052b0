/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import javax.annotation.Nullable;
import org.whispersystems.peerbackup.identity.SignedEvent;

/**
 * A backup protocol message exchanged between peers. On the wire each message is a JSON object whose {@code type}
 * property names the kind of message. Required fields carry Bean Validation constraints, which
 * {@link ControlMessageCodec#decode(String)} enforces.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ControlMessage.BackupInvite.class, name = MessageType.INVITE),
    @JsonSubTypes.Type(value = ControlMessage.BackupInviteResponse.class, name = MessageType.INVITE_RESPONSE),
    @JsonSubTypes.Type(value = ControlMessage.BackupStart.class, name = MessageType.START),
    @JsonSubTypes.Type(value = ControlMessage.BackupComplete.class, name = MessageType.COMPLETE),
    @JsonSubTypes.Type(value = ControlMessage.DiscoveryChallenge.class, name = MessageType.CHALLENGE),
    @JsonSubTypes.Type(value = ControlMessage.DiscoveryResponse.class, name = MessageType.RESPONSE),
    @JsonSubTypes.Type(value = ControlMessage.StatusChange.class, name = MessageType.STATUS),
})
public sealed interface ControlMessage {

  MessageType messageType();

  /**
   * Messages that carry a signed event, which must verify and be fresh before the message is acted on.
   */
  sealed interface Signed extends ControlMessage {

    SignedEvent event();
  }

  /**
   * A client asks the recipient to store its backups.
   */
  @JsonTypeName(MessageType.INVITE)
  record BackupInvite(@JsonProperty("event") @NotNull @Valid SignedEvent event) implements Signed {

    @Override
    public MessageType messageType() {
      return MessageType.BACKUP_INVITE;
    }
  }

  @JsonTypeName(MessageType.INVITE_RESPONSE)
  record BackupInviteResponse(
      @JsonProperty("accepted") boolean accepted,
      @JsonProperty("provider_npub") @NotBlank String providerPublicKey,
      @JsonProperty("max_storage_bytes") long maxStorageBytes,
      @JsonProperty("max_snapshots") int maxSnapshots) implements ControlMessage {

    @Override
    public MessageType messageType() {
      return MessageType.BACKUP_INVITE_RESPONSE;
    }
  }

  @JsonTypeName(MessageType.START)
  record BackupStart(@JsonProperty("snapshot_id") @NotBlank String snapshotId) implements ControlMessage {

    @Override
    public MessageType messageType() {
      return MessageType.BACKUP_START;
    }
  }

  @JsonTypeName(MessageType.COMPLETE)
  record BackupComplete(
      @JsonProperty("snapshot_id") @NotBlank String snapshotId,
      @JsonProperty("total_files") int totalFiles,
      @JsonProperty("total_bytes") long totalBytes) implements ControlMessage {

    @Override
    public MessageType messageType() {
      return MessageType.BACKUP_COMPLETE;
    }
  }

  /**
   * Asks the recipient whether it holds backups for the identity that signed the challenge.
   */
  @JsonTypeName(MessageType.CHALLENGE)
  record DiscoveryChallenge(
      @JsonProperty("event") @NotNull @Valid SignedEvent event,
      @JsonProperty("discovery_id") @NotBlank String discoveryId) implements Signed {

    @Override
    public MessageType messageType() {
      return MessageType.DISCOVERY_CHALLENGE;
    }
  }

  /**
   * Every challenged peer answers, whether or not it holds backups. The storage details are present only when
   * {@code hasBackups} is set.
   */
  @JsonTypeName(MessageType.RESPONSE)
  record DiscoveryResponse(
      @JsonProperty("event") @NotNull @Valid SignedEvent event,
      @JsonProperty("discovery_id") @NotBlank String discoveryId,
      @JsonProperty("has_backups") boolean hasBackups,
      @JsonProperty("max_storage_bytes") @Nullable Long maxStorageBytes,
      @JsonProperty("snapshot_count") @Nullable Integer snapshotCount,
      @JsonProperty("latest_snapshot") @Nullable String latestSnapshot) implements Signed {

    public static DiscoveryResponse negative(final SignedEvent event, final String discoveryId) {
      return new DiscoveryResponse(event, discoveryId, false, null, null, null);
    }

    @Override
    public MessageType messageType() {
      return MessageType.DISCOVERY_RESPONSE;
    }
  }

  @JsonTypeName(MessageType.STATUS)
  record StatusChange(@JsonProperty("status") @NotBlank String status) implements ControlMessage {

    @Override
    public MessageType messageType() {
      return MessageType.STATUS_CHANGE;
    }
  }
}
