/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.identity;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.whispersystems.peerbackup.util.SystemMapper;

/**
 * A signed event as exchanged between peers. The {@code id} is the SHA-256 of the canonical serialization of every
 * other field except the signature, and {@code sig} is the author's signature over the {@code id}.
 *
 * @param id        hex-encoded SHA-256 of the canonical serialization
 * @param publicKey the author's public key
 * @param createdAt seconds since the epoch at which the event was created
 * @param kind      the event kind
 * @param tags      name/value tags; the first element of each tag is its name
 * @param content   free-form content
 * @param signature hex-encoded signature over {@code id}
 */
public record SignedEvent(
    @JsonProperty("id") @NotBlank String id,
    @JsonProperty("pubkey") @NotBlank String publicKey,
    @JsonProperty("created_at") long createdAt,
    @JsonProperty("kind") int kind,
    @JsonProperty("tags") List<List<String>> tags,
    @JsonProperty("content") @NotNull String content,
    @JsonProperty("sig") @NotBlank String signature) {

  public static final int TEXT_NOTE_KIND = 1;

  public SignedEvent {
    tags = tags == null ? List.of() : tags.stream().map(List::copyOf).toList();
  }

  /**
   * @return the value of the first tag with the given name, if any
   */
  public Optional<String> tagValue(final String name) {
    return tags.stream()
        .filter(tag -> tag.size() >= 2 && Objects.equals(tag.get(0), name))
        .map(tag -> tag.get(1))
        .findFirst();
  }

  public Instant createdAtInstant() {
    return Instant.ofEpochSecond(createdAt);
  }

  /**
   * Computes the event id for the given fields.
   */
  public static String computeId(final String publicKey, final long createdAt, final int kind,
      final List<List<String>> tags, final String content) {

    final byte[] serialized;
    try {
      serialized = SystemMapper.jsonMapper()
          .writeValueAsString(List.of(0, publicKey, createdAt, kind, tags, content))
          .getBytes(StandardCharsets.UTF_8);
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException("Event fields could not be serialized", e);
    }

    try {
      return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(serialized));
    } catch (final NoSuchAlgorithmException e) {
      throw new AssertionError("Every implementation of the Java platform is required to support SHA-256", e);
    }
  }
}
