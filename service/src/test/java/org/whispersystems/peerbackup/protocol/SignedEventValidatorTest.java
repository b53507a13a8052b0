/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.whispersystems.peerbackup.identity.EcEventVerifier;
import org.whispersystems.peerbackup.identity.EcIdentity;
import org.whispersystems.peerbackup.identity.SignedEvent;
import org.whispersystems.peerbackup.util.TestClock;

class SignedEventValidatorTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private EcIdentity identity;
  private TestClock clock;
  private SignedEventValidator validator;

  @BeforeEach
  void setUp() {
    identity = EcIdentity.generate("ALFA");
    clock = TestClock.pinned(NOW);
    validator = new SignedEventValidator(new EcEventVerifier(), clock, Duration.ofMinutes(5));
  }

  @Test
  void validEvent() {
    assertEquals(SignedEventValidator.Result.VALID, validator.validate(sign(NOW.minusSeconds(30))));
  }

  @Test
  void missingEvent() {
    assertEquals(SignedEventValidator.Result.MISSING, validator.validate(null));

    final SignedEvent event = sign(NOW);
    assertEquals(SignedEventValidator.Result.MISSING, validator.validate(new SignedEvent(event.id(),
        event.publicKey(), event.createdAt(), event.kind(), event.tags(), event.content(), null)));
  }

  @Test
  void forgedEvent() {
    final SignedEvent event = sign(NOW);
    final SignedEvent forged = new SignedEvent(event.id(), event.publicKey(), event.createdAt(), event.kind(),
        event.tags(), "something else", event.signature());

    assertEquals(SignedEventValidator.Result.SIGNATURE_INVALID, validator.validate(forged));
  }

  @Test
  void staleInEitherDirection() {
    assertEquals(SignedEventValidator.Result.STALE, validator.validate(sign(NOW.minus(Duration.ofMinutes(6)))));
    assertEquals(SignedEventValidator.Result.STALE, validator.validate(sign(NOW.plus(Duration.ofMinutes(6)))));
  }

  @Test
  void freshnessFollowsClock() {
    final SignedEvent event = sign(NOW);
    assertEquals(SignedEventValidator.Result.VALID, validator.validate(event));

    clock.advance(Duration.ofMinutes(10));
    assertEquals(SignedEventValidator.Result.STALE, validator.validate(event));
  }

  private SignedEvent sign(final Instant createdAt) {
    return identity.sign(SignedEvent.TEXT_NOTE_KIND, List.of(List.of("action", "backup_invite")), "invite",
        createdAt);
  }
}
