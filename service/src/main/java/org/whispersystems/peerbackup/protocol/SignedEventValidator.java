/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.protocol;

import static org.whispersystems.peerbackup.metrics.MetricsUtil.name;

import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import javax.annotation.Nullable;
import org.whispersystems.peerbackup.identity.EventVerifier;
import org.whispersystems.peerbackup.identity.SignedEvent;

/**
 * Checks that a signed event was produced by the key it names and that its timestamp is within the freshness window
 * of the local clock, in either direction.
 */
public class SignedEventValidator {

  public enum Result {
    VALID,
    MISSING,
    SIGNATURE_INVALID,
    STALE
  }

  private static final String REJECTED_COUNTER_NAME = name(SignedEventValidator.class, "rejected");
  private static final String REASON_TAG_NAME = "reason";

  private final EventVerifier eventVerifier;
  private final Clock clock;
  private final Duration freshnessWindow;

  public SignedEventValidator(final EventVerifier eventVerifier, final Clock clock, final Duration freshnessWindow) {
    this.eventVerifier = eventVerifier;
    this.clock = clock;
    this.freshnessWindow = freshnessWindow;
  }

  public Result validate(@Nullable final SignedEvent event) {
    final Result result = check(event);

    if (result != Result.VALID) {
      Metrics.counter(REJECTED_COUNTER_NAME, REASON_TAG_NAME, result.name().toLowerCase(Locale.ROOT)).increment();
    }

    return result;
  }

  private Result check(@Nullable final SignedEvent event) {
    if (event == null || event.publicKey() == null || event.signature() == null) {
      return Result.MISSING;
    }

    if (!eventVerifier.verify(event)) {
      return Result.SIGNATURE_INVALID;
    }

    final Duration skew = Duration.between(event.createdAtInstant(), Instant.now(clock)).abs();
    if (skew.compareTo(freshnessWindow) > 0) {
      return Result.STALE;
    }

    return Result.VALID;
  }
}
