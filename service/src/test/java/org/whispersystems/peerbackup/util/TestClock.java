/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * A clock that follows real time until pinned, and that can be moved forward while pinned.
 */
public class TestClock extends Clock {

  private volatile Optional<Instant> pinnedInstant;
  private final ZoneId zoneId;

  private TestClock(final Optional<Instant> pinnedInstant, final ZoneId zoneId) {
    this.pinnedInstant = pinnedInstant;
    this.zoneId = zoneId;
  }

  public static TestClock now() {
    return new TestClock(Optional.empty(), ZoneOffset.UTC);
  }

  public static TestClock pinned(final Instant instant) {
    return new TestClock(Optional.of(instant), ZoneOffset.UTC);
  }

  public void pin(final Instant instant) {
    pinnedInstant = Optional.of(instant);
  }

  public void unpin() {
    pinnedInstant = Optional.empty();
  }

  /**
   * Moves a pinned clock forward; pins an unpinned clock at the current time plus the given amount.
   */
  public void advance(final Duration duration) {
    pin(instant().plus(duration));
  }

  @Override
  public TestClock withZone(final ZoneId zone) {
    return new TestClock(pinnedInstant, zone);
  }

  @Override
  public ZoneId getZone() {
    return zoneId;
  }

  @Override
  public Instant instant() {
    return pinnedInstant.orElseGet(Instant::now);
  }
}
