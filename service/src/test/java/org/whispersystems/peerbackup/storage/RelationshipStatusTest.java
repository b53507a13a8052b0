/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Locale;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RelationshipStatusTest {

  @ParameterizedTest
  @CsvSource({
      "PENDING, ACTIVE, true",
      "PENDING, DECLINED, true",
      "PENDING, TERMINATED, true",
      "PENDING, PENDING, false",
      "ACTIVE, TERMINATED, true",
      "ACTIVE, DECLINED, false",
      "ACTIVE, PENDING, false",
      "DECLINED, ACTIVE, false",
      "DECLINED, TERMINATED, false",
      "TERMINATED, ACTIVE, false",
      "TERMINATED, PENDING, false",
  })
  void canTransitionTo(final RelationshipStatus from, final RelationshipStatus to, final boolean expected) {
    assertEquals(expected, from.canTransitionTo(to));
  }

  @ParameterizedTest
  @CsvSource({
      "active, ACTIVE",
      "TERMINATED, TERMINATED",
      "declined, DECLINED",
  })
  void fromWireName(final String wireName, final RelationshipStatus expected) {
    assertEquals(Optional.of(expected), RelationshipStatus.fromWireName(wireName));
  }

  @ParameterizedTest
  @CsvSource({"unknown", "''"})
  void fromUnknownWireName(final String wireName) {
    assertEquals(Optional.empty(), RelationshipStatus.fromWireName(wireName));
  }

  @Test
  void wireNamesIgnoreDefaultLocale() {
    final Locale defaultLocale = Locale.getDefault();
    Locale.setDefault(Locale.forLanguageTag("tr-TR"));

    try {
      assertEquals("active", RelationshipStatus.ACTIVE.wireName());
      assertEquals("terminated", RelationshipStatus.TERMINATED.wireName());
      assertEquals(Optional.of(RelationshipStatus.PENDING), RelationshipStatus.fromWireName("pending"));
      assertEquals("in_progress", SnapshotStatus.IN_PROGRESS.wireName());
    } finally {
      Locale.setDefault(defaultLocale);
    }
  }
}
