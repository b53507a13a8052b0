/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.protocol;

import java.util.List;

/**
 * Tag names and values carried by the signed events of the backup protocol.
 */
public final class EventTags {

  public static final String ACTION = "action";
  public static final String TARGET = "target";
  public static final String CALLSIGN = "callsign";
  public static final String INTERVAL_DAYS = "interval_days";
  public static final String CHALLENGE = "challenge";
  public static final String TARGET_CALLSIGN = "target_callsign";
  public static final String HAS_BACKUPS = "has_backups";

  public static final String INVITE_ACTION = "backup_invite";
  public static final String DISCOVERY_QUERY_ACTION = "discovery_query";
  public static final String DISCOVERY_RESPONSE_ACTION = "discovery_response";

  private EventTags() {
  }

  public static List<String> tag(final String name, final String value) {
    return List.of(name, value);
  }
}
