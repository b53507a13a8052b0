/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.protocol;

import java.util.Arrays;
import java.util.Optional;

public enum MessageType {
  BACKUP_INVITE(MessageType.INVITE),
  BACKUP_INVITE_RESPONSE(MessageType.INVITE_RESPONSE),
  BACKUP_START(MessageType.START),
  BACKUP_COMPLETE(MessageType.COMPLETE),
  DISCOVERY_CHALLENGE(MessageType.CHALLENGE),
  DISCOVERY_RESPONSE(MessageType.RESPONSE),
  STATUS_CHANGE(MessageType.STATUS);

  static final String INVITE = "backup_invite";
  static final String INVITE_RESPONSE = "backup_invite_response";
  static final String START = "backup_start";
  static final String COMPLETE = "backup_complete";
  static final String CHALLENGE = "backup_discovery_challenge";
  static final String RESPONSE = "backup_discovery_response";
  static final String STATUS = "backup_status_change";

  private final String wireName;

  MessageType(final String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static Optional<MessageType> fromWireName(final String wireName) {
    return Arrays.stream(values())
        .filter(type -> type.wireName.equals(wireName))
        .findFirst();
  }
}
