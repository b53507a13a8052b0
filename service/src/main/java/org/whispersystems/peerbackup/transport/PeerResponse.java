/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.transport;

import javax.annotation.Nullable;

public record PeerResponse(int statusCode, @Nullable String body) {

  public static final int OK = 200;
  public static final int BAD_REQUEST = 400;
  public static final int FORBIDDEN = 403;
  public static final int NOT_FOUND = 404;
  public static final int INTERNAL_SERVER_ERROR = 500;

  public static PeerResponse ok(@Nullable final String body) {
    return new PeerResponse(OK, body);
  }

  public static PeerResponse error(final int statusCode) {
    return new PeerResponse(statusCode, null);
  }

  public boolean isSuccess() {
    return statusCode >= 200 && statusCode < 300;
  }
}
