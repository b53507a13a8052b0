/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.transport;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a successful download: the stored object, base64-encoded.
 */
public record TransferPayload(@JsonProperty("data") String data) {
}
