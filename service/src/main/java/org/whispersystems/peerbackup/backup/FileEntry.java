/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.backup;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * One file within a snapshot's manifest.
 *
 * @param relativePath      path relative to the data directory, always '/'-separated
 * @param contentHash       hex SHA-256 of the plaintext
 * @param plaintextSize     size of the plaintext in bytes
 * @param encryptedSize     size of the stored blob in bytes
 * @param encryptedBlobName random name of the blob on the provider; not derived from the path
 * @param modifiedAt        last modification time of the source file
 */
public record FileEntry(
    @JsonProperty("path") String relativePath,
    @JsonProperty("sha256") String contentHash,
    @JsonProperty("size") long plaintextSize,
    @JsonProperty("encrypted_size") long encryptedSize,
    @JsonProperty("encrypted_name") String encryptedBlobName,
    @JsonProperty("modified_at") Instant modifiedAt) {
}
