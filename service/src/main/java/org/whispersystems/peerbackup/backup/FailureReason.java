/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.backup;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Why a backup or restore did not run to completion.
 */
public enum FailureReason {
  @JsonProperty("already_in_progress")
  ALREADY_IN_PROGRESS,

  @JsonProperty("identity_unavailable")
  IDENTITY_UNAVAILABLE,

  @JsonProperty("provider_not_found")
  PROVIDER_NOT_FOUND,

  @JsonProperty("provider_not_active")
  PROVIDER_NOT_ACTIVE,

  @JsonProperty("upload_failed")
  UPLOAD_FAILED,

  @JsonProperty("manifest_download_failed")
  MANIFEST_DOWNLOAD_FAILED,

  @JsonProperty("download_failed")
  DOWNLOAD_FAILED,

  @JsonProperty("hash_mismatch")
  HASH_MISMATCH,

  @JsonProperty("internal_error")
  INTERNAL_ERROR
}
