/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.backup;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import javax.annotation.Nullable;

/**
 * Progress of a backup or restore.
 *
 * @param peerCallsign     the provider being backed up to or restored from
 * @param snapshotId       the snapshot being transferred
 * @param state            the state of the transfer
 * @param filesTotal       the number of files to transfer
 * @param filesTransferred the number of files transferred so far
 * @param bytesTotal       the number of plaintext bytes to transfer
 * @param bytesTransferred the number of plaintext bytes transferred so far
 * @param progressPercent  0-100, never decreases for a single transfer
 * @param error            a human-readable description of the failure, if the transfer failed or was rejected
 * @param failureReason    the machine-readable cause of the failure
 * @param startedAt        when the transfer started
 */
public record TransferStatus(
    @JsonProperty("peer_callsign") @Nullable String peerCallsign,
    @JsonProperty("snapshot_id") @Nullable String snapshotId,
    @JsonProperty("status") TransferState state,
    @JsonProperty("files_total") int filesTotal,
    @JsonProperty("files_transferred") int filesTransferred,
    @JsonProperty("bytes_total") long bytesTotal,
    @JsonProperty("bytes_transferred") long bytesTransferred,
    @JsonProperty("progress_percent") int progressPercent,
    @JsonProperty("error") @Nullable String error,
    @JsonProperty("failure_reason") @Nullable FailureReason failureReason,
    @JsonProperty("started_at") @Nullable Instant startedAt) {

  public static TransferStatus idle() {
    return new TransferStatus(null, null, TransferState.IDLE, 0, 0, 0, 0, 0, null, null, null);
  }

  public static TransferStatus started(final String peerCallsign, final String snapshotId, final Instant startedAt) {
    return new TransferStatus(peerCallsign, snapshotId, TransferState.IN_PROGRESS, 0, 0, 0, 0, 0, null, null,
        startedAt);
  }

  public static TransferStatus rejected(@Nullable final String peerCallsign, final FailureReason reason,
      final String error) {
    return new TransferStatus(peerCallsign, null, TransferState.FAILED, 0, 0, 0, 0, 0, error, reason, null);
  }

  public boolean isInProgress() {
    return state == TransferState.IN_PROGRESS;
  }

  public TransferStatus withTotals(final int filesTotal, final long bytesTotal) {
    return new TransferStatus(peerCallsign, snapshotId, state, filesTotal, filesTransferred, bytesTotal,
        bytesTransferred, progressPercent, error, failureReason, startedAt);
  }

  /**
   * Record one more transferred file. Progress is derived from the file count and never moves backwards.
   */
  public TransferStatus withFileTransferred(final long plaintextBytes) {
    final int transferred = filesTransferred + 1;
    final int percent = filesTotal == 0 ? 100 : Math.min(100, transferred * 100 / filesTotal);

    return new TransferStatus(peerCallsign, snapshotId, state, filesTotal, transferred, bytesTotal,
        bytesTransferred + plaintextBytes, Math.max(progressPercent, percent), error, failureReason, startedAt);
  }

  public TransferStatus completed() {
    return new TransferStatus(peerCallsign, snapshotId, TransferState.COMPLETE, filesTotal, filesTransferred,
        bytesTotal, bytesTransferred, 100, null, null, startedAt);
  }

  public TransferStatus failed(final FailureReason reason, final String error) {
    return new TransferStatus(peerCallsign, snapshotId, TransferState.FAILED, filesTotal, filesTransferred,
        bytesTotal, bytesTransferred, progressPercent, error, reason, startedAt);
  }

  /**
   * A copy of this status annotated with an error, without changing its state. Used to answer a start request that
   * was rejected because a transfer is already running.
   */
  public TransferStatus withError(final FailureReason reason, final String error) {
    return new TransferStatus(peerCallsign, snapshotId, state, filesTotal, filesTransferred, bytesTotal,
        bytesTransferred, progressPercent, error, reason, startedAt);
  }
}
