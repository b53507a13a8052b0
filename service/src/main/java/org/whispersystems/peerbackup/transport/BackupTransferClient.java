/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.transport;

import java.io.IOException;
import java.util.Base64;
import java.util.concurrent.CompletionException;
import javax.annotation.Nullable;
import org.apache.commons.lang3.StringUtils;
import org.whispersystems.peerbackup.backup.BackupPaths;
import org.whispersystems.peerbackup.backup.DownloadFailedException;
import org.whispersystems.peerbackup.backup.ManifestDownloadFailedException;
import org.whispersystems.peerbackup.backup.UploadFailedException;
import org.whispersystems.peerbackup.util.ExceptionUtils;
import org.whispersystems.peerbackup.util.SystemMapper;

/**
 * Client side of the provider's backup storage endpoint. Calls block the worker thread that runs the transfer until
 * the transport answers.
 */
public class BackupTransferClient {

  private final PeerTransport transport;

  public BackupTransferClient(final PeerTransport transport) {
    this.transport = transport;
  }

  public void uploadFile(final String providerCallsign, final String clientCallsign, final String snapshotId,
      final String blobName, final byte[] encryptedBytes) throws UploadFailedException {

    upload(providerCallsign, BackupPaths.filePath(clientCallsign, snapshotId, blobName), encryptedBytes);
  }

  public void uploadManifest(final String providerCallsign, final String clientCallsign, final String snapshotId,
      final byte[] encryptedManifest) throws UploadFailedException {

    upload(providerCallsign, BackupPaths.manifestPath(clientCallsign, snapshotId), encryptedManifest);
  }

  public byte[] downloadManifest(final String providerCallsign, final String clientCallsign, final String snapshotId)
      throws ManifestDownloadFailedException {

    final String path = BackupPaths.manifestPath(clientCallsign, snapshotId);
    try {
      return download(providerCallsign, path);
    } catch (final DownloadFailedException e) {
      throw new ManifestDownloadFailedException(e.getMessage(), e.getCause());
    }
  }

  public byte[] downloadFile(final String providerCallsign, final String clientCallsign, final String snapshotId,
      final String blobName) throws DownloadFailedException {

    return download(providerCallsign, BackupPaths.filePath(clientCallsign, snapshotId, blobName));
  }

  private void upload(final String providerCallsign, final String path, final byte[] data)
      throws UploadFailedException {

    final PeerResponse response;
    try {
      response = transport.request(providerCallsign, BackupStorageRequestHandler.PUT, path,
          Base64.getEncoder().encodeToString(data)).join();
    } catch (final CompletionException e) {
      throw new UploadFailedException("Failed to upload " + path + ": " + ExceptionUtils.describe(e),
          ExceptionUtils.unwrap(e));
    }

    if (!response.isSuccess()) {
      throw new UploadFailedException("Failed to upload " + path + ": status " + response.statusCode());
    }
  }

  private byte[] download(final String providerCallsign, final String path) throws DownloadFailedException {
    final PeerResponse response;
    try {
      response = transport.request(providerCallsign, BackupStorageRequestHandler.GET, path, null).join();
    } catch (final CompletionException e) {
      throw new DownloadFailedException("Failed to download " + path + ": " + ExceptionUtils.describe(e),
          ExceptionUtils.unwrap(e));
    }

    if (!response.isSuccess() || StringUtils.isBlank(response.body())) {
      throw new DownloadFailedException("Failed to download " + path + ": status " + response.statusCode());
    }

    return decodePayload(path, response.body());
  }

  private static byte[] decodePayload(final String path, @Nullable final String body)
      throws DownloadFailedException {

    try {
      final TransferPayload payload = SystemMapper.jsonMapper().readValue(body, TransferPayload.class);
      if (payload.data() == null) {
        throw new DownloadFailedException("Empty payload for " + path);
      }
      return Base64.getDecoder().decode(payload.data());
    } catch (final IOException | IllegalArgumentException e) {
      throw new DownloadFailedException("Malformed payload for " + path, e);
    }
  }
}
