/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.storage;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.peerbackup.backup.BackupPaths;

/**
 * Provider-side storage of client snapshots. Manifests and blobs are opaque ciphertext; the only plaintext the provider
 * keeps about a snapshot is its status record.
 * <pre>
 * backups/{CLIENT_CALLSIGN}/{snapshotId}/manifest.json
 * backups/{CLIENT_CALLSIGN}/{snapshotId}/status.json
 * backups/{CLIENT_CALLSIGN}/{snapshotId}/files/{encryptedBlobName}
 * </pre>
 * Snapshot ids are calendar days, so a second snapshot taken on the same day writes into the same directory and
 * replaces the earlier manifest and status. Lookups with malformed names find nothing; writes with malformed names are
 * rejected with {@link IllegalArgumentException}.
 */
public class SnapshotStore {

  private static final String MANIFEST_FILE = "manifest.json";
  private static final String STATUS_FILE = "status.json";
  private static final String FILES_DIRECTORY = "files";

  private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

  private final RelationshipStore relationshipStore;

  public SnapshotStore(final RelationshipStore relationshipStore) {
    this.relationshipStore = relationshipStore;
  }

  /**
   * Lists the snapshots recorded for a client, newest first. A malformed callsign has no snapshots.
   */
  public List<Snapshot> getSnapshots(final String clientCallsign) throws IOException {
    if (!BackupPaths.isValidCallsign(BackupPaths.normalizeCallsign(clientCallsign))) {
      return List.of();
    }

    final Path clientDirectory = relationshipStore.clientDirectory(clientCallsign);
    if (!Files.isDirectory(clientDirectory)) {
      return List.of();
    }

    final List<Snapshot> snapshots = new ArrayList<>();

    try (final DirectoryStream<Path> directories = Files.newDirectoryStream(clientDirectory,
        path -> Files.isDirectory(path) && BackupPaths.isValidSnapshotId(path.getFileName().toString()))) {

      for (final Path directory : directories) {
        try {
          JsonFiles.read(directory.resolve(STATUS_FILE), Snapshot.class).ifPresent(snapshots::add);
        } catch (final IOException e) {
          log.warn("Could not read snapshot status from {}", directory, e);
        }
      }
    }

    snapshots.sort(Comparator.comparing(Snapshot::snapshotId).reversed());
    return snapshots;
  }

  /**
   * Writes a snapshot's status record and refreshes the owning client's snapshot count and last-backup fields.
   *
   * @return {@code false} if no relationship exists for the client
   */
  public boolean updateSnapshotStatus(final String clientCallsign, final Snapshot snapshot) throws IOException {
    if (relationshipStore.getClient(clientCallsign).isEmpty()) {
      return false;
    }

    JsonFiles.write(snapshotDirectory(clientCallsign, snapshot.snapshotId()).resolve(STATUS_FILE), snapshot);

    final int snapshotCount = getSnapshots(clientCallsign).size();
    relationshipStore.updateClient(clientCallsign, client -> client.withLastBackup(snapshotCount,
        snapshot.completedAt() != null ? snapshot.completedAt() : snapshot.startedAt(),
        snapshot.status().wireName()));

    return true;
  }

  public Optional<Snapshot> getSnapshot(final String clientCallsign, final String snapshotId) throws IOException {
    if (!isValidSnapshot(clientCallsign, snapshotId)) {
      return Optional.empty();
    }

    return JsonFiles.read(snapshotDirectory(clientCallsign, snapshotId).resolve(STATUS_FILE), Snapshot.class);
  }

  public void saveManifest(final String clientCallsign, final String snapshotId, final byte[] encryptedManifest)
      throws IOException {

    JsonFiles.writeBytes(snapshotDirectory(clientCallsign, snapshotId).resolve(MANIFEST_FILE), encryptedManifest);
  }

  public Optional<byte[]> getManifest(final String clientCallsign, final String snapshotId) throws IOException {
    if (!isValidSnapshot(clientCallsign, snapshotId)) {
      return Optional.empty();
    }

    return JsonFiles.readBytes(snapshotDirectory(clientCallsign, snapshotId).resolve(MANIFEST_FILE));
  }

  /**
   * Stores an encrypted blob and charges its size against the client's storage. Replacing an existing blob only
   * charges the difference in size.
   */
  public void saveEncryptedFile(final String clientCallsign, final String snapshotId, final String blobName,
      final byte[] encryptedBytes) throws IOException {

    final Path blobPath = blobPath(clientCallsign, snapshotId, blobName);
    final long replacedBytes = Files.isRegularFile(blobPath) ? Files.size(blobPath) : 0;

    JsonFiles.writeBytes(blobPath, encryptedBytes);
    relationshipStore.updateClient(clientCallsign,
        client -> client.withStorageAdded(encryptedBytes.length - replacedBytes));
  }

  public Optional<byte[]> getEncryptedFile(final String clientCallsign, final String snapshotId,
      final String blobName) throws IOException {

    if (!isValidSnapshot(clientCallsign, snapshotId) || !BackupPaths.isValidBlobName(blobName)) {
      return Optional.empty();
    }

    return JsonFiles.readBytes(blobPath(clientCallsign, snapshotId, blobName));
  }

  private static boolean isValidSnapshot(final String clientCallsign, final String snapshotId) {
    return BackupPaths.isValidCallsign(BackupPaths.normalizeCallsign(clientCallsign))
        && BackupPaths.isValidSnapshotId(snapshotId);
  }

  private Path snapshotDirectory(final String clientCallsign, final String snapshotId) {
    if (!BackupPaths.isValidSnapshotId(snapshotId)) {
      throw new IllegalArgumentException("Invalid snapshot id: " + snapshotId);
    }
    return relationshipStore.clientDirectory(clientCallsign).resolve(snapshotId);
  }

  private Path blobPath(final String clientCallsign, final String snapshotId, final String blobName) {
    if (!BackupPaths.isValidBlobName(blobName)) {
      throw new IllegalArgumentException("Invalid blob name: " + blobName);
    }
    return snapshotDirectory(clientCallsign, snapshotId).resolve(FILES_DIRECTORY).resolve(blobName);
  }
}
