/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.backup;

import static org.whispersystems.peerbackup.metrics.MetricsUtil.name;

import io.micrometer.core.instrument.Metrics;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.peerbackup.identity.Identity;
import org.whispersystems.peerbackup.identity.IdentityProvider;
import org.whispersystems.peerbackup.storage.ProviderRelationship;
import org.whispersystems.peerbackup.storage.RelationshipStore;
import org.whispersystems.peerbackup.transport.BackupTransferClient;
import org.whispersystems.peerbackup.util.ExceptionUtils;
import org.whispersystems.peerbackup.util.LatestValuePublisher;
import org.whispersystems.peerbackup.util.SystemMapper;
import reactor.core.publisher.Flux;

/**
 * Restores a snapshot from a provider into the local data directory.
 * <p>
 * Files are restored in manifest order and each one is checked against the hash recorded in the manifest before it is
 * written. The first file that fails the check stops the run; files written before it are left in place.
 */
public class RestoreExecutor {

  private static final String RESTORE_COUNTER_NAME = name(RestoreExecutor.class, "restores");
  private static final String OUTCOME_TAG_NAME = "outcome";

  private static final Logger log = LoggerFactory.getLogger(RestoreExecutor.class);

  private final IdentityProvider identityProvider;
  private final RelationshipStore relationshipStore;
  private final BackupTransferClient transferClient;
  private final ExecutorService executor;
  private final Clock clock;
  private final Path dataDirectory;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private final LatestValuePublisher<TransferStatus> status = new LatestValuePublisher<>(TransferStatus.idle());

  public RestoreExecutor(final IdentityProvider identityProvider,
      final RelationshipStore relationshipStore,
      final BackupTransferClient transferClient,
      final ExecutorService executor,
      final Clock clock,
      final Path dataDirectory) {

    this.identityProvider = identityProvider;
    this.relationshipStore = relationshipStore;
    this.transferClient = transferClient;
    this.executor = executor;
    this.clock = clock;
    this.dataDirectory = dataDirectory.toAbsolutePath().normalize();
  }

  public TransferStatus getStatus() {
    return status.current();
  }

  public Flux<TransferStatus> statusUpdates() {
    return status.updates();
  }

  /**
   * Start restoring a snapshot without waiting for it to finish. The provider must be known, in any relationship
   * state.
   *
   * @return the status of the new run; if a restore is already running, the status of that run annotated with
   * {@link FailureReason#ALREADY_IN_PROGRESS}
   */
  public synchronized TransferStatus startRestore(final String providerCallsign, final String snapshotId) {
    if (!running.compareAndSet(false, true)) {
      return status.current().withError(FailureReason.ALREADY_IN_PROGRESS, "Restore already in progress");
    }

    final Optional<Identity> maybeIdentity = identityProvider.currentIdentity();
    if (maybeIdentity.isEmpty()) {
      return reject(providerCallsign, FailureReason.IDENTITY_UNAVAILABLE, "Identity not available");
    }

    final Optional<ProviderRelationship> maybeProvider = relationshipStore.getProvider(providerCallsign);
    if (maybeProvider.isEmpty()) {
      return reject(providerCallsign, FailureReason.PROVIDER_NOT_FOUND, "Provider not found");
    }

    if (!BackupPaths.isValidSnapshotId(snapshotId)) {
      return reject(providerCallsign, FailureReason.MANIFEST_DOWNLOAD_FAILED, "Invalid snapshot id: " + snapshotId);
    }

    final String callsign = maybeProvider.get().providerCallsign();
    final TransferStatus started = TransferStatus.started(callsign, snapshotId, clock.instant());
    status.publish(started);

    try {
      executor.execute(() -> runRestore(maybeIdentity.get(), callsign, snapshotId));
    } catch (final RejectedExecutionException e) {
      log.warn("Restore worker pool rejected restore from {}", callsign, e);
      status.update(current -> current.failed(FailureReason.INTERNAL_ERROR, "Restore could not be scheduled"));
      running.set(false);
    }

    return started;
  }

  private TransferStatus reject(final String providerCallsign, final FailureReason reason, final String error) {
    final TransferStatus rejected = TransferStatus.rejected(providerCallsign, reason, error);
    status.publish(rejected);
    running.set(false);
    countOutcome(reason.name());
    return rejected;
  }

  private void runRestore(final Identity identity, final String providerCallsign, final String snapshotId) {
    try {
      final Manifest manifest = downloadManifest(identity, providerCallsign, snapshotId);
      status.update(current -> current.withTotals(manifest.totalFiles(), manifest.totalBytes()));

      log.info("Restoring {} files ({} bytes) of snapshot {} from {}", manifest.totalFiles(), manifest.totalBytes(),
          snapshotId, providerCallsign);

      for (final FileEntry entry : manifest.files()) {
        final Path target = resolveTarget(entry);

        final byte[] encrypted =
            transferClient.downloadFile(providerCallsign, identity.callsign(), snapshotId, entry.encryptedBlobName());

        final byte[] plaintext;
        try {
          plaintext = identity.decrypt(encrypted);
        } catch (final GeneralSecurityException e) {
          throw new HashMismatchException(entry.relativePath(), e);
        }

        if (!ContentHashes.matches(plaintext, entry.contentHash())) {
          throw new HashMismatchException(entry.relativePath());
        }

        Files.createDirectories(target.getParent());
        Files.write(target, plaintext);

        status.update(current -> current.withFileTransferred(plaintext.length));
      }

      finish(TransferStatus::completed);
      countOutcome("complete");
      log.info("Restore of snapshot {} from {} complete", snapshotId, providerCallsign);
    } catch (final BackupException e) {
      fail(providerCallsign, e.getReason(), e.getMessage(), e);
    } catch (final IOException e) {
      fail(providerCallsign, FailureReason.INTERNAL_ERROR, ExceptionUtils.describe(e), e);
    } catch (final RuntimeException e) {
      log.error("Unexpected error during restore from {}", providerCallsign, e);
      fail(providerCallsign, FailureReason.INTERNAL_ERROR, ExceptionUtils.describe(e), e);
    }
  }

  private Manifest downloadManifest(final Identity identity, final String providerCallsign, final String snapshotId)
      throws ManifestDownloadFailedException {

    final byte[] encryptedManifest =
        transferClient.downloadManifest(providerCallsign, identity.callsign(), snapshotId);

    try {
      return SystemMapper.jsonMapper().readValue(identity.decryptManifest(encryptedManifest), Manifest.class);
    } catch (final GeneralSecurityException e) {
      throw new ManifestDownloadFailedException("Manifest could not be decrypted", e);
    } catch (final IOException e) {
      throw new ManifestDownloadFailedException("Manifest could not be parsed", e);
    }
  }

  /**
   * Resolves a manifest entry against the data directory, refusing entries that would land outside it.
   */
  private Path resolveTarget(final FileEntry entry) throws DownloadFailedException {
    final Path target = dataDirectory.resolve(entry.relativePath()).normalize();

    if (!target.startsWith(dataDirectory) || target.equals(dataDirectory)) {
      throw new DownloadFailedException("Refusing to restore outside the data directory: " + entry.relativePath());
    }

    return target;
  }

  private synchronized void finish(final UnaryOperator<TransferStatus> terminalUpdate) {
    status.update(terminalUpdate);
    running.set(false);
  }

  private void fail(final String providerCallsign, final FailureReason reason, final String error,
      final Throwable cause) {

    log.warn("Restore from {} failed: {}", providerCallsign, error, cause);
    finish(current -> current.failed(reason, error));
    countOutcome(reason.name());
  }

  private static void countOutcome(final String outcome) {
    Metrics.counter(RESTORE_COUNTER_NAME, OUTCOME_TAG_NAME, outcome.toLowerCase(Locale.ROOT)).increment();
  }
}
