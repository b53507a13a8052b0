/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.backup;

import static org.whispersystems.peerbackup.metrics.MetricsUtil.name;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.peerbackup.identity.Identity;
import org.whispersystems.peerbackup.identity.IdentityProvider;
import org.whispersystems.peerbackup.protocol.ControlMessage.BackupComplete;
import org.whispersystems.peerbackup.protocol.ControlMessage.BackupStart;
import org.whispersystems.peerbackup.protocol.ControlMessageSender;
import org.whispersystems.peerbackup.storage.ProviderRelationship;
import org.whispersystems.peerbackup.storage.RelationshipStatus;
import org.whispersystems.peerbackup.storage.RelationshipStore;
import org.whispersystems.peerbackup.transport.BackupTransferClient;
import org.whispersystems.peerbackup.util.ExceptionUtils;
import org.whispersystems.peerbackup.util.LatestValuePublisher;
import org.whispersystems.peerbackup.util.SystemMapper;
import reactor.core.publisher.Flux;

/**
 * Takes a snapshot of the local data directory and uploads it to a provider.
 * <p>
 * Each file is encrypted to this device's own public key under a random blob name, so the provider learns neither
 * contents nor paths. Once every file is uploaded, the manifest that maps paths to blobs is encrypted with a key that
 * only this identity can derive and uploaded last. An upload failure stops the run; blobs already uploaded stay on the
 * provider.
 * <p>
 * At most one backup runs at a time. Callers observe progress through {@link #statusUpdates()}; failures are reported
 * only there and never thrown.
 */
public class BackupExecutor {

  private static final String BACKUP_COUNTER_NAME = name(BackupExecutor.class, "backups");
  private static final String BACKUP_TIMER_NAME = name(BackupExecutor.class, "duration");
  private static final String OUTCOME_TAG_NAME = "outcome";

  private static final Logger log = LoggerFactory.getLogger(BackupExecutor.class);

  private final IdentityProvider identityProvider;
  private final RelationshipStore relationshipStore;
  private final BackupTransferClient transferClient;
  private final ControlMessageSender messageSender;
  private final ExecutorService executor;
  private final Clock clock;
  private final Path dataDirectory;
  private final Set<String> excludedDirectories;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private final LatestValuePublisher<TransferStatus> status = new LatestValuePublisher<>(TransferStatus.idle());

  public BackupExecutor(final IdentityProvider identityProvider,
      final RelationshipStore relationshipStore,
      final BackupTransferClient transferClient,
      final ControlMessageSender messageSender,
      final ExecutorService executor,
      final Clock clock,
      final Path dataDirectory,
      final Set<String> excludedDirectories) {

    this.identityProvider = identityProvider;
    this.relationshipStore = relationshipStore;
    this.transferClient = transferClient;
    this.messageSender = messageSender;
    this.executor = executor;
    this.clock = clock;
    this.dataDirectory = dataDirectory;
    this.excludedDirectories = Set.copyOf(excludedDirectories);
  }

  public TransferStatus getStatus() {
    return status.current();
  }

  public Flux<TransferStatus> statusUpdates() {
    return status.updates();
  }

  /**
   * Start a backup to the given provider without waiting for it to finish.
   *
   * @return the status of the new run; if a backup is already running, the status of that run annotated with
   * {@link FailureReason#ALREADY_IN_PROGRESS}
   */
  public synchronized TransferStatus startBackup(final String providerCallsign) {
    if (!running.compareAndSet(false, true)) {
      return status.current().withError(FailureReason.ALREADY_IN_PROGRESS, "Backup already in progress");
    }

    final Optional<Identity> maybeIdentity = identityProvider.currentIdentity();
    if (maybeIdentity.isEmpty()) {
      return reject(providerCallsign, FailureReason.IDENTITY_UNAVAILABLE, "Identity not available");
    }

    final Optional<ProviderRelationship> maybeProvider = relationshipStore.getProvider(providerCallsign);
    if (maybeProvider.isEmpty()) {
      return reject(providerCallsign, FailureReason.PROVIDER_NOT_FOUND, "Provider not found");
    }

    if (maybeProvider.get().status() != RelationshipStatus.ACTIVE) {
      return reject(providerCallsign, FailureReason.PROVIDER_NOT_ACTIVE, "Provider not active");
    }

    final String callsign = maybeProvider.get().providerCallsign();
    final String snapshotId = BackupPaths.snapshotIdFor(clock);
    final TransferStatus started = TransferStatus.started(callsign, snapshotId, clock.instant());
    status.publish(started);

    try {
      executor.execute(() -> runBackup(maybeIdentity.get(), callsign, snapshotId, started.startedAt()));
    } catch (final RejectedExecutionException e) {
      log.warn("Backup worker pool rejected backup to {}", callsign, e);
      status.update(current -> current.failed(FailureReason.INTERNAL_ERROR, "Backup could not be scheduled"));
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

  private void runBackup(final Identity identity, final String providerCallsign, final String snapshotId,
      final Instant startedAt) {

    final Timer.Sample sample = Timer.start();
    final String clientCallsign = identity.callsign();

    try {
      final List<Path> files = listFiles();
      long totalBytes = 0;
      for (final Path file : files) {
        totalBytes += Files.size(file);
      }

      final long bytesTotal = totalBytes;
      status.update(current -> current.withTotals(files.size(), bytesTotal));

      log.info("Backing up {} files ({} bytes) to {} as snapshot {}", files.size(), bytesTotal, providerCallsign,
          snapshotId);

      messageSender.send(providerCallsign, new BackupStart(snapshotId)).join();

      final List<FileEntry> entries = new ArrayList<>(files.size());
      for (final Path file : files) {
        final FileEntry entry = uploadFile(identity, providerCallsign, snapshotId, file);
        entries.add(entry);
        status.update(current -> current.withFileTransferred(entry.plaintextSize()));
      }

      final Instant completedAt = clock.instant();
      final Manifest manifest =
          Manifest.of(snapshotId, identity.publicKey(), clientCallsign, entries, startedAt, completedAt);

      transferClient.uploadManifest(providerCallsign, clientCallsign, snapshotId, encryptManifest(identity, manifest));

      messageSender.send(providerCallsign,
          new BackupComplete(snapshotId, manifest.totalFiles(), manifest.totalBytes())).join();

      try {
        relationshipStore.updateProvider(providerCallsign, provider -> provider.withSuccessfulBackup(completedAt));
      } catch (final IOException e) {
        log.warn("Backup to {} completed but its schedule could not be updated", providerCallsign, e);
      }

      finish(TransferStatus::completed);
      countOutcome("complete");
      log.info("Backup {} to {} complete", snapshotId, providerCallsign);
    } catch (final BackupException e) {
      fail(providerCallsign, e.getReason(), e.getMessage(), e);
    } catch (final CompletionException e) {
      fail(providerCallsign, FailureReason.UPLOAD_FAILED,
          "Could not notify provider: " + ExceptionUtils.describe(e), ExceptionUtils.unwrap(e));
    } catch (final IOException | GeneralSecurityException e) {
      fail(providerCallsign, FailureReason.INTERNAL_ERROR, ExceptionUtils.describe(e), e);
    } catch (final RuntimeException e) {
      log.error("Unexpected error during backup to {}", providerCallsign, e);
      fail(providerCallsign, FailureReason.INTERNAL_ERROR, ExceptionUtils.describe(e), e);
    } finally {
      sample.stop(Metrics.timer(BACKUP_TIMER_NAME));
    }
  }

  private FileEntry uploadFile(final Identity identity, final String providerCallsign, final String snapshotId,
      final Path file) throws IOException, GeneralSecurityException, UploadFailedException {

    final byte[] plaintext = Files.readAllBytes(file);
    final byte[] ciphertext = identity.encrypt(plaintext, identity.publicKey());
    final String blobName = BackupPaths.randomBlobName();

    transferClient.uploadFile(providerCallsign, identity.callsign(), snapshotId, blobName, ciphertext);

    return new FileEntry(relativePath(file), ContentHashes.sha256(plaintext), plaintext.length, ciphertext.length,
        blobName, Files.getLastModifiedTime(file).toInstant());
  }

  private static byte[] encryptManifest(final Identity identity, final Manifest manifest)
      throws GeneralSecurityException {

    try {
      return identity.encryptManifest(SystemMapper.jsonMapper().writeValueAsString(manifest));
    } catch (final JsonProcessingException e) {
      throw new IllegalStateException("Manifest could not be serialized", e);
    }
  }

  private void fail(final String providerCallsign, final FailureReason reason, final String error,
      final Throwable cause) {

    log.warn("Backup to {} failed: {}", providerCallsign, error, cause);
    finish(current -> current.failed(reason, error));
    countOutcome(reason.name());
  }

  /**
   * Publishes the final status of a run and allows the next one to start. Holding the same lock as
   * {@link #startBackup} keeps a new run's status from being overwritten by the end of the previous run.
   */
  private synchronized void finish(final UnaryOperator<TransferStatus> terminalUpdate) {
    status.update(terminalUpdate);
    running.set(false);
  }

  /**
   * Lists the regular files of the data directory that belong in a snapshot, ordered by relative path.
   */
  @VisibleForTesting
  List<Path> listFiles() throws IOException {
    if (!Files.isDirectory(dataDirectory)) {
      return List.of();
    }

    try (final Stream<Path> paths = Files.walk(dataDirectory)) {
      return paths
          .filter(Files::isRegularFile)
          .filter(path -> !isExcluded(path))
          .sorted(Comparator.comparing(this::relativePath))
          .collect(Collectors.toList());
    }
  }

  private boolean isExcluded(final Path path) {
    final Path relative = dataDirectory.relativize(path);
    return relative.getNameCount() > 1 && excludedDirectories.contains(relative.getName(0).toString());
  }

  private String relativePath(final Path path) {
    return dataDirectory.relativize(path).toString().replace(File.separatorChar, '/');
  }

  private static void countOutcome(final String outcome) {
    Metrics.counter(BACKUP_COUNTER_NAME, OUTCOME_TAG_NAME, outcome.toLowerCase(Locale.ROOT)).increment();
  }
}
