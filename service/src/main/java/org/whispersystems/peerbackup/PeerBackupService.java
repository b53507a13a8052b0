/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.dropwizard.lifecycle.Managed;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.peerbackup.backup.BackupExecutor;
import org.whispersystems.peerbackup.backup.RestoreExecutor;
import org.whispersystems.peerbackup.configuration.PeerBackupConfiguration;
import org.whispersystems.peerbackup.discovery.DiscoveryCoordinator;
import org.whispersystems.peerbackup.discovery.DiscoveryResponder;
import org.whispersystems.peerbackup.identity.EventVerifier;
import org.whispersystems.peerbackup.identity.IdentityProvider;
import org.whispersystems.peerbackup.protocol.ControlMessageSender;
import org.whispersystems.peerbackup.protocol.ProtocolRouter;
import org.whispersystems.peerbackup.protocol.SignedEventValidator;
import org.whispersystems.peerbackup.relationship.RelationshipManager;
import org.whispersystems.peerbackup.storage.RelationshipStore;
import org.whispersystems.peerbackup.storage.SnapshotStore;
import org.whispersystems.peerbackup.transport.BackupStorageRequestHandler;
import org.whispersystems.peerbackup.transport.BackupTransferClient;
import org.whispersystems.peerbackup.transport.PeerDirectory;
import org.whispersystems.peerbackup.transport.PeerTransport;

/**
 * Wires the backup engine of one device to its identity, transport and peer directory.
 * <p>
 * Inbound control messages go to {@link #getProtocolRouter()} and inbound storage requests to
 * {@link #getStorageRequestHandler()}. Stored relationships are loaded on {@link #start()}; {@link #stop()} waits for
 * running transfers to finish.
 */
public class PeerBackupService implements Managed {

  private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

  private static final Logger log = LoggerFactory.getLogger(PeerBackupService.class);

  private final ExecutorService transferExecutor;
  private final ScheduledExecutorService scheduler;

  private final RelationshipStore relationshipStore;
  private final SnapshotStore snapshotStore;
  private final RelationshipManager relationshipManager;
  private final BackupExecutor backupExecutor;
  private final RestoreExecutor restoreExecutor;
  private final DiscoveryCoordinator discoveryCoordinator;
  private final ProtocolRouter protocolRouter;
  private final BackupStorageRequestHandler storageRequestHandler;

  public PeerBackupService(final PeerBackupConfiguration configuration,
      final IdentityProvider identityProvider,
      final EventVerifier eventVerifier,
      final PeerTransport transport,
      final PeerDirectory peerDirectory,
      final Clock clock) {

    final Path dataDirectory = configuration.getStorageConfiguration().getDataDirectory();

    this.transferExecutor = Executors.newFixedThreadPool(configuration.getExecutorConfiguration().getWorkerThreads(),
        new ThreadFactoryBuilder().setNameFormat("peer-backup-transfer-%d").setDaemon(true).build());

    this.scheduler = Executors.newScheduledThreadPool(configuration.getExecutorConfiguration().getSchedulerThreads(),
        new ThreadFactoryBuilder().setNameFormat("peer-backup-scheduler-%d").setDaemon(true).build());

    this.relationshipStore = new RelationshipStore(dataDirectory,
        configuration.getProviderDefaultsConfiguration().toProviderSettings(clock.instant()));
    this.snapshotStore = new SnapshotStore(relationshipStore);

    final ControlMessageSender messageSender = new ControlMessageSender(transport);
    final BackupTransferClient transferClient = new BackupTransferClient(transport);

    this.relationshipManager = new RelationshipManager(identityProvider, relationshipStore, peerDirectory,
        messageSender, clock, configuration.getProtocolConfiguration().getInviteTimeout());

    this.backupExecutor = new BackupExecutor(identityProvider, relationshipStore, transferClient, messageSender,
        transferExecutor, clock, dataDirectory, configuration.getStorageConfiguration().getExcludedDirectories());

    this.restoreExecutor = new RestoreExecutor(identityProvider, relationshipStore, transferClient, transferExecutor,
        clock, dataDirectory);

    this.discoveryCoordinator = new DiscoveryCoordinator(identityProvider, peerDirectory, messageSender, scheduler,
        clock);

    final DiscoveryResponder discoveryResponder =
        new DiscoveryResponder(identityProvider, relationshipStore, snapshotStore, messageSender, clock);

    final SignedEventValidator eventValidator = new SignedEventValidator(eventVerifier, clock,
        configuration.getProtocolConfiguration().getFreshnessWindow());

    this.protocolRouter = new ProtocolRouter(eventValidator, relationshipManager, relationshipStore, snapshotStore,
        discoveryCoordinator, discoveryResponder, clock);

    this.storageRequestHandler = new BackupStorageRequestHandler(relationshipStore, snapshotStore);
  }

  @Override
  public void start() throws IOException {
    relationshipStore.load();
  }

  @Override
  public void stop() throws InterruptedException {
    transferExecutor.shutdown();
    scheduler.shutdownNow();

    if (!transferExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
      log.warn("Transfers did not finish within {} seconds; interrupting", SHUTDOWN_TIMEOUT_SECONDS);
      transferExecutor.shutdownNow();
    }
  }

  public RelationshipStore getRelationshipStore() {
    return relationshipStore;
  }

  public SnapshotStore getSnapshotStore() {
    return snapshotStore;
  }

  public RelationshipManager getRelationshipManager() {
    return relationshipManager;
  }

  public BackupExecutor getBackupExecutor() {
    return backupExecutor;
  }

  public RestoreExecutor getRestoreExecutor() {
    return restoreExecutor;
  }

  public DiscoveryCoordinator getDiscoveryCoordinator() {
    return discoveryCoordinator;
  }

  public ProtocolRouter getProtocolRouter() {
    return protocolRouter;
  }

  public BackupStorageRequestHandler getStorageRequestHandler() {
    return storageRequestHandler;
  }
}
