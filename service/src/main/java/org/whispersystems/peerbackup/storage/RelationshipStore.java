/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.storage;

import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.peerbackup.backup.BackupPaths;
import org.whispersystems.peerbackup.util.LatestValuePublisher;
import reactor.core.publisher.Flux;

/**
 * Durable store of backup relationships in both roles, plus the provider settings.
 * <p>
 * Every mutation writes the whole record to disk before the in-memory index is updated, so a reader never observes a
 * record that is newer than its persisted copy. Mutations are serialized on the store.
 * <pre>
 * backups/settings.json                                   provider settings
 * backups/{CLIENT_CALLSIGN}/config.json                   client relationships (provider role)
 * backup-config/providers/{PROVIDER_CALLSIGN}/config.json provider relationships (client role)
 * </pre>
 */
public class RelationshipStore {

  public static final String BACKUPS_DIRECTORY = "backups";
  public static final String BACKUP_CONFIG_DIRECTORY = "backup-config";

  private static final String PROVIDERS_DIRECTORY = "providers";
  private static final String SETTINGS_FILE = "settings.json";
  private static final String CONFIG_FILE = "config.json";

  private static final Logger log = LoggerFactory.getLogger(RelationshipStore.class);

  private final Path dataDirectory;
  private final Map<String, ClientRelationship> clients = new ConcurrentHashMap<>();
  private final Map<String, ProviderRelationship> providers = new ConcurrentHashMap<>();

  private final LatestValuePublisher<List<ClientRelationship>> clientUpdates = new LatestValuePublisher<>(List.of());
  private final LatestValuePublisher<List<ProviderRelationship>> providerUpdates =
      new LatestValuePublisher<>(List.of());

  private volatile ProviderSettings providerSettings;

  public RelationshipStore(final Path dataDirectory, final ProviderSettings defaultSettings) {
    this.dataDirectory = dataDirectory;
    this.providerSettings = defaultSettings;
  }

  /**
   * Load every persisted record. Records that cannot be parsed are logged and skipped.
   */
  public synchronized void load() throws IOException {
    Files.createDirectories(backupsDirectory());
    Files.createDirectories(providersDirectory());

    try {
      JsonFiles.read(backupsDirectory().resolve(SETTINGS_FILE), ProviderSettings.class)
          .ifPresent(settings -> providerSettings = settings);
    } catch (final IOException e) {
      log.warn("Could not read provider settings; using defaults", e);
    }

    clients.clear();
    forEachConfig(backupsDirectory(), ClientRelationship.class,
        client -> clients.put(BackupPaths.normalizeCallsign(client.clientCallsign()), client));

    providers.clear();
    forEachConfig(providersDirectory(), ProviderRelationship.class,
        provider -> providers.put(BackupPaths.normalizeCallsign(provider.providerCallsign()), provider));

    log.info("Loaded {} backup clients and {} backup providers", clients.size(), providers.size());
    publishClients();
    publishProviders();
  }

  private <T> void forEachConfig(final Path parent, final Class<T> type, final Consumer<T> consumer)
      throws IOException {

    try (final DirectoryStream<Path> directories = Files.newDirectoryStream(parent, Files::isDirectory)) {
      for (final Path directory : directories) {
        try {
          JsonFiles.read(directory.resolve(CONFIG_FILE), type).ifPresent(consumer);
        } catch (final IOException e) {
          log.warn("Could not read relationship config from {}", directory, e);
        }
      }
    }
  }

  public ProviderSettings getProviderSettings() {
    return providerSettings;
  }

  public synchronized void saveProviderSettings(final ProviderSettings settings) throws IOException {
    JsonFiles.write(backupsDirectory().resolve(SETTINGS_FILE), settings);
    providerSettings = settings;
  }

  // Provider role

  public List<ClientRelationship> getClients() {
    return clients.values().stream()
        .sorted(Comparator.comparing(ClientRelationship::clientCallsign))
        .toList();
  }

  public Optional<ClientRelationship> getClient(final String callsign) {
    return Optional.ofNullable(clients.get(BackupPaths.normalizeCallsign(callsign)));
  }

  public Optional<ClientRelationship> findActiveClientByPublicKey(final String publicKey) {
    return clients.values().stream()
        .filter(client -> client.status() == RelationshipStatus.ACTIVE)
        .filter(client -> client.clientPublicKey().equals(publicKey))
        .findFirst();
  }

  public synchronized void saveClient(final ClientRelationship relationship) throws IOException {
    final String callsign = requireValidCallsign(relationship.clientCallsign());

    JsonFiles.write(clientDirectory(callsign).resolve(CONFIG_FILE), relationship);
    clients.put(callsign, relationship);
    publishClients();
  }

  /**
   * Atomically read, modify and persist a client relationship.
   *
   * @return the updated relationship, or empty if no relationship exists for the callsign
   */
  public synchronized Optional<ClientRelationship> updateClient(final String callsign,
      final UnaryOperator<ClientRelationship> updater) throws IOException {

    final Optional<ClientRelationship> maybeExisting = getClient(callsign);
    if (maybeExisting.isEmpty()) {
      return Optional.empty();
    }

    final ClientRelationship updated = updater.apply(maybeExisting.get());
    saveClient(updated);
    return Optional.of(updated);
  }

  /**
   * Remove a client relationship along with every snapshot stored for it.
   *
   * @return {@code true} if a relationship existed
   */
  public synchronized boolean eraseClient(final String callsign) throws IOException {
    final String normalized = BackupPaths.normalizeCallsign(callsign);
    if (!clients.containsKey(normalized)) {
      return false;
    }

    JsonFiles.deleteRecursively(clientDirectory(normalized));
    clients.remove(normalized);
    publishClients();
    return true;
  }

  /**
   * Checks whether storing {@code additionalBytes} more for the client would stay within its quota. This is advisory;
   * nothing in the store enforces it.
   */
  public boolean hasQuotaAvailable(final String clientCallsign, final long additionalBytes) {
    return getClient(clientCallsign)
        .map(client -> client.currentStorageBytes() + additionalBytes <= client.maxStorageBytes())
        .orElse(false);
  }

  public long getTotalStorageUsed() {
    return clients.values().stream().mapToLong(ClientRelationship::currentStorageBytes).sum();
  }

  public Flux<List<ClientRelationship>> clientUpdates() {
    return clientUpdates.updates();
  }

  // Client role

  public List<ProviderRelationship> getProviders() {
    return providers.values().stream()
        .sorted(Comparator.comparing(ProviderRelationship::providerCallsign))
        .toList();
  }

  public Optional<ProviderRelationship> getProvider(final String callsign) {
    return Optional.ofNullable(providers.get(BackupPaths.normalizeCallsign(callsign)));
  }

  public synchronized void saveProvider(final ProviderRelationship relationship) throws IOException {
    final String callsign = requireValidCallsign(relationship.providerCallsign());

    JsonFiles.write(providersDirectory().resolve(callsign).resolve(CONFIG_FILE), relationship);
    providers.put(callsign, relationship);
    publishProviders();
  }

  /**
   * Atomically read, modify and persist a provider relationship.
   *
   * @return the updated relationship, or empty if no relationship exists for the callsign
   */
  public synchronized Optional<ProviderRelationship> updateProvider(final String callsign,
      final UnaryOperator<ProviderRelationship> updater) throws IOException {

    final Optional<ProviderRelationship> maybeExisting = getProvider(callsign);
    if (maybeExisting.isEmpty()) {
      return Optional.empty();
    }

    final ProviderRelationship updated = updater.apply(maybeExisting.get());
    saveProvider(updated);
    return Optional.of(updated);
  }

  public Flux<List<ProviderRelationship>> providerUpdates() {
    return providerUpdates.updates();
  }

  Path clientDirectory(final String clientCallsign) {
    return backupsDirectory().resolve(requireValidCallsign(clientCallsign));
  }

  @VisibleForTesting
  Path backupsDirectory() {
    return dataDirectory.resolve(BACKUPS_DIRECTORY);
  }

  private Path providersDirectory() {
    return dataDirectory.resolve(BACKUP_CONFIG_DIRECTORY).resolve(PROVIDERS_DIRECTORY);
  }

  private static String requireValidCallsign(final String callsign) {
    final String normalized = BackupPaths.normalizeCallsign(callsign);
    if (!BackupPaths.isValidCallsign(normalized)) {
      throw new IllegalArgumentException("Invalid callsign: " + callsign);
    }
    return normalized;
  }

  private void publishClients() {
    clientUpdates.publish(getClients());
  }

  private void publishProviders() {
    providerUpdates.publish(getProviders());
  }
}
