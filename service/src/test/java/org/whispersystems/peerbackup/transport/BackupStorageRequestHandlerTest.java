/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.transport;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.whispersystems.peerbackup.backup.BackupPaths;
import org.whispersystems.peerbackup.storage.ClientRelationship;
import org.whispersystems.peerbackup.storage.ProviderSettings;
import org.whispersystems.peerbackup.storage.RelationshipStatus;
import org.whispersystems.peerbackup.storage.RelationshipStore;
import org.whispersystems.peerbackup.storage.SnapshotStore;
import org.whispersystems.peerbackup.util.SystemMapper;

class BackupStorageRequestHandlerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final String SNAPSHOT_ID = "2026-03-01";
  private static final String BLOB = "00112233445566778899aabbccddeeff.enc";

  @TempDir
  Path dataDirectory;

  private RelationshipStore relationshipStore;
  private BackupStorageRequestHandler handler;

  @BeforeEach
  void setUp() throws IOException {
    relationshipStore = new RelationshipStore(dataDirectory, new ProviderSettings(true, 10_000, 1_000, 5, false, NOW));
    relationshipStore.load();
    relationshipStore.saveClient(ClientRelationship.pending("npub-alfa", "ALFA", 1_000, 5, NOW)
        .withStatus(RelationshipStatus.ACTIVE));

    handler = new BackupStorageRequestHandler(relationshipStore, new SnapshotStore(relationshipStore));
  }

  @Test
  void putThenGetFile() throws IOException {
    final byte[] blob = {1, 2, 3, 4, 5};
    final String path = BackupPaths.filePath("ALFA", SNAPSHOT_ID, BLOB);

    final PeerResponse putResponse = handler.handle("ALFA", BackupStorageRequestHandler.PUT, path,
        Base64.getEncoder().encodeToString(blob));

    assertEquals(PeerResponse.OK, putResponse.statusCode());
    assertEquals(5, relationshipStore.getClient("ALFA").orElseThrow().currentStorageBytes());

    final PeerResponse getResponse = handler.handle("ALFA", BackupStorageRequestHandler.GET, path, null);
    assertEquals(PeerResponse.OK, getResponse.statusCode());

    final TransferPayload payload = SystemMapper.jsonMapper().readValue(getResponse.body(), TransferPayload.class);
    assertArrayEquals(blob, Base64.getDecoder().decode(payload.data()));
  }

  @Test
  void putThenGetManifest() throws IOException {
    final String path = BackupPaths.manifestPath("ALFA", SNAPSHOT_ID);

    assertEquals(PeerResponse.OK, handler.handle("ALFA", BackupStorageRequestHandler.PUT, path,
        Base64.getEncoder().encodeToString(new byte[]{9, 9})).statusCode());

    final PeerResponse getResponse = handler.handle("alfa", BackupStorageRequestHandler.GET, path, null);
    final TransferPayload payload = SystemMapper.jsonMapper().readValue(getResponse.body(), TransferPayload.class);
    assertArrayEquals(new byte[]{9, 9}, Base64.getDecoder().decode(payload.data()));

    // Manifests do not count against storage
    assertEquals(0, relationshipStore.getClient("ALFA").orElseThrow().currentStorageBytes());
  }

  @Test
  void uploadBeyondQuotaIsStored() {
    final String path = BackupPaths.filePath("ALFA", SNAPSHOT_ID, BLOB);

    assertEquals(PeerResponse.OK, handler.handle("ALFA", BackupStorageRequestHandler.PUT, path,
        Base64.getEncoder().encodeToString(new byte[2_000])).statusCode());
    assertEquals(2_000, relationshipStore.getClient("ALFA").orElseThrow().currentStorageBytes());
  }

  @Test
  void missingObject() {
    final PeerResponse response = handler.handle("ALFA", BackupStorageRequestHandler.GET,
        BackupPaths.filePath("ALFA", SNAPSHOT_ID, BLOB), null);

    assertEquals(PeerResponse.NOT_FOUND, response.statusCode());
    assertNull(response.body());
  }

  @Test
  void otherClientsStorageIsForbidden() throws IOException {
    relationshipStore.saveClient(ClientRelationship.pending("npub-bravo", "BRAVO", 1_000, 5, NOW)
        .withStatus(RelationshipStatus.ACTIVE));

    assertEquals(PeerResponse.FORBIDDEN, handler.handle("BRAVO", BackupStorageRequestHandler.GET,
        BackupPaths.manifestPath("ALFA", SNAPSHOT_ID), null).statusCode());
  }

  @Test
  void inactiveClients() throws IOException {
    final String path = BackupPaths.manifestPath("ALFA", SNAPSHOT_ID);
    handler.handle("ALFA", BackupStorageRequestHandler.PUT, path, Base64.getEncoder().encodeToString(new byte[]{1}));

    relationshipStore.updateClient("ALFA", client -> client.withStatus(RelationshipStatus.TERMINATED));

    assertEquals(PeerResponse.FORBIDDEN, handler.handle("ALFA", BackupStorageRequestHandler.PUT, path,
        Base64.getEncoder().encodeToString(new byte[]{2})).statusCode());

    // Terminated clients can still download what they stored
    assertEquals(PeerResponse.OK, handler.handle("ALFA", BackupStorageRequestHandler.GET, path, null).statusCode());

    assertEquals(PeerResponse.FORBIDDEN, handler.handle("CHARLIE", BackupStorageRequestHandler.GET,
        BackupPaths.manifestPath("CHARLIE", SNAPSHOT_ID), null).statusCode());
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "/api/backup/clients/ALFA/snapshots/yesterday",
      "/api/backup/clients/ALFA/snapshots/2026-03-01/files/config.json",
      "/api/backup/clients/ALFA/snapshots/2026-03-01/files/../../settings.json",
      "/api/backup/clients/ALFA",
      "/somewhere/else",
      ""
  })
  void malformedPaths(final String path) {
    assertEquals(PeerResponse.BAD_REQUEST,
        handler.handle("ALFA", BackupStorageRequestHandler.GET, path, null).statusCode());
  }

  @Test
  void malformedRequests() {
    final String path = BackupPaths.filePath("ALFA", SNAPSHOT_ID, BLOB);

    assertEquals(PeerResponse.BAD_REQUEST,
        handler.handle("ALFA", BackupStorageRequestHandler.PUT, path, "not base64!").statusCode());
    assertEquals(PeerResponse.BAD_REQUEST,
        handler.handle("ALFA", BackupStorageRequestHandler.PUT, path, "").statusCode());
    assertEquals(PeerResponse.BAD_REQUEST, handler.handle("ALFA", "DELETE", path, null).statusCode());
  }
}
