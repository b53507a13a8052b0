/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.transport;

import static org.whispersystems.peerbackup.metrics.MetricsUtil.name;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.micrometer.core.instrument.Metrics;
import java.io.IOException;
import java.util.Base64;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.peerbackup.backup.BackupPaths;
import org.whispersystems.peerbackup.storage.ClientRelationship;
import org.whispersystems.peerbackup.storage.RelationshipStatus;
import org.whispersystems.peerbackup.storage.RelationshipStore;
import org.whispersystems.peerbackup.storage.SnapshotStore;
import org.whispersystems.peerbackup.util.SystemMapper;

/**
 * Serves a provider's backup storage to its clients.
 * <p>
 * Clients upload with {@code PUT} and a base64 body, and download with {@code GET}, which answers with a
 * {@link TransferPayload}. A client may only reach the objects stored under its own callsign. Uploads require an
 * active relationship; downloads are also allowed after the relationship was terminated, as long as the data was not
 * erased.
 */
public class BackupStorageRequestHandler {

  public static final String GET = "GET";
  public static final String PUT = "PUT";

  private static final Pattern PATH_PATTERN = Pattern.compile(
      "^" + Pattern.quote(BackupPaths.API_PREFIX)
          + "(?<callsign>[^/]+)/snapshots/(?<snapshot>[^/]+)(?:/files/(?<blob>[^/]+))?$");

  private static final String REQUEST_COUNTER_NAME = name(BackupStorageRequestHandler.class, "requests");
  private static final String METHOD_TAG_NAME = "method";
  private static final String STATUS_TAG_NAME = "status";

  private static final Logger log = LoggerFactory.getLogger(BackupStorageRequestHandler.class);

  private final RelationshipStore relationshipStore;
  private final SnapshotStore snapshotStore;

  public BackupStorageRequestHandler(final RelationshipStore relationshipStore, final SnapshotStore snapshotStore) {
    this.relationshipStore = relationshipStore;
    this.snapshotStore = snapshotStore;
  }

  public PeerResponse handle(final String requesterCallsign, final String method, final String path,
      @Nullable final String body) {

    final PeerResponse response = handleRequest(requesterCallsign, method, path, body);

    Metrics.counter(REQUEST_COUNTER_NAME,
            METHOD_TAG_NAME, StringUtils.defaultString(method),
            STATUS_TAG_NAME, String.valueOf(response.statusCode()))
        .increment();

    return response;
  }

  private PeerResponse handleRequest(final String requesterCallsign, final String method, final String path,
      @Nullable final String body) {

    final Matcher matcher = PATH_PATTERN.matcher(StringUtils.defaultString(path));
    if (!matcher.matches()) {
      return PeerResponse.error(PeerResponse.BAD_REQUEST);
    }

    final String clientCallsign = BackupPaths.normalizeCallsign(matcher.group("callsign"));
    final String snapshotId = matcher.group("snapshot");
    @Nullable final String blobName = matcher.group("blob");

    if (!BackupPaths.isValidCallsign(clientCallsign) || !BackupPaths.isValidSnapshotId(snapshotId)
        || (blobName != null && !BackupPaths.isValidBlobName(blobName))) {
      return PeerResponse.error(PeerResponse.BAD_REQUEST);
    }

    if (!clientCallsign.equals(BackupPaths.normalizeCallsign(requesterCallsign))) {
      log.warn("{} attempted to access backup storage of {}", requesterCallsign, clientCallsign);
      return PeerResponse.error(PeerResponse.FORBIDDEN);
    }

    final Optional<ClientRelationship> maybeClient = relationshipStore.getClient(clientCallsign);

    try {
      if (PUT.equals(method)) {
        if (maybeClient.map(client -> client.status() != RelationshipStatus.ACTIVE).orElse(true)) {
          return PeerResponse.error(PeerResponse.FORBIDDEN);
        }
        return handlePut(clientCallsign, snapshotId, blobName, body);
      } else if (GET.equals(method)) {
        if (maybeClient.map(client -> client.status() != RelationshipStatus.ACTIVE
            && client.status() != RelationshipStatus.TERMINATED).orElse(true)) {
          return PeerResponse.error(PeerResponse.FORBIDDEN);
        }
        return handleGet(clientCallsign, snapshotId, blobName);
      } else {
        return PeerResponse.error(PeerResponse.BAD_REQUEST);
      }
    } catch (final IOException e) {
      log.warn("Failed to serve {} {} for {}", method, path, clientCallsign, e);
      return PeerResponse.error(PeerResponse.INTERNAL_SERVER_ERROR);
    }
  }

  private PeerResponse handlePut(final String clientCallsign, final String snapshotId, @Nullable final String blobName,
      @Nullable final String body) throws IOException {

    if (StringUtils.isBlank(body)) {
      return PeerResponse.error(PeerResponse.BAD_REQUEST);
    }

    final byte[] data;
    try {
      data = Base64.getDecoder().decode(body.trim());
    } catch (final IllegalArgumentException e) {
      return PeerResponse.error(PeerResponse.BAD_REQUEST);
    }

    if (!relationshipStore.hasQuotaAvailable(clientCallsign, data.length)) {
      // Quotas are advisory; the upload is still stored
      log.info("{} is storing {} bytes beyond its quota", clientCallsign, data.length);
    }

    if (blobName == null) {
      snapshotStore.saveManifest(clientCallsign, snapshotId, data);
    } else {
      snapshotStore.saveEncryptedFile(clientCallsign, snapshotId, blobName, data);
    }

    return PeerResponse.ok(null);
  }

  private PeerResponse handleGet(final String clientCallsign, final String snapshotId, @Nullable final String blobName)
      throws IOException {

    final Optional<byte[]> maybeData = blobName == null
        ? snapshotStore.getManifest(clientCallsign, snapshotId)
        : snapshotStore.getEncryptedFile(clientCallsign, snapshotId, blobName);

    if (maybeData.isEmpty()) {
      return PeerResponse.error(PeerResponse.NOT_FOUND);
    }

    try {
      return PeerResponse.ok(SystemMapper.jsonMapper()
          .writeValueAsString(new TransferPayload(Base64.getEncoder().encodeToString(maybeData.get()))));
    } catch (final JsonProcessingException e) {
      throw new IOException(e);
    }
  }
}
