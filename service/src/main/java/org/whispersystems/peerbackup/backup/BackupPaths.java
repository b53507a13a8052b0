/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.backup;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Naming rules for snapshots, blobs and the logical transfer paths served by providers.
 */
public final class BackupPaths {

  public static final String API_PREFIX = "/api/backup/clients/";

  private static final Pattern SNAPSHOT_ID_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
  private static final Pattern BLOB_NAME_PATTERN = Pattern.compile("^[0-9a-f]{32}\\.enc$");
  private static final Pattern CALLSIGN_PATTERN = Pattern.compile("^[A-Z0-9][A-Z0-9_-]{0,63}$");

  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private BackupPaths() {
  }

  /**
   * Snapshots are identified by the calendar day on which they were taken, so a second backup on the same day
   * replaces the first.
   */
  public static String snapshotIdFor(final Clock clock) {
    return LocalDate.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE);
  }

  public static String randomBlobName() {
    final byte[] bytes = new byte[16];
    SECURE_RANDOM.nextBytes(bytes);
    return HexFormat.of().formatHex(bytes) + ".enc";
  }

  public static String normalizeCallsign(final String callsign) {
    return callsign.trim().toUpperCase(Locale.ROOT);
  }

  public static boolean isValidSnapshotId(@Nullable final String snapshotId) {
    return snapshotId != null && SNAPSHOT_ID_PATTERN.matcher(snapshotId).matches();
  }

  public static boolean isValidBlobName(@Nullable final String blobName) {
    return blobName != null && BLOB_NAME_PATTERN.matcher(blobName).matches();
  }

  public static boolean isValidCallsign(@Nullable final String callsign) {
    return callsign != null && CALLSIGN_PATTERN.matcher(callsign).matches();
  }

  public static String manifestPath(final String clientCallsign, final String snapshotId) {
    return API_PREFIX + clientCallsign + "/snapshots/" + snapshotId;
  }

  public static String filePath(final String clientCallsign, final String snapshotId, final String blobName) {
    return manifestPath(clientCallsign, snapshotId) + "/files/" + blobName;
  }
}
