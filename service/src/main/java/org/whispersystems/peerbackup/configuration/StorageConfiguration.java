/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

public class StorageConfiguration {

  /**
   * The device's data directory. Snapshots are taken of it, restores write into it, and provider storage and
   * relationship records live under it.
   */
  @JsonProperty
  @NotBlank
  private String dataDirectory = "data";

  /**
   * Top-level directories of the data directory that are never included in a snapshot.
   */
  @JsonProperty
  @NotNull
  private List<@NotBlank String> excludedDirectories = List.of("backups", "backup-config", "updates");

  public Path getDataDirectory() {
    return Path.of(dataDirectory);
  }

  public Set<String> getExcludedDirectories() {
    return Set.copyOf(excludedDirectories);
  }
}
