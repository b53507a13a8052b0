/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;

public class ExecutorConfiguration {

  @JsonProperty
  @Min(2)
  private int workerThreads = 2;

  @JsonProperty
  @Min(1)
  private int schedulerThreads = 1;

  /**
   * @return the number of threads that run backups and restores; one of each may run at a time
   */
  public int getWorkerThreads() {
    return workerThreads;
  }

  public int getSchedulerThreads() {
    return schedulerThreads;
  }
}
