/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.metrics;

public class MetricsUtil {

  public static final String PREFIX = "peerbackup";

  private MetricsUtil() {
  }

  /**
   * Returns a dot-separated ('.') name for the given class and name parts
   */
  public static String name(Class<?> clazz, String... parts) {
    final StringBuilder sb = new StringBuilder(PREFIX);
    sb.append(".").append(clazz.getSimpleName());
    for (String part : parts) {
      sb.append(".").append(part);
    }
    return sb.toString();
  }
}
