/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.apache.commons.lang3.StringUtils;

public final class ExceptionUtils {

  private ExceptionUtils() {
    // utility class
  }

  /**
   * Extracts the cause of a {@link CompletionException} or {@link ExecutionException}. Nested wrappers are unwrapped
   * until the first cause that is neither; a wrapper without a cause is returned as-is.
   *
   * @param throwable the throwable to "unwrap"
   * @return the first entity in the given {@code throwable}'s causal chain that is not a future wrapper
   */
  public static Throwable unwrap(Throwable throwable) {
    while ((throwable instanceof CompletionException || throwable instanceof ExecutionException)
        && throwable.getCause() != null) {
      throwable = throwable.getCause();
    }
    return throwable;
  }

  /**
   * Wraps the given {@code throwable} in a {@link CompletionException} unless it already is one.
   */
  public static CompletionException wrap(final Throwable throwable) {
    return throwable instanceof CompletionException completionException
        ? completionException
        : new CompletionException(throwable);
  }

  /**
   * Produce a short, user-presentable description of a failure for status records.
   */
  public static String describe(final Throwable throwable) {
    final Throwable cause = unwrap(throwable);
    return StringUtils.isBlank(cause.getMessage())
        ? cause.getClass().getSimpleName()
        : cause.getMessage();
  }
}
