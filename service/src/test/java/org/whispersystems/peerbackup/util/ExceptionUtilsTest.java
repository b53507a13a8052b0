/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;

class ExceptionUtilsTest {

  @Test
  void unwrap() {
    final IOException cause = new IOException("unreachable");

    assertSame(cause, ExceptionUtils.unwrap(cause));
    assertSame(cause, ExceptionUtils.unwrap(new CompletionException(cause)));
    assertSame(cause, ExceptionUtils.unwrap(new CompletionException(new ExecutionException(cause))));

    final CompletionException withoutCause = new CompletionException("no cause", null);
    assertSame(withoutCause, ExceptionUtils.unwrap(withoutCause));
  }

  @Test
  void wrap() {
    final CompletionException completionException = new CompletionException(new IOException());

    assertSame(completionException, ExceptionUtils.wrap(completionException));
    assertEquals(TimeoutException.class, ExceptionUtils.wrap(new TimeoutException()).getCause().getClass());
  }

  @Test
  void describe() {
    assertEquals("unreachable", ExceptionUtils.describe(new CompletionException(new IOException("unreachable"))));
    assertEquals("TimeoutException", ExceptionUtils.describe(new TimeoutException()));
  }
}
