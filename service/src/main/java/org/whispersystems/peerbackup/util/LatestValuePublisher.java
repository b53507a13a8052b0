/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.util;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Holds the latest value of some piece of state and fans updates out to any number of subscribers.
 * <p>
 * A subscriber receives the current value when it subscribes, then every later value. Subscribers that fall behind
 * may miss intermediate values but always observe the latest one.
 *
 * @param <T> the type of the published state
 */
public class LatestValuePublisher<T> {

  private final AtomicReference<T> current;
  private final Sinks.Many<T> sink = Sinks.many().replay().latest();

  public LatestValuePublisher(final T initialValue) {
    this.current = new AtomicReference<>(initialValue);
    sink.tryEmitNext(initialValue);
  }

  public T current() {
    return current.get();
  }

  public synchronized void publish(final T value) {
    current.set(value);
    sink.tryEmitNext(value);
  }

  /**
   * Apply an update to the current value and publish the result.
   *
   * @return the published value
   */
  public synchronized T update(final UnaryOperator<T> updater) {
    final T updated = updater.apply(current.get());
    publish(updated);
    return updated;
  }

  /**
   * Signal subscribers that no further values will be published. The last value is still replayed to later
   * subscribers.
   */
  public synchronized void complete() {
    sink.tryEmitComplete();
  }

  public Flux<T> updates() {
    return sink.asFlux();
  }
}
