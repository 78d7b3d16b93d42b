package com.databricks.pubsub.retry;

import java.time.Duration;

/**
 * Backoff that grows the delay geometrically (e.g., 100ms, 130ms, 169ms, ...) up to a maximum.
 *
 * <p>The first call to {@link #nextDelay()} returns the initial delay.
 */
public final class ExponentialBackoffPolicy implements BackoffPolicy {
  private final Duration maximumDelay;
  private final double scaling;
  private Duration currentDelay;

  public ExponentialBackoffPolicy(Duration initialDelay, Duration maximumDelay, double scaling) {
    if (scaling < 1.0) {
      throw new IllegalArgumentException("scaling must be >= 1.0: " + scaling);
    }
    if (initialDelay.isNegative() || maximumDelay.compareTo(initialDelay) < 0) {
      throw new IllegalArgumentException(
          "invalid delays: initial=" + initialDelay + ", maximum=" + maximumDelay);
    }
    this.maximumDelay = maximumDelay;
    this.scaling = scaling;
    this.currentDelay = initialDelay;
  }

  @Override
  public synchronized Duration nextDelay() {
    Duration delay = currentDelay;
    long nextNanos = (long) (currentDelay.toNanos() * scaling);
    currentDelay = Duration.ofNanos(Math.min(nextNanos, maximumDelay.toNanos()));
    return delay;
  }
}
