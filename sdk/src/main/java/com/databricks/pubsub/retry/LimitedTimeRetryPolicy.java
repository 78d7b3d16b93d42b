package com.databricks.pubsub.retry;

import io.grpc.Status;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/** Retries transient failures until a fixed amount of time has passed since creation. */
public final class LimitedTimeRetryPolicy implements RetryPolicy {
  private final Clock clock;
  private final Instant deadline;

  public LimitedTimeRetryPolicy(Duration maxDuration) {
    this(maxDuration, Clock.systemUTC());
  }

  public LimitedTimeRetryPolicy(Duration maxDuration, Clock clock) {
    if (maxDuration.isNegative()) {
      throw new IllegalArgumentException("maxDuration must be non-negative: " + maxDuration);
    }
    this.clock = clock;
    this.deadline = clock.instant().plus(maxDuration);
  }

  @Override
  public boolean onFailure(Status status) {
    if (isPermanentFailure(status)) {
      return false;
    }
    return !isExhausted();
  }

  @Override
  public boolean isExhausted() {
    return !clock.instant().isBefore(deadline);
  }

  Instant deadline() {
    return deadline;
  }
}
