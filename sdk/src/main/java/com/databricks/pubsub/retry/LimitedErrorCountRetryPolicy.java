package com.databricks.pubsub.retry;

import io.grpc.Status;

/** Retries transient failures until more than {@code maxFailures} have been observed. */
public final class LimitedErrorCountRetryPolicy implements RetryPolicy {
  private final int maxFailures;
  private int failureCount = 0;

  public LimitedErrorCountRetryPolicy(int maxFailures) {
    if (maxFailures < 0) {
      throw new IllegalArgumentException("maxFailures must be non-negative: " + maxFailures);
    }
    this.maxFailures = maxFailures;
  }

  @Override
  public synchronized boolean onFailure(Status status) {
    if (isPermanentFailure(status)) {
      return false;
    }
    ++failureCount;
    return !isExhausted();
  }

  @Override
  public synchronized boolean isExhausted() {
    return failureCount > maxFailures;
  }

  public int maxFailures() {
    return maxFailures;
  }
}
