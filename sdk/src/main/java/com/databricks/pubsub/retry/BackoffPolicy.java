package com.databricks.pubsub.retry;

import java.time.Duration;

/** Computes the delay before the next attempt of a retried operation. */
public interface BackoffPolicy {

  /** Returns the delay to wait before the next attempt, advancing the policy's state. */
  Duration nextDelay();
}
