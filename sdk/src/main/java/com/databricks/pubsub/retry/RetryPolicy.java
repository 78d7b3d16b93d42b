package com.databricks.pubsub.retry;

import io.grpc.Status;

/**
 * Decides whether a failed operation should be attempted again.
 *
 * <p>Instances are stateful: they count failures or track a deadline from their creation. Callers
 * obtain a fresh instance for every logical operation, usually from a {@code
 * Supplier<RetryPolicy>}.
 */
public interface RetryPolicy {

  /**
   * Records a failure.
   *
   * @param status the failure
   * @return true if the operation should be retried
   */
  boolean onFailure(Status status);

  /** Returns true once the retry budget is spent, regardless of the last status. */
  boolean isExhausted();

  /** Returns true if {@code status} must never be retried. */
  default boolean isPermanentFailure(Status status) {
    return GrpcErrorHandling.isPermanent(status);
  }
}
