package com.databricks.pubsub.session;

import java.time.Instant;

/**
 * The lease on one message that the pipeline received but the application has not settled yet.
 *
 * <p>The handling deadline is fixed when the message is received. The estimated server deadline
 * moves forward every time an extension succeeds.
 */
public final class Lease {
  private final String ackId;
  private final Instant handlingDeadline;
  private Instant estimatedServerDeadline;

  Lease(String ackId, Instant estimatedServerDeadline, Instant handlingDeadline) {
    this.ackId = ackId;
    this.estimatedServerDeadline = estimatedServerDeadline;
    this.handlingDeadline = handlingDeadline;
  }

  public String ackId() {
    return ackId;
  }

  public Instant estimatedServerDeadline() {
    return estimatedServerDeadline;
  }

  public Instant handlingDeadline() {
    return handlingDeadline;
  }

  void extendTo(Instant newDeadline) {
    if (newDeadline.isAfter(estimatedServerDeadline)) {
      estimatedServerDeadline = newDeadline;
    }
  }

  @Override
  public String toString() {
    return "Lease{ackId="
        + ackId
        + ", estimatedServerDeadline="
        + estimatedServerDeadline
        + ", handlingDeadline="
        + handlingDeadline
        + "}";
  }
}
