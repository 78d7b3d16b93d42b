package com.databricks.pubsub;

import io.grpc.Status;
import java.util.concurrent.CompletableFuture;

/**
 * Settles one delivered message.
 *
 * <p>Exactly one of {@link #ack()} or {@link #nack()} takes effect; later calls resolve with
 * {@link Status.Code#FAILED_PRECONDITION}. Neither method throws. Once the session has completed
 * both resolve with {@link Status.Code#FAILED_PRECONDITION} without contacting the broker.
 *
 * <p>With exactly-once delivery the returned status tells whether the broker accepted the
 * acknowledgement. Otherwise acknowledgements are best effort, and the broker redelivers the
 * message if one is lost.
 */
public interface AckHandler {

  /** Acknowledges the message; the broker will not redeliver it. */
  CompletableFuture<Status> ack();

  /** Returns the message to the broker for immediate redelivery. */
  CompletableFuture<Status> nack();

  String ackId();

  /** The delivery attempt reported by the broker, or 0 if the subscription does not track it. */
  int deliveryAttempt();
}
