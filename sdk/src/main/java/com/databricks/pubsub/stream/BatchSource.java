package com.databricks.pubsub.stream;

import io.grpc.Status;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A source of message batches together with the operations that settle the messages it produced.
 *
 * <p>Sources are stacked: each layer of the subscriber pipeline implements this interface on top
 * of the layer below it. The futures returned by the settle operations never complete
 * exceptionally; failures are reported as a non-OK {@link Status}.
 */
public interface BatchSource {

  /** Starts producing batches. Must be called exactly once. */
  void start(BatchCallback callback);

  /** Asks for one more batch. Extra calls before the batch arrives have no effect. */
  void pull();

  /** Stops producing batches and releases the resources of the source. */
  void shutdown();

  CompletableFuture<Status> ackMessage(String ackId);

  CompletableFuture<Status> nackMessage(String ackId);

  /** Returns the given messages to the broker for redelivery. */
  CompletableFuture<Status> bulkNack(List<String> ackIds);

  /** Extends the lease of the given messages by {@code extension}, in whole seconds. */
  CompletableFuture<Status> extendLeases(List<String> ackIds, Duration extension);
}
