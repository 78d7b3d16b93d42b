package com.databricks.pubsub.stream;

import com.databricks.pubsub.StreamingPullResponse;
import io.grpc.Status;

/** Receives the output of a {@link BatchSource}. */
public interface BatchCallback {

  /**
   * Called with every batch of messages read from the broker. Never called concurrently for the
   * same source.
   */
  void onBatch(StreamingPullResponse response);

  /** Called once if the source fails permanently and will produce no more batches. */
  void onError(Status status);
}
