package com.databricks.pubsub.stub;

import com.databricks.pubsub.StreamingPullRequest;
import com.databricks.pubsub.StreamingPullResponse;
import io.grpc.Status;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * One bidirectional streaming pull call.
 *
 * <p>Callers issue at most one {@link #read()} and at most one {@link #write} at a time. A {@code
 * false} or empty result means the stream is broken; the final status is then obtained with {@link
 * #finish()}.
 */
public interface PullStream {

  /** Starts the call. Completes with false if the call could not be started. */
  CompletableFuture<Boolean> start();

  /** Sends one request. Completes with false if the stream is broken. */
  CompletableFuture<Boolean> write(StreamingPullRequest request);

  /** Reads the next response. Completes with an empty value once the stream is closed. */
  CompletableFuture<Optional<StreamingPullResponse>> read();

  /** Half-closes the stream. */
  CompletableFuture<Boolean> writesDone();

  /** Completes with the final status of the call once the broker has closed it. */
  CompletableFuture<Status> finish();

  /** Cancels the call. Pending reads and writes complete shortly after. */
  void cancel();
}
