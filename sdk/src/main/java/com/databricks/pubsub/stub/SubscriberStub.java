package com.databricks.pubsub.stub;

import com.databricks.pubsub.AcknowledgeRequest;
import com.databricks.pubsub.ModifyAckDeadlineRequest;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nullable;

/**
 * Transport used by the subscriber pipeline to reach the broker.
 *
 * <p>Unary calls complete exceptionally with a {@link io.grpc.StatusRuntimeException} when the
 * broker rejects them.
 */
public interface SubscriberStub {

  /**
   * Opens a new bidirectional streaming pull. The stream is not started until {@link
   * PullStream#start()} is called.
   *
   * @return the stream, or null if the transport could not create one
   */
  @Nullable
  PullStream streamingPull();

  CompletableFuture<Void> acknowledge(AcknowledgeRequest request);

  CompletableFuture<Void> modifyAckDeadline(ModifyAckDeadlineRequest request);
}
