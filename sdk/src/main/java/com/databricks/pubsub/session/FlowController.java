package com.databricks.pubsub.session;

import com.databricks.pubsub.ReceivedMessage;
import com.databricks.pubsub.StreamingPullResponse;
import com.databricks.pubsub.SubscriberOptions;
import com.databricks.pubsub.stream.BatchCallback;
import com.databricks.pubsub.stream.BatchSource;
import io.grpc.Status;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounds the number and total size of messages held by the pipeline.
 *
 * <p>Messages are admitted while both counters are below their high watermark; the rest of a batch
 * that crosses a watermark is nacked immediately. Once a high watermark is reached the controller
 * stops pulling, and resumes only when both counters are at or below their low watermarks.
 *
 * <p>Only ack ids admitted by this controller are forwarded to the source below; settling an
 * unknown or already settled ack id is a no-op that resolves with OK.
 */
public class FlowController implements BatchSource {
  private static final Logger logger = LoggerFactory.getLogger(FlowController.class);

  private final BatchSource child;
  private final long messageCountHwm;
  private final long messageCountLwm;
  private final long messageSizeHwm;
  private final long messageSizeLwm;

  private final Map<String, Long> sizes = new HashMap<>();
  private BatchCallback callback;
  private long messageCount = 0;
  private long messageSize = 0;
  private boolean paused = false;

  public FlowController(@Nonnull BatchSource child, @Nonnull SubscriberOptions options) {
    this(
        child,
        options.maxOutstandingMessages(),
        options.outstandingMessagesLowWatermark(),
        options.maxOutstandingBytes(),
        options.outstandingBytesLowWatermark());
  }

  FlowController(
      BatchSource child,
      long messageCountHwm,
      long messageCountLwm,
      long messageSizeHwm,
      long messageSizeLwm) {
    this.child = Objects.requireNonNull(child, "child cannot be null");
    this.messageCountHwm = messageCountHwm;
    this.messageCountLwm = Math.min(messageCountLwm, messageCountHwm);
    this.messageSizeHwm = messageSizeHwm;
    this.messageSizeLwm = Math.min(messageSizeLwm, messageSizeHwm);
  }

  @Override
  public void start(@Nonnull BatchCallback callback) {
    synchronized (this) {
      this.callback = Objects.requireNonNull(callback, "callback cannot be null");
    }
    child.start(
        new BatchCallback() {
          @Override
          public void onBatch(StreamingPullResponse response) {
            FlowController.this.onBatch(response);
          }

          @Override
          public void onError(Status status) {
            FlowController.this.onError(status);
          }
        });
    child.pull();
  }

  @Override
  public void pull() {
    // Pulls are driven by the watermarks.
  }

  @Override
  public void shutdown() {
    child.shutdown();
  }

  @Override
  public CompletableFuture<Status> ackMessage(@Nonnull String ackId) {
    if (!release(ackId)) {
      return CompletableFuture.completedFuture(Status.OK);
    }
    CompletableFuture<Status> result = child.ackMessage(ackId);
    resumeIfBelowLowWatermark();
    return result;
  }

  @Override
  public CompletableFuture<Status> nackMessage(@Nonnull String ackId) {
    if (!release(ackId)) {
      return CompletableFuture.completedFuture(Status.OK);
    }
    CompletableFuture<Status> result = child.nackMessage(ackId);
    resumeIfBelowLowWatermark();
    return result;
  }

  @Override
  public CompletableFuture<Status> bulkNack(@Nonnull List<String> ackIds) {
    List<String> known = new ArrayList<>();
    for (String ackId : ackIds) {
      if (release(ackId)) {
        known.add(ackId);
      }
    }
    if (known.isEmpty()) {
      return CompletableFuture.completedFuture(Status.OK);
    }
    CompletableFuture<Status> result = child.bulkNack(known);
    resumeIfBelowLowWatermark();
    return result;
  }

  @Override
  public CompletableFuture<Status> extendLeases(
      @Nonnull List<String> ackIds, @Nonnull Duration extension) {
    return child.extendLeases(ackIds, extension);
  }

  public synchronized long messageCount() {
    return messageCount;
  }

  public synchronized long messageSize() {
    return messageSize;
  }

  public synchronized boolean isPaused() {
    return paused;
  }

  static long messageSize(ReceivedMessage message) {
    return message.hasMessage()
        ? message.getMessage().getSerializedSize()
        : message.getSerializedSize();
  }

  private void onBatch(StreamingPullResponse response) {
    List<ReceivedMessage> admitted = new ArrayList<>();
    List<String> rejected = new ArrayList<>();
    BatchCallback current;
    boolean pullMore;
    synchronized (this) {
      current = callback;
      for (ReceivedMessage message : response.getReceivedMessagesList()) {
        if (messageCount < messageCountHwm && messageSize < messageSizeHwm) {
          long size = messageSize(message);
          if (sizes.put(message.getAckId(), size) == null) {
            ++messageCount;
            messageSize += size;
          }
          admitted.add(message);
        } else {
          rejected.add(message.getAckId());
        }
      }
      paused = messageCount >= messageCountHwm || messageSize >= messageSizeHwm;
      pullMore = !paused;
    }
    if (!rejected.isEmpty()) {
      logger.warn(
          "Flow control limits reached, nacking {} of {} received messages",
          rejected.size(),
          response.getReceivedMessagesCount());
      child.bulkNack(rejected);
    }
    if (!admitted.isEmpty()) {
      current.onBatch(
          response.toBuilder().clearReceivedMessages().addAllReceivedMessages(admitted).build());
    }
    if (pullMore) {
      child.pull();
    } else {
      logger.debug("Flow control paused pulling");
    }
  }

  private void onError(Status status) {
    BatchCallback current;
    synchronized (this) {
      current = callback;
    }
    current.onError(status);
  }

  /** Removes {@code ackId} from the counters. Returns false if it was not admitted here. */
  private synchronized boolean release(String ackId) {
    Long size = sizes.remove(ackId);
    if (size == null) {
      return false;
    }
    --messageCount;
    messageSize -= size;
    return true;
  }

  private void resumeIfBelowLowWatermark() {
    synchronized (this) {
      if (!paused || messageCount > messageCountLwm || messageSize > messageSizeLwm) {
        return;
      }
      paused = false;
    }
    logger.debug("Flow control resumed pulling");
    child.pull();
  }
}
