package com.databricks.pubsub.session;

import com.databricks.pubsub.ReceivedMessage;
import com.databricks.pubsub.StreamingPullResponse;
import com.databricks.pubsub.stream.BatchCallback;
import com.databricks.pubsub.stream.BatchSource;
import io.grpc.Status;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Buffers received messages and releases them to the application at the rate it asks for.
 *
 * <p>Each call to {@link #read(int)} grants read credits; one message is dispatched per credit, in
 * arrival order. Messages that share an ordering key are dispatched one at a time: the next one is
 * released when the previous one is acked or nacked.
 *
 * <p>The callback is invoked without holding the queue lock and may call {@link #read}, {@link
 * #ackMessage} or {@link #nackMessage} synchronously.
 */
public class MessageDispatchQueue {
  private static final Logger logger = LoggerFactory.getLogger(MessageDispatchQueue.class);

  /** Receives the messages released by the queue. */
  public interface MessageCallback {
    void onMessage(PendingMessage message);
  }

  private final BatchSource source;
  private final ShutdownCoordinator coordinator;

  private final Deque<PendingMessage> ready = new ArrayDeque<>();
  private final Map<String, Deque<PendingMessage>> waitingByKey = new HashMap<>();
  private final Set<String> busyKeys = new HashSet<>();
  private final Map<String, String> keyByAckId = new HashMap<>();
  private MessageCallback callback;
  private long credits = 0;
  private boolean draining = false;
  private boolean shutdown = false;

  public MessageDispatchQueue(
      @Nonnull BatchSource source, @Nonnull ShutdownCoordinator coordinator) {
    this.source = Objects.requireNonNull(source, "source cannot be null");
    this.coordinator = Objects.requireNonNull(coordinator, "coordinator cannot be null");
  }

  public void start(@Nonnull MessageCallback callback) {
    synchronized (this) {
      this.callback = Objects.requireNonNull(callback, "callback cannot be null");
    }
    source.start(
        new BatchCallback() {
          @Override
          public void onBatch(StreamingPullResponse response) {
            MessageDispatchQueue.this.onBatch(response);
          }

          @Override
          public void onError(Status status) {
            MessageDispatchQueue.this.onError(status);
          }
        });
  }

  /** Allows {@code count} more messages to be dispatched. */
  public void read(int count) {
    if (count < 0) {
      throw new IllegalArgumentException("count must be non-negative: " + count);
    }
    synchronized (this) {
      credits += count;
    }
    drain();
  }

  public CompletableFuture<Status> ackMessage(@Nonnull String ackId) {
    boolean released = releaseKey(ackId);
    CompletableFuture<Status> result = source.ackMessage(ackId);
    if (released) {
      drain();
    }
    return result;
  }

  public CompletableFuture<Status> nackMessage(@Nonnull String ackId) {
    boolean released = releaseKey(ackId);
    CompletableFuture<Status> result = source.nackMessage(ackId);
    if (released) {
      drain();
    }
    return result;
  }

  /**
   * Stops dispatching, nacks every buffered message in one call and shuts down the source.
   *
   * <p>Messages already handed to the callback are not affected; they can still be acked or
   * nacked.
   */
  public void shutdown() {
    List<String> buffered = new ArrayList<>();
    synchronized (this) {
      if (shutdown) {
        return;
      }
      shutdown = true;
      for (PendingMessage message : ready) {
        buffered.add(message.ackId());
      }
      for (Deque<PendingMessage> waiting : waitingByKey.values()) {
        for (PendingMessage message : waiting) {
          buffered.add(message.ackId());
        }
      }
      ready.clear();
      waitingByKey.clear();
    }
    if (!buffered.isEmpty()) {
      logger.debug("Nacking {} buffered messages on shutdown", buffered.size());
      source.bulkNack(buffered);
    }
    source.shutdown();
  }

  /** Returns the number of messages waiting to be dispatched. */
  public synchronized int size() {
    int size = ready.size();
    for (Deque<PendingMessage> waiting : waitingByKey.values()) {
      size += waiting.size();
    }
    return size;
  }

  private void onBatch(StreamingPullResponse response) {
    boolean nack;
    synchronized (this) {
      nack = shutdown;
      if (!nack) {
        for (ReceivedMessage received : response.getReceivedMessagesList()) {
          enqueue(new PendingMessage(received));
        }
      }
    }
    if (nack) {
      source.bulkNack(
          response.getReceivedMessagesList().stream()
              .map(ReceivedMessage::getAckId)
              .collect(Collectors.toList()));
      return;
    }
    drain();
  }

  private void onError(Status status) {
    logger.error("Message source failed: {}", status);
    coordinator.markAsShutdown(MessageDispatchQueue.class.getSimpleName(), status);
    shutdown();
  }

  // Requires the lock.
  private void enqueue(PendingMessage message) {
    String key = message.orderingKey();
    if (key.isEmpty()) {
      ready.add(message);
      return;
    }
    if (busyKeys.add(key)) {
      keyByAckId.put(message.ackId(), key);
      ready.add(message);
      return;
    }
    waitingByKey.computeIfAbsent(key, k -> new ArrayDeque<>()).add(message);
  }

  /** Releases the next message of the ordering key of {@code ackId}, if any. */
  private synchronized boolean releaseKey(String ackId) {
    String key = keyByAckId.remove(ackId);
    if (key == null) {
      return false;
    }
    Deque<PendingMessage> waiting = waitingByKey.get(key);
    PendingMessage next = waiting == null ? null : waiting.poll();
    if (next == null) {
      waitingByKey.remove(key);
      busyKeys.remove(key);
      return false;
    }
    if (waiting.isEmpty()) {
      waitingByKey.remove(key);
    }
    keyByAckId.put(next.ackId(), key);
    ready.add(next);
    return true;
  }

  private void drain() {
    synchronized (this) {
      if (draining) {
        return;
      }
      draining = true;
    }
    while (true) {
      PendingMessage next;
      MessageCallback current;
      synchronized (this) {
        if (shutdown || credits <= 0 || ready.isEmpty()) {
          draining = false;
          return;
        }
        next = ready.poll();
        --credits;
        current = callback;
      }
      try {
        current.onMessage(next);
      } catch (RuntimeException e) {
        synchronized (this) {
          draining = false;
        }
        throw e;
      }
    }
  }
}
