package com.databricks.pubsub.stream;

import com.databricks.pubsub.AcknowledgeRequest;
import com.databricks.pubsub.ModifyAckDeadlineRequest;
import com.databricks.pubsub.ReceivedMessage;
import com.databricks.pubsub.StreamState;
import com.databricks.pubsub.StreamingPullRequest;
import com.databricks.pubsub.StreamingPullResponse;
import com.databricks.pubsub.SubscriberOptions;
import com.databricks.pubsub.retry.BackoffPolicy;
import com.databricks.pubsub.retry.LeaseRetryPolicy;
import com.databricks.pubsub.retry.RetryPolicy;
import com.databricks.pubsub.session.ShutdownCoordinator;
import com.databricks.pubsub.stub.PullStream;
import com.databricks.pubsub.stub.SubscriberStub;
import io.grpc.Status;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The bottom of the subscriber pipeline: a reconnecting streaming pull.
 *
 * <p>The source keeps one logical stream open to the broker. A new stream goes through the connect
 * sequence (start, write the initial request, read the first response) and becomes {@link
 * StreamState#ACTIVE} once the first response arrives. Failures during the connect sequence are
 * retried under the configured retry and backoff policies; once the retry policy gives up the
 * failure is reported through {@link BatchCallback#onError} and the session is marked as shut
 * down. An established stream that breaks goes through {@link StreamState#DISCONNECTING} and
 * {@link StreamState#FINISHING} and is then replaced by a new one.
 *
 * <p>Acks, nacks and lease extensions are unary calls. When the subscription has exactly-once
 * delivery enabled they are retried per ack id with {@link LeaseRetryPolicy}; otherwise they are
 * sent once.
 *
 * <p>Every asynchronous step is tracked by the {@link ShutdownCoordinator}: the {@code stream}
 * operation lasts from the start of a connect sequence until the stream is finished, so the
 * session cannot complete while a stream is open.
 */
public class StreamingBatchSource implements BatchSource {
  private static final Logger logger = LoggerFactory.getLogger(StreamingBatchSource.class);

  /** The broker rejects acknowledge and modify-ack-deadline requests with more ids. */
  public static final int MAX_ACK_IDS_PER_REQUEST = 2500;

  private static final String STREAM_OP = "stream";
  private static final String READ_OP = "read";
  private static final String BACKOFF_OP = "backoff";
  private static final String KEEPALIVE_OP = "keepalive";

  private final SubscriberStub stub;
  private final ScheduledExecutorService scheduler;
  private final ShutdownCoordinator coordinator;
  private final String subscription;
  private final String clientId;
  private final SubscriberOptions options;
  private final Clock clock;

  private BatchCallback callback;
  private StreamState state = StreamState.NULL;
  @Nullable private PullStream stream;
  private boolean readPending = false;
  private boolean writePending = false;
  private boolean pullRequested = false;
  private boolean shutdown = false;
  @Nullable private ScheduledFuture<?> backoffTimer;
  @Nullable private ScheduledFuture<?> keepAliveTimer;
  private volatile boolean exactlyOnceDelivery = false;

  public StreamingBatchSource(
      @Nonnull SubscriberStub stub,
      @Nonnull ScheduledExecutorService scheduler,
      @Nonnull ShutdownCoordinator coordinator,
      @Nonnull String subscription,
      @Nonnull String clientId,
      @Nonnull SubscriberOptions options,
      @Nonnull Clock clock) {
    this.stub = Objects.requireNonNull(stub, "stub cannot be null");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
    this.coordinator = Objects.requireNonNull(coordinator, "coordinator cannot be null");
    this.subscription = Objects.requireNonNull(subscription, "subscription cannot be null");
    this.clientId = Objects.requireNonNull(clientId, "clientId cannot be null");
    this.options = Objects.requireNonNull(options, "options cannot be null");
    this.clock = Objects.requireNonNull(clock, "clock cannot be null");
  }

  // ==================== Stream lifecycle ====================

  @Override
  public void start(@Nonnull BatchCallback callback) {
    Objects.requireNonNull(callback, "callback cannot be null");
    synchronized (this) {
      if (this.callback != null) {
        throw new IllegalStateException("StreamingBatchSource already started");
      }
      this.callback = callback;
    }
    logger.debug("Starting streaming pull for {}", subscription);
    startStream(options.retryPolicy().get(), options.backoffPolicy().get());
  }

  @Override
  public void pull() {
    synchronized (this) {
      pullRequested = true;
    }
    readLoop();
  }

  @Override
  public void shutdown() {
    ScheduledFuture<?> backoff;
    ScheduledFuture<?> keepAlive;
    PullStream connecting = null;
    synchronized (this) {
      if (shutdown) {
        return;
      }
      shutdown = true;
      backoff = backoffTimer;
      backoffTimer = null;
      keepAlive = keepAliveTimer;
      keepAliveTimer = null;
      if (state == StreamState.NULL) {
        connecting = stream;
      }
    }
    logger.debug("Shutting down streaming pull for {}", subscription);
    if (backoff != null && backoff.cancel(false)) {
      coordinator.finishedOperation(BACKOFF_OP);
    }
    if (keepAlive != null && keepAlive.cancel(false)) {
      coordinator.finishedOperation(KEEPALIVE_OP);
    }
    if (connecting != null) {
      connecting.cancel();
    }
    shutdownStream();
  }

  /** Returns the current state of the stream. */
  public synchronized StreamState state() {
    return state;
  }

  /** Returns true once a response has reported that the subscription uses exactly-once delivery. */
  public boolean exactlyOnceDelivery() {
    return exactlyOnceDelivery;
  }

  private void startStream(RetryPolicy retryPolicy, BackoffPolicy backoffPolicy) {
    boolean started =
        coordinator.startOperation(STREAM_OP, () -> connect(retryPolicy, backoffPolicy));
    if (!started) {
      logger.debug("Not opening a new stream for {}, session is shutting down", subscription);
    }
  }

  private void connect(RetryPolicy retryPolicy, BackoffPolicy backoffPolicy) {
    PullStream newStream = stub.streamingPull();
    if (newStream == null) {
      terminate(Status.UNKNOWN.withDescription("null stream returned by the transport"));
      return;
    }
    boolean cancelNow;
    synchronized (this) {
      stream = newStream;
      cancelNow = shutdown;
    }
    if (cancelNow) {
      newStream.cancel();
    }
    newStream
        .start()
        .whenComplete(
            (started, startError) -> {
              if (startError != null || !Boolean.TRUE.equals(started)) {
                onConnectFailure(newStream, retryPolicy, backoffPolicy);
                return;
              }
              newStream
                  .write(initialRequest())
                  .whenComplete(
                      (written, writeError) -> {
                        if (writeError != null || !Boolean.TRUE.equals(written)) {
                          onConnectFailure(newStream, retryPolicy, backoffPolicy);
                          return;
                        }
                        synchronized (this) {
                          readPending = true;
                        }
                        newStream
                            .read()
                            .whenComplete(
                                (response, readError) -> {
                                  if (readError != null
                                      || response == null
                                      || !response.isPresent()) {
                                    synchronized (this) {
                                      readPending = false;
                                    }
                                    onConnectFailure(newStream, retryPolicy, backoffPolicy);
                                    return;
                                  }
                                  onFirstResponse(response.get());
                                });
                      });
            });
  }

  StreamingPullRequest initialRequest() {
    return StreamingPullRequest.newBuilder()
        .setSubscription(subscription)
        .setStreamAckDeadlineSeconds((int) options.streamAckDeadline().getSeconds())
        .setClientId(clientId)
        .setMaxOutstandingMessages(options.maxOutstandingMessages())
        .setMaxOutstandingBytes(options.maxOutstandingBytes())
        .build();
  }

  private void onConnectFailure(
      PullStream failed, RetryPolicy retryPolicy, BackoffPolicy backoffPolicy) {
    failed
        .finish()
        .whenComplete(
            (status, error) -> {
              Status finalStatus = error != null ? Status.fromThrowable(error) : status;
              if (finalStatus == null) {
                finalStatus = Status.UNKNOWN.withDescription("missing stream status");
              } else if (finalStatus.isOk()) {
                finalStatus = Status.UNAVAILABLE.withDescription("stream closed during setup");
              }
              onConnectFinished(finalStatus, retryPolicy, backoffPolicy);
            });
  }

  private void onConnectFinished(
      Status status, RetryPolicy retryPolicy, BackoffPolicy backoffPolicy) {
    synchronized (this) {
      stream = null;
    }
    if (isShutdown()) {
      logger.debug("Stream setup for {} ended during shutdown: {}", subscription, status);
      coordinator.finishedOperation(STREAM_OP);
      return;
    }
    if (!retryPolicy.onFailure(status)) {
      terminate(status);
      return;
    }
    Duration delay = backoffPolicy.nextDelay();
    logger.warn(
        "Stream setup for {} failed with {}, retrying in {} ms",
        subscription,
        status,
        delay.toMillis());
    coordinator.startOperation(
        BACKOFF_OP, () -> scheduleReconnect(delay, retryPolicy, backoffPolicy));
    coordinator.finishedOperation(STREAM_OP);
  }

  private void scheduleReconnect(
      Duration delay, RetryPolicy retryPolicy, BackoffPolicy backoffPolicy) {
    try {
      ScheduledFuture<?> timer =
          scheduler.schedule(
              () -> onBackoffExpired(retryPolicy, backoffPolicy),
              delay.toMillis(),
              TimeUnit.MILLISECONDS);
      synchronized (this) {
        backoffTimer = timer;
      }
    } catch (RejectedExecutionException e) {
      logger.warn("Cannot schedule stream reconnection for {}: executor shut down", subscription);
      Status status = Status.CANCELLED.withDescription("executor shut down");
      coordinator.markAsShutdown(StreamingBatchSource.class.getSimpleName(), status);
      notifyError(status);
      coordinator.finishedOperation(BACKOFF_OP);
    }
  }

  private void onBackoffExpired(RetryPolicy retryPolicy, BackoffPolicy backoffPolicy) {
    synchronized (this) {
      backoffTimer = null;
    }
    if (!isShutdown()) {
      startStream(retryPolicy, backoffPolicy);
    }
    coordinator.finishedOperation(BACKOFF_OP);
  }

  /** Reports a permanent failure; the source produces nothing after this. */
  private void terminate(Status status) {
    synchronized (this) {
      stream = null;
    }
    logger.error("Streaming pull for {} failed permanently: {}", subscription, status);
    coordinator.markAsShutdown(StreamingBatchSource.class.getSimpleName(), status);
    notifyError(status);
    coordinator.finishedOperation(STREAM_OP);
  }

  private void onFirstResponse(StreamingPullResponse response) {
    synchronized (this) {
      state = StreamState.ACTIVE;
      // The first batch answers any pull issued while connecting.
      pullRequested = false;
    }
    logger.info("Streaming pull for {} is active", subscription);
    handleResponse(response);
    boolean active;
    synchronized (this) {
      readPending = false;
      active = state == StreamState.ACTIVE;
    }
    if (!active || isShutdown()) {
      shutdownStream();
      return;
    }
    scheduleKeepAlive();
    readLoop();
  }

  private void readLoop() {
    PullStream current;
    synchronized (this) {
      if (state != StreamState.ACTIVE || readPending || !pullRequested) {
        return;
      }
      readPending = true;
      pullRequested = false;
      current = stream;
    }
    boolean started =
        coordinator.startOperation(
            READ_OP, () -> current.read().whenComplete(this::onRead));
    if (!started) {
      synchronized (this) {
        readPending = false;
      }
      shutdownStream();
    }
  }

  private void onRead(
      @Nullable Optional<StreamingPullResponse> response, @Nullable Throwable error) {
    coordinator.finishedOperation(READ_OP);
    if (error != null || response == null || !response.isPresent()) {
      logger.debug("Read on streaming pull for {} ended the stream", subscription);
      synchronized (this) {
        readPending = false;
      }
      shutdownStream();
      return;
    }
    handleResponse(response.get());
    boolean active;
    synchronized (this) {
      readPending = false;
      active = state == StreamState.ACTIVE;
    }
    if (!active || isShutdown()) {
      shutdownStream();
      return;
    }
    readLoop();
  }

  private void handleResponse(StreamingPullResponse response) {
    if (response.hasSubscriptionProperties()) {
      exactlyOnceDelivery = response.getSubscriptionProperties().getExactlyOnceDeliveryEnabled();
    }
    if (isShutdown()) {
      List<String> ackIds =
          response.getReceivedMessagesList().stream()
              .map(ReceivedMessage::getAckId)
              .collect(Collectors.toList());
      logger.debug("Nacking {} messages received during shutdown", ackIds.size());
      bulkNack(ackIds);
      return;
    }
    BatchCallback current;
    synchronized (this) {
      current = callback;
    }
    current.onBatch(response);
  }

  private void scheduleKeepAlive() {
    coordinator.startOperation(
        KEEPALIVE_OP,
        () -> {
          try {
            ScheduledFuture<?> timer =
                scheduler.schedule(
                    this::onKeepAlive,
                    options.streamKeepAlivePeriod().toMillis(),
                    TimeUnit.MILLISECONDS);
            synchronized (this) {
              keepAliveTimer = timer;
            }
          } catch (RejectedExecutionException e) {
            logger.debug("Keep-alive for {} not scheduled: executor shut down", subscription);
            coordinator.finishedOperation(KEEPALIVE_OP);
          }
        });
  }

  private void onKeepAlive() {
    PullStream current = null;
    boolean reschedule;
    synchronized (this) {
      keepAliveTimer = null;
      reschedule = state == StreamState.ACTIVE && !shutdown;
      if (reschedule && !writePending) {
        writePending = true;
        current = stream;
      }
    }
    // A failed write cancels the keep-alive scheduled here along with the stream.
    if (reschedule) {
      scheduleKeepAlive();
    }
    if (current != null) {
      current
          .write(StreamingPullRequest.getDefaultInstance())
          .whenComplete((ok, error) -> onWrite(error == null && Boolean.TRUE.equals(ok)));
    }
    coordinator.finishedOperation(KEEPALIVE_OP);
  }

  private void onWrite(boolean ok) {
    boolean active;
    synchronized (this) {
      writePending = false;
      active = state == StreamState.ACTIVE;
    }
    if (!ok) {
      logger.debug("Keep-alive write on streaming pull for {} failed", subscription);
    }
    if (!ok || !active) {
      shutdownStream();
    }
  }

  /**
   * Moves an active stream towards {@link StreamState#FINISHING}. Called again whenever a pending
   * read or write completes, until nothing is in flight.
   */
  private void shutdownStream() {
    PullStream toCancel = null;
    PullStream toFinish = null;
    synchronized (this) {
      if (state == StreamState.ACTIVE) {
        state = StreamState.DISCONNECTING;
        logger.debug("Streaming pull for {} is disconnecting", subscription);
      }
      if (state != StreamState.DISCONNECTING) {
        return;
      }
      if (readPending || writePending) {
        toCancel = stream;
      } else {
        state = StreamState.FINISHING;
        toFinish = stream;
      }
    }
    if (toCancel != null) {
      toCancel.cancel();
      return;
    }
    if (toFinish != null) {
      // No-op if the broker already closed the call.
      toFinish.cancel();
      toFinish
          .finish()
          .whenComplete(
              (status, error) -> onFinish(error != null ? Status.fromThrowable(error) : status));
    }
  }

  private void onFinish(@Nullable Status status) {
    ScheduledFuture<?> keepAlive;
    synchronized (this) {
      state = StreamState.NULL;
      stream = null;
      keepAlive = keepAliveTimer;
      keepAliveTimer = null;
    }
    if (keepAlive != null && keepAlive.cancel(false)) {
      coordinator.finishedOperation(KEEPALIVE_OP);
    }
    if (isShutdown()) {
      logger.info("Streaming pull for {} closed", subscription);
      coordinator.finishedOperation(STREAM_OP);
      return;
    }
    logger.warn("Streaming pull for {} closed with {}, reconnecting", subscription, status);
    startStream(options.retryPolicy().get(), options.backoffPolicy().get());
    coordinator.finishedOperation(STREAM_OP);
  }

  private boolean isShutdown() {
    synchronized (this) {
      if (shutdown) {
        return true;
      }
    }
    return coordinator.isShutdown();
  }

  private void notifyError(Status status) {
    BatchCallback current;
    synchronized (this) {
      current = callback;
    }
    if (current != null) {
      current.onError(status);
    }
  }

  // ==================== Settle operations ====================

  @Override
  public CompletableFuture<Status> ackMessage(@Nonnull String ackId) {
    return settle(
        Collections.singletonList(ackId),
        ids ->
            stub.acknowledge(
                AcknowledgeRequest.newBuilder()
                    .setSubscription(subscription)
                    .addAllAckIds(ids)
                    .build()),
        "ack",
        options.maxHandlingTime());
  }

  @Override
  public CompletableFuture<Status> nackMessage(@Nonnull String ackId) {
    return modifyAckDeadline(Collections.singletonList(ackId), 0, options.maxHandlingTime());
  }

  @Override
  public CompletableFuture<Status> bulkNack(@Nonnull List<String> ackIds) {
    return inChunks(
        ackIds, chunk -> modifyAckDeadline(chunk, 0, options.maxHandlingTime()), "nack");
  }

  /**
   * {@inheritDoc}
   *
   * <p>Under exactly-once delivery a failed extension is retried until {@code extension} has
   * elapsed, and never once the session is shutting down.
   */
  @Override
  public CompletableFuture<Status> extendLeases(
      @Nonnull List<String> ackIds, @Nonnull Duration extension) {
    int seconds = (int) extension.getSeconds();
    Duration budget =
        extension.compareTo(options.maxHandlingTime()) < 0 ? extension : options.maxHandlingTime();
    return inChunks(ackIds, chunk -> modifyAckDeadline(chunk, seconds, budget), "modack");
  }

  private CompletableFuture<Status> modifyAckDeadline(
      List<String> ackIds, int seconds, Duration retryBudget) {
    return settle(
        ackIds,
        ids ->
            stub.modifyAckDeadline(
                ModifyAckDeadlineRequest.newBuilder()
                    .setSubscription(subscription)
                    .addAllAckIds(ids)
                    .setAckDeadlineSeconds(seconds)
                    .build()),
        seconds == 0 ? "nack" : "modack",
        retryBudget);
  }

  /** Splits {@code ackIds} into requests the broker accepts and combines their results. */
  private CompletableFuture<Status> inChunks(
      List<String> ackIds,
      Function<List<String>, CompletableFuture<Status>> call,
      String operation) {
    if (ackIds.isEmpty()) {
      return CompletableFuture.completedFuture(Status.OK);
    }
    if (ackIds.size() <= MAX_ACK_IDS_PER_REQUEST) {
      return call.apply(new ArrayList<>(ackIds));
    }
    List<CompletableFuture<Status>> parts = new ArrayList<>();
    for (int i = 0; i < ackIds.size(); i += MAX_ACK_IDS_PER_REQUEST) {
      int end = Math.min(ackIds.size(), i + MAX_ACK_IDS_PER_REQUEST);
      parts.add(call.apply(new ArrayList<>(ackIds.subList(i, end))));
    }
    return CompletableFuture.allOf(parts.toArray(new CompletableFuture<?>[0]))
        .thenApply(
            ignored -> {
              for (CompletableFuture<Status> part : parts) {
                Status status = part.join();
                if (!status.isOk()) {
                  return Status.UNKNOWN.withDescription(
                      "one or more " + operation + " requests failed: " + status);
                }
              }
              return Status.OK;
            });
  }

  private CompletableFuture<Status> settle(
      List<String> ackIds,
      Function<List<String>, CompletableFuture<Void>> call,
      String operation,
      Duration retryBudget) {
    if (!exactlyOnceDelivery) {
      return call.apply(ackIds)
          .handle(
              (ignored, error) -> {
                if (error == null) {
                  return Status.OK;
                }
                Status status = Status.fromThrowable(unwrap(error));
                logger.warn("{} of {} messages failed: {}", operation, ackIds.size(), status);
                return status;
              });
    }
    Instant deadline = clock.instant().plus(retryBudget);
    List<LeaseRetryPolicy> policies = new ArrayList<>();
    for (String ackId : ackIds) {
      policies.add(new LeaseRetryPolicy(ackId, deadline, clock));
    }
    SettleCall settleCall =
        new SettleCall(call, operation, options.backoffPolicy().get(), operation.equals("modack"));
    attempt(settleCall, policies, Status.OK);
    return settleCall.result;
  }

  private void attempt(SettleCall settleCall, List<LeaseRetryPolicy> pending, Status firstFailure) {
    List<String> ids = pending.stream().map(LeaseRetryPolicy::ackId).collect(Collectors.toList());
    settleCall
        .call
        .apply(ids)
        .whenComplete(
            (ignored, error) -> {
              if (error == null) {
                settleCall.result.complete(firstFailure);
                return;
              }
              Throwable cause = unwrap(error);
              Status failure = firstFailure;
              List<LeaseRetryPolicy> retry = new ArrayList<>();
              for (LeaseRetryPolicy policy : pending) {
                switch (policy.classify(cause)) {
                  case RETRY:
                    retry.add(policy);
                    break;
                  case FAILED:
                    Status status = policy.failureStatus(cause);
                    logger.warn(
                        "{} of {} failed: {}", settleCall.operation, policy.ackId(), status);
                    if (failure.isOk()) {
                      failure = status;
                    }
                    break;
                  default:
                    break;
                }
              }
              if (retry.isEmpty()) {
                settleCall.result.complete(failure);
                return;
              }
              Status carried = failure.isOk() ? Status.fromThrowable(cause) : failure;
              if (settleCall.abandonOnShutdown && isShutdown()) {
                logger.debug(
                    "Not retrying {} of {} messages, shutting down",
                    settleCall.operation,
                    retry.size());
                settleCall.result.complete(carried);
                return;
              }
              Duration delay = settleCall.backoffPolicy.nextDelay();
              logger.debug(
                  "Retrying {} of {} messages in {} ms",
                  settleCall.operation,
                  retry.size(),
                  delay.toMillis());
              Status next = failure;
              try {
                scheduler.schedule(
                    () -> retryAttempt(settleCall, retry, next, carried),
                    delay.toMillis(),
                    TimeUnit.MILLISECONDS);
              } catch (RejectedExecutionException e) {
                settleCall.result.complete(carried);
              }
            });
  }

  private void retryAttempt(
      SettleCall settleCall, List<LeaseRetryPolicy> pending, Status firstFailure, Status carried) {
    if (settleCall.abandonOnShutdown && isShutdown()) {
      settleCall.result.complete(carried);
      return;
    }
    attempt(settleCall, pending, firstFailure);
  }

  /** One ack, nack or lease extension call and the state shared by its retries. */
  private static final class SettleCall {
    final Function<List<String>, CompletableFuture<Void>> call;
    final String operation;
    final BackoffPolicy backoffPolicy;
    // Lease extensions stop retrying once the session shuts down; acks and nacks do not.
    final boolean abandonOnShutdown;
    final CompletableFuture<Status> result = new CompletableFuture<>();

    SettleCall(
        Function<List<String>, CompletableFuture<Void>> call,
        String operation,
        BackoffPolicy backoffPolicy,
        boolean abandonOnShutdown) {
      this.call = call;
      this.operation = operation;
      this.backoffPolicy = backoffPolicy;
      this.abandonOnShutdown = abandonOnShutdown;
    }
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }
}
