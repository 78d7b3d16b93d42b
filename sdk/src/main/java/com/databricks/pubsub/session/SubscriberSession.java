package com.databricks.pubsub.session;

import com.databricks.pubsub.AckHandler;
import com.databricks.pubsub.MessageHandler;
import com.databricks.pubsub.SubscriberOptions;
import com.databricks.pubsub.stream.BatchSource;
import com.databricks.pubsub.stream.StreamingBatchSource;
import com.databricks.pubsub.stub.SubscriberStub;
import io.grpc.Status;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns one subscriber pipeline from start to completion.
 *
 * <p>The session wires a {@link StreamingBatchSource}, a {@link LeaseManager}, a {@link
 * FlowController} and a {@link MessageDispatchQueue} together and runs the application's {@link
 * MessageHandler} on the executor. Every handler run is an operation of the {@link
 * ShutdownCoordinator}, so the session does not complete while a handler is still running.
 *
 * <p>A periodic liveness timer runs on the same executor. The session ends in one of two ways:
 *
 * <ul>
 *   <li>The application calls {@link #shutdown()} or cancels the future returned by {@link
 *       #start()}. Buffered messages are nacked and the session completes once every outstanding
 *       operation, including running handlers and the liveness timer, has finished. The final
 *       status is OK unless the stream had already failed.
 *   <li>The executor shuts down. The liveness timer notices, or the owner of the executor calls
 *       {@link #onExecutorShutdown()} first. The pipeline is torn down at once, handlers that have
 *       not started are nacked, and the final status is {@link Status.Code#CANCELLED}.
 * </ul>
 *
 * <p>A permanent stream failure also ends the session; its status is the result of the session.
 */
public class SubscriberSession {
  private static final Logger logger = LoggerFactory.getLogger(SubscriberSession.class);

  private static final String TIMER_OP = "timer";
  private static final String HANDLER_OP = "handler";

  /** Lifecycle of the session. */
  public enum ShutdownState {
    NOT_STARTED,
    SHUTDOWN_BY_EXECUTOR,
    SHUTDOWN_BY_APPLICATION,
    COMPLETED
  }

  private final ShutdownCoordinator coordinator;
  private final ScheduledExecutorService executor;
  private final SubscriberOptions options;
  private final MessageHandler handler;
  private final MessageDispatchQueue queue;
  private final CompletableFuture<Status> result = new CompletableFuture<>();
  private final CompletableFuture<Status> completion = new CompletableFuture<>();
  // Handler runs submitted to the executor that have not started yet.
  private final Set<HandlerTask> queuedHandlers = new LinkedHashSet<>();

  private ShutdownState state = ShutdownState.NOT_STARTED;
  private boolean started = false;
  private boolean executorShutdown = false;
  @Nullable private LivenessTick pendingTick;

  /**
   * Creates a session that pulls from {@code subscription} over {@code stub}.
   *
   * @param stub the transport to the broker
   * @param executor runs timers, continuations and the message handler
   * @param subscription the full subscription name
   * @param options the pipeline configuration
   * @param handler the application callback
   * @return a session that has not been started yet
   */
  public static SubscriberSession create(
      @Nonnull SubscriberStub stub,
      @Nonnull ScheduledExecutorService executor,
      @Nonnull String subscription,
      @Nonnull SubscriberOptions options,
      @Nonnull MessageHandler handler) {
    Clock clock = Clock.systemUTC();
    ShutdownCoordinator coordinator = new ShutdownCoordinator(subscription);
    StreamingBatchSource source =
        new StreamingBatchSource(
            stub,
            executor,
            coordinator,
            subscription,
            UUID.randomUUID().toString(),
            options,
            clock);
    return new SubscriberSession(source, coordinator, executor, options, handler, clock);
  }

  SubscriberSession(
      @Nonnull BatchSource source,
      @Nonnull ShutdownCoordinator coordinator,
      @Nonnull ScheduledExecutorService executor,
      @Nonnull SubscriberOptions options,
      @Nonnull MessageHandler handler,
      @Nonnull Clock clock) {
    this.coordinator = Objects.requireNonNull(coordinator, "coordinator cannot be null");
    this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    this.options = Objects.requireNonNull(options, "options cannot be null");
    this.handler = Objects.requireNonNull(handler, "handler cannot be null");
    LeaseManager leaseManager = new LeaseManager(source, executor, coordinator, options, clock);
    FlowController flowController = new FlowController(leaseManager, options);
    this.queue = new MessageDispatchQueue(flowController, coordinator);
  }

  /**
   * Starts delivering messages.
   *
   * <p>Cancelling the returned future shuts the session down, like {@link #shutdown()}. A cancelled
   * future no longer carries the final status; {@link #completion()} still does.
   *
   * @return a future that completes with the final status of the session
   * @throws IllegalStateException if the session was already started
   */
  public CompletableFuture<Status> start() {
    synchronized (this) {
      if (started) {
        throw new IllegalStateException("SubscriberSession already started");
      }
      started = true;
    }
    CompletableFuture<Status> done = coordinator.start(new CompletableFuture<>());
    done.whenComplete(
        (status, error) -> {
          synchronized (this) {
            state = ShutdownState.COMPLETED;
          }
          if (error != null) {
            result.completeExceptionally(error);
            completion.completeExceptionally(error);
          } else {
            result.complete(status);
            completion.complete(status);
          }
        });
    result.whenComplete(
        (status, error) -> {
          if (result.isCancelled()) {
            logger.debug("Session future cancelled by the application");
            onShutdownByApplication();
          }
        });

    queue.start(this::dispatch);
    queue.read(options.maxConcurrency());
    scheduleTimer();
    return result;
  }

  /** Requests an orderly shutdown. Messages already handed to the handler can still be settled. */
  public void shutdown() {
    onShutdownByApplication();
  }

  /**
   * Tears the session down because its executor is about to stop.
   *
   * <p>Call this before shutting the executor down: tasks the executor drops would otherwise keep
   * the session from completing. The final status is {@link Status.Code#CANCELLED} unless the
   * session was already shutting down. Handlers that are running can still settle their message.
   */
  public void onExecutorShutdown() {
    boolean first;
    synchronized (this) {
      first = state == ShutdownState.NOT_STARTED;
      if (first) {
        state = ShutdownState.SHUTDOWN_BY_EXECUTOR;
      }
    }
    if (first) {
      logger.info("Executor shut down, tearing down subscriber session");
      coordinator.markAsShutdown(
          "executor", Status.CANCELLED.withDescription("executor shut down"));
      queue.shutdown();
    }
    LivenessTick tick;
    List<HandlerTask> abandoned;
    synchronized (this) {
      executorShutdown = true;
      tick = pendingTick;
      pendingTick = null;
      abandoned = new ArrayList<>(queuedHandlers);
    }
    if (tick != null) {
      tick.release();
    }
    for (HandlerTask task : abandoned) {
      task.abandon();
    }
  }

  /**
   * Returns a future that completes with the final status of the session.
   *
   * <p>Cancelling the future returned by {@link #start()} does not cancel this one.
   */
  public CompletableFuture<Status> completion() {
    return completion;
  }

  public synchronized ShutdownState state() {
    return state;
  }

  private synchronized boolean isCompleted() {
    return state == ShutdownState.COMPLETED;
  }

  private void onShutdownByApplication() {
    synchronized (this) {
      if (state != ShutdownState.NOT_STARTED) {
        return;
      }
      state = ShutdownState.SHUTDOWN_BY_APPLICATION;
    }
    logger.info("Shutting down subscriber session at the application's request");
    coordinator.markAsShutdown("application", Status.OK);
    queue.shutdown();
  }

  private void scheduleTimer() {
    coordinator.startOperation(
        TIMER_OP,
        () -> {
          LivenessTick tick = new LivenessTick();
          boolean releaseNow;
          synchronized (this) {
            pendingTick = tick;
            releaseNow = executorShutdown;
          }
          try {
            tick.future =
                executor.schedule(
                    tick, options.shutdownPollingPeriod().toMillis(), TimeUnit.MILLISECONDS);
          } catch (RejectedExecutionException e) {
            onExecutorShutdown();
            tick.release();
            return;
          }
          if (releaseNow) {
            tick.release();
          }
        });
  }

  private void onTimer() {
    if (executor.isShutdown()) {
      onExecutorShutdown();
    } else {
      scheduleTimer();
    }
    coordinator.finishedOperation(TIMER_OP);
  }

  private void dispatch(PendingMessage message) {
    HandlerTask task = new HandlerTask(message);
    if (!coordinator.startAsyncOperation(HANDLER_OP, command -> submit(task), task)) {
      logger.warn("Cannot run handler for {}, nacking the message", message.ackId());
      task.ackHandler.nack();
    }
  }

  private void submit(HandlerTask task) {
    synchronized (this) {
      if (executorShutdown) {
        throw new RejectedExecutionException("executor shut down");
      }
      queuedHandlers.add(task);
    }
    try {
      executor.execute(task);
    } catch (RejectedExecutionException e) {
      if (task.claim()) {
        throw e;
      }
      // Already abandoned by onExecutorShutdown(), which settled the message.
    }
  }

  private void runHandler(PendingMessage message, SessionAckHandler ackHandler) {
    try {
      handler.onMessage(message.message(), ackHandler);
    } catch (RuntimeException e) {
      logger.error("Message handler failed for {}, nacking the message", message.ackId(), e);
      ackHandler.nack();
    }
  }

  /** One pending run of the liveness timer; whoever claims it first finishes its operation. */
  private final class LivenessTick implements Runnable {
    private final AtomicBoolean claimed = new AtomicBoolean(false);
    @Nullable private volatile ScheduledFuture<?> future;

    @Override
    public void run() {
      if (claimed.compareAndSet(false, true)) {
        onTimer();
      }
    }

    void release() {
      if (!claimed.compareAndSet(false, true)) {
        return;
      }
      ScheduledFuture<?> scheduled = future;
      if (scheduled != null) {
        scheduled.cancel(false);
      }
      coordinator.finishedOperation(TIMER_OP);
    }
  }

  /** One handler run, either executed or abandoned, never both. */
  private final class HandlerTask implements Runnable {
    private final PendingMessage message;
    private final SessionAckHandler ackHandler;
    private final AtomicBoolean claimed = new AtomicBoolean(false);

    HandlerTask(PendingMessage message) {
      this.message = message;
      this.ackHandler = new SessionAckHandler(message);
    }

    boolean claim() {
      if (!claimed.compareAndSet(false, true)) {
        return false;
      }
      synchronized (SubscriberSession.this) {
        queuedHandlers.remove(this);
      }
      return true;
    }

    @Override
    public void run() {
      if (!claim()) {
        return;
      }
      try {
        runHandler(message, ackHandler);
      } finally {
        coordinator.finishedOperation(HANDLER_OP);
      }
    }

    void abandon() {
      if (!claim()) {
        return;
      }
      logger.warn("Handler for {} never started: executor shut down", message.ackId());
      ackHandler.nack();
      coordinator.finishedOperation(HANDLER_OP);
    }
  }

  private class SessionAckHandler implements AckHandler {
    private final PendingMessage message;
    private final AtomicBoolean settled = new AtomicBoolean(false);

    SessionAckHandler(PendingMessage message) {
      this.message = message;
    }

    @Override
    public CompletableFuture<Status> ack() {
      Status rejected = checkSettle();
      if (rejected != null) {
        return CompletableFuture.completedFuture(rejected);
      }
      CompletableFuture<Status> status = queue.ackMessage(message.ackId());
      queue.read(1);
      return status;
    }

    @Override
    public CompletableFuture<Status> nack() {
      Status rejected = checkSettle();
      if (rejected != null) {
        return CompletableFuture.completedFuture(rejected);
      }
      CompletableFuture<Status> status = queue.nackMessage(message.ackId());
      queue.read(1);
      return status;
    }

    @Override
    public String ackId() {
      return message.ackId();
    }

    @Override
    public int deliveryAttempt() {
      return message.deliveryAttempt();
    }

    @Nullable
    private Status checkSettle() {
      if (!settled.compareAndSet(false, true)) {
        return Status.FAILED_PRECONDITION.withDescription(
            "message " + message.ackId() + " already acked or nacked");
      }
      if (isCompleted()) {
        return Status.FAILED_PRECONDITION.withDescription("subscriber session has completed");
      }
      return null;
    }
  }
}
