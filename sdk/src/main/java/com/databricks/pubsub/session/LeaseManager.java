package com.databricks.pubsub.session;

import com.databricks.pubsub.ReceivedMessage;
import com.databricks.pubsub.StreamingPullResponse;
import com.databricks.pubsub.SubscriberOptions;
import com.databricks.pubsub.stream.BatchCallback;
import com.databricks.pubsub.stream.BatchSource;
import io.grpc.Status;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the leases of received messages alive until the application settles them, or until their
 * handling deadline passes.
 *
 * <p>Every received message gets a {@link Lease}. A self-rescheduling timer extends all eligible
 * leases with a single call to the source below, always ahead of their estimated server deadline.
 * Messages within a second of their handling deadline are left to expire; an extension of zero
 * seconds would be a nack.
 *
 * <p>On shutdown every lease still tracked is nacked so the broker can redeliver the message.
 */
public class LeaseManager implements BatchSource {
  private static final Logger logger = LoggerFactory.getLogger(LeaseManager.class);

  /** Refreshes are scheduled this long before the estimated server deadline. */
  static final Duration REFRESH_SLACK = Duration.ofSeconds(2);

  private static final Duration MIN_EXTENSION = Duration.ofSeconds(1);
  private static final String TIMER_OP = "refresh-timer";
  private static final String REFRESH_OP = "refresh";

  private final BatchSource child;
  private final ScheduledExecutorService scheduler;
  private final ShutdownCoordinator coordinator;
  private final SubscriberOptions options;
  private final Clock clock;

  private final Map<String, Lease> leases = new LinkedHashMap<>();
  private BatchCallback callback;
  private boolean shutdown = false;
  private boolean refreshing = false;
  @Nullable private Instant refreshRequestedDuringRefresh;
  @Nullable private ScheduledFuture<?> refreshTimer;
  @Nullable private Instant refreshAt;
  private long timerGeneration = 0;

  public LeaseManager(
      @Nonnull BatchSource child,
      @Nonnull ScheduledExecutorService scheduler,
      @Nonnull ShutdownCoordinator coordinator,
      @Nonnull SubscriberOptions options,
      @Nonnull Clock clock) {
    this.child = Objects.requireNonNull(child, "child cannot be null");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
    this.coordinator = Objects.requireNonNull(coordinator, "coordinator cannot be null");
    this.options = Objects.requireNonNull(options, "options cannot be null");
    this.clock = Objects.requireNonNull(clock, "clock cannot be null");
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
            LeaseManager.this.onBatch(response);
          }

          @Override
          public void onError(Status status) {
            LeaseManager.this.onError(status);
          }
        });
  }

  @Override
  public void pull() {
    child.pull();
  }

  @Override
  public void shutdown() {
    ScheduledFuture<?> timer;
    List<String> ackIds;
    synchronized (this) {
      if (shutdown) {
        return;
      }
      shutdown = true;
      timer = refreshTimer;
      refreshTimer = null;
      refreshAt = null;
      ++timerGeneration;
      ackIds = new ArrayList<>(leases.keySet());
      leases.clear();
    }
    if (timer != null && timer.cancel(false)) {
      coordinator.finishedOperation(TIMER_OP);
    }
    if (!ackIds.isEmpty()) {
      logger.debug("Nacking {} leased messages on shutdown", ackIds.size());
      child.bulkNack(ackIds);
    }
    child.shutdown();
  }

  @Override
  public CompletableFuture<Status> ackMessage(@Nonnull String ackId) {
    synchronized (this) {
      leases.remove(ackId);
    }
    return child.ackMessage(ackId);
  }

  @Override
  public CompletableFuture<Status> nackMessage(@Nonnull String ackId) {
    synchronized (this) {
      leases.remove(ackId);
    }
    return child.nackMessage(ackId);
  }

  @Override
  public CompletableFuture<Status> bulkNack(@Nonnull List<String> ackIds) {
    synchronized (this) {
      for (String ackId : ackIds) {
        leases.remove(ackId);
      }
    }
    return child.bulkNack(ackIds);
  }

  @Override
  public CompletableFuture<Status> extendLeases(
      @Nonnull List<String> ackIds, @Nonnull Duration extension) {
    return child.extendLeases(ackIds, extension);
  }

  /** Returns a snapshot of the tracked leases, in arrival order. */
  synchronized List<Lease> leases() {
    return new ArrayList<>(leases.values());
  }

  private void onBatch(StreamingPullResponse response) {
    Instant now = clock.instant();
    Duration streamDeadline = options.streamAckDeadline();
    boolean nack;
    BatchCallback current;
    synchronized (this) {
      nack = shutdown;
      current = callback;
      if (!nack) {
        for (ReceivedMessage message : response.getReceivedMessagesList()) {
          leases.put(
              message.getAckId(),
              new Lease(
                  message.getAckId(),
                  now.plus(streamDeadline),
                  now.plus(options.maxHandlingTime())));
        }
      }
    }
    if (nack) {
      child.bulkNack(
          response.getReceivedMessagesList().stream()
              .map(ReceivedMessage::getAckId)
              .collect(Collectors.toList()));
      return;
    }
    ensureRefreshBy(now.plus(streamDeadline).minus(REFRESH_SLACK));
    current.onBatch(response);
  }

  private void onError(Status status) {
    BatchCallback current;
    synchronized (this) {
      current = callback;
    }
    current.onError(status);
  }

  /** Makes sure a refresh runs no later than {@code when}. */
  private void ensureRefreshBy(Instant when) {
    ScheduledFuture<?> previous;
    long generation;
    synchronized (this) {
      if (shutdown) {
        return;
      }
      if (refreshing) {
        if (refreshRequestedDuringRefresh == null || when.isBefore(refreshRequestedDuringRefresh)) {
          refreshRequestedDuringRefresh = when;
        }
        return;
      }
      if (refreshAt != null && !refreshAt.isAfter(when)) {
        return;
      }
      previous = refreshTimer;
      refreshTimer = null;
      refreshAt = when;
      generation = ++timerGeneration;
    }
    if (previous != null && previous.cancel(false)) {
      coordinator.finishedOperation(TIMER_OP);
    }
    long delayMillis = Math.max(0, Duration.between(clock.instant(), when).toMillis());
    logger.debug("Next lease refresh in {} ms", delayMillis);
    boolean started =
        coordinator.startOperation(
            TIMER_OP,
            () -> {
              try {
                ScheduledFuture<?> timer =
                    scheduler.schedule(
                        () -> onRefreshTimer(generation), delayMillis, TimeUnit.MILLISECONDS);
                synchronized (this) {
                  if (generation == timerGeneration && refreshAt != null) {
                    refreshTimer = timer;
                  }
                }
              } catch (RejectedExecutionException e) {
                logger.debug("Lease refresh not scheduled: executor shut down");
                clearRefreshAt(generation);
                coordinator.finishedOperation(TIMER_OP);
              }
            });
    if (!started) {
      clearRefreshAt(generation);
    }
  }

  private synchronized void clearRefreshAt(long generation) {
    if (generation == timerGeneration) {
      refreshAt = null;
    }
  }

  private void onRefreshTimer(long generation) {
    boolean stale;
    synchronized (this) {
      stale = generation != timerGeneration || shutdown;
      if (!stale) {
        refreshTimer = null;
        refreshAt = null;
      }
    }
    if (!stale) {
      refresh();
    }
    coordinator.finishedOperation(TIMER_OP);
  }

  /** Extends every eligible lease and schedules the next refresh. */
  void refresh() {
    Instant now = clock.instant();
    List<String> ackIds = new ArrayList<>();
    Duration extension = options.maxLeaseExtension();
    synchronized (this) {
      if (shutdown) {
        return;
      }
      for (Lease lease : leases.values()) {
        Duration remaining = Duration.between(now, lease.handlingDeadline());
        if (remaining.compareTo(MIN_EXTENSION) < 0) {
          continue;
        }
        ackIds.add(lease.ackId());
        if (remaining.compareTo(extension) < 0) {
          extension = remaining;
        }
      }
      refreshing = true;
    }
    // Whole seconds, so never less than MIN_EXTENSION.
    Duration wholeSeconds = Duration.ofSeconds(extension.getSeconds());
    Instant newDeadline = now.plus(wholeSeconds);
    Instant nextRefresh = nextRefresh(now, wholeSeconds);
    if (ackIds.isEmpty()) {
      onRefreshDone(ackIds, newDeadline, nextRefresh, Status.OK);
      return;
    }
    logger.debug("Extending {} leases by {}s", ackIds.size(), wholeSeconds.getSeconds());
    boolean started =
        coordinator.startOperation(
            REFRESH_OP,
            () ->
                child
                    .extendLeases(ackIds, wholeSeconds)
                    .whenComplete(
                        (status, error) -> {
                          Status result =
                              error != null
                                  ? Status.fromThrowable(error)
                                  : (status == null ? Status.UNKNOWN : status);
                          onRefreshDone(ackIds, newDeadline, nextRefresh, result);
                          coordinator.finishedOperation(REFRESH_OP);
                        }));
    if (!started) {
      synchronized (this) {
        refreshing = false;
        refreshRequestedDuringRefresh = null;
      }
    }
  }

  private static Instant nextRefresh(Instant now, Duration extension) {
    if (extension.compareTo(REFRESH_SLACK.multipliedBy(2)) <= 0) {
      return now.plus(extension.dividedBy(2));
    }
    return now.plus(extension).minus(REFRESH_SLACK);
  }

  private void onRefreshDone(
      List<String> ackIds, Instant newDeadline, Instant nextRefresh, Status status) {
    Instant next = nextRefresh;
    boolean idle;
    synchronized (this) {
      refreshing = false;
      if (refreshRequestedDuringRefresh != null && refreshRequestedDuringRefresh.isBefore(next)) {
        next = refreshRequestedDuringRefresh;
      }
      refreshRequestedDuringRefresh = null;
      if (status.isOk()) {
        for (String ackId : ackIds) {
          Lease lease = leases.get(ackId);
          if (lease != null) {
            lease.extendTo(newDeadline);
          }
        }
      }
      idle = leases.isEmpty();
    }
    if (!status.isOk()) {
      logger.warn("Lease extension for {} messages failed: {}", ackIds.size(), status);
    }
    // The next batch schedules a refresh again.
    if (!idle) {
      ensureRefreshBy(next);
    }
  }
}
