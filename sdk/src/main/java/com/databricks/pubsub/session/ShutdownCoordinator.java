package com.databricks.pubsub.session;

import io.grpc.Status;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the named asynchronous operations of a session and delivers a single result once the
 * session is shut down and every operation has finished.
 *
 * <p>Components wrap each asynchronous step (a stream read, a timer, a unary call) in {@link
 * #startOperation} and call {@link #finishedOperation} from its completion. Once {@link
 * #markAsShutdown} has been called no new operation starts, and the future returned by {@link
 * #start} completes when the outstanding count reaches zero.
 *
 * <p>Operation names are only used for logging; mismatched names are accepted.
 *
 * <p>This class is thread-safe. Operation functions always run without holding the lock.
 */
public class ShutdownCoordinator {
  private static final Logger logger = LoggerFactory.getLogger(ShutdownCoordinator.class);

  private final String sessionName;

  private CompletableFuture<Status> result = new CompletableFuture<>();
  private int outstandingOperations = 0;
  private boolean shutdown = false;
  private boolean signaled = false;
  private Status shutdownStatus = Status.OK;

  public ShutdownCoordinator() {
    this("session");
  }

  public ShutdownCoordinator(@Nonnull String sessionName) {
    this.sessionName = Objects.requireNonNull(sessionName, "sessionName cannot be null");
  }

  /**
   * Registers the completion signal of the session.
   *
   * @param promise the future to complete with the shutdown status
   * @return {@code promise}, completed exactly once
   */
  public CompletableFuture<Status> start(@Nonnull CompletableFuture<Status> promise) {
    Objects.requireNonNull(promise, "promise cannot be null");
    Status ready = null;
    synchronized (this) {
      result = promise;
      if (signaled) {
        ready = shutdownStatus;
      }
    }
    if (ready != null) {
      promise.complete(ready);
    }
    return promise;
  }

  /**
   * Runs {@code fn} on the calling thread as a tracked operation.
   *
   * @return false if shutdown was already requested, in which case {@code fn} did not run
   */
  public boolean startOperation(@Nonnull String name, @Nonnull Runnable fn) {
    synchronized (this) {
      if (shutdown) {
        logger.debug("[{}] operation {} refused, shutting down", sessionName, name);
        return false;
      }
      ++outstandingOperations;
      logger.debug(
          "[{}] operation {} started, outstanding={}", sessionName, name, outstandingOperations);
    }
    fn.run();
    return true;
  }

  /**
   * Schedules {@code fn} on {@code executor} as a tracked operation.
   *
   * <p>If the executor rejects the task the operation is rolled back and the call returns false.
   *
   * @return false if {@code fn} will not run
   */
  public boolean startAsyncOperation(
      @Nonnull String name, @Nonnull Executor executor, @Nonnull Runnable fn) {
    synchronized (this) {
      if (shutdown) {
        logger.debug("[{}] async operation {} refused, shutting down", sessionName, name);
        return false;
      }
      ++outstandingOperations;
      logger.debug(
          "[{}] async operation {} started, outstanding={}",
          sessionName,
          name,
          outstandingOperations);
    }
    try {
      executor.execute(fn);
      return true;
    } catch (RejectedExecutionException e) {
      logger.debug("[{}] async operation {} rejected by executor", sessionName, name);
      finishedOperation(name);
      return false;
    }
  }

  /**
   * Records the completion of an operation started with {@link #startOperation} or {@link
   * #startAsyncOperation}.
   *
   * @return true if this call completed the shutdown of the session
   */
  public boolean finishedOperation(@Nonnull String name) {
    CompletableFuture<Status> toComplete;
    Status status;
    synchronized (this) {
      if (outstandingOperations > 0) {
        --outstandingOperations;
      }
      logger.debug(
          "[{}] operation {} finished, outstanding={}", sessionName, name, outstandingOperations);
      if (!shutdown || outstandingOperations > 0 || signaled) {
        return false;
      }
      signaled = true;
      toComplete = result;
      status = shutdownStatus;
    }
    logger.info("[{}] shutdown completed with status {}", sessionName, status.getCode());
    toComplete.complete(status);
    return true;
  }

  /**
   * Requests the shutdown of the session.
   *
   * <p>The first call sets the final status; later calls are ignored. If no operation is
   * outstanding the completion signal fires immediately, otherwise it fires from the last {@link
   * #finishedOperation}.
   *
   * @param reason a short description for the logs
   * @param status the final status of the session
   */
  public void markAsShutdown(@Nonnull String reason, @Nonnull Status status) {
    CompletableFuture<Status> toComplete;
    Status finalStatus;
    synchronized (this) {
      if (shutdown) {
        logger.debug("[{}] shutdown already requested, ignoring {}", sessionName, reason);
        return;
      }
      shutdown = true;
      shutdownStatus = status;
      logger.debug(
          "[{}] shutdown requested by {} with status {}, outstanding={}",
          sessionName,
          reason,
          status.getCode(),
          outstandingOperations);
      if (outstandingOperations > 0) {
        return;
      }
      signaled = true;
      toComplete = result;
      finalStatus = shutdownStatus;
    }
    logger.info("[{}] shutdown completed with status {}", sessionName, finalStatus.getCode());
    toComplete.complete(finalStatus);
  }

  public synchronized boolean isShutdown() {
    return shutdown;
  }

  synchronized int outstandingOperations() {
    return outstandingOperations;
  }
}
