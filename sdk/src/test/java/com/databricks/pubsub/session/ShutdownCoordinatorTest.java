package com.databricks.pubsub.session;

import static org.junit.jupiter.api.Assertions.*;

import io.grpc.Status;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

/** Tests for {@link ShutdownCoordinator}. */
class ShutdownCoordinatorTest {

  // ==================== Completion ====================

  @Test
  void testShutdownWithoutOperations_CompletesImmediately() {
    ShutdownCoordinator coordinator = new ShutdownCoordinator("test");
    CompletableFuture<Status> done = coordinator.start(new CompletableFuture<>());

    coordinator.markAsShutdown("test", Status.OK);

    assertTrue(done.isDone());
    assertEquals(Status.Code.OK, done.join().getCode());
    assertTrue(coordinator.isShutdown());
  }

  @Test
  void testShutdownWaitsForOutstandingOperations() {
    ShutdownCoordinator coordinator = new ShutdownCoordinator("test");
    CompletableFuture<Status> done = coordinator.start(new CompletableFuture<>());

    assertTrue(coordinator.startOperation("read", () -> {}));
    assertTrue(coordinator.startOperation("timer", () -> {}));
    coordinator.markAsShutdown("test", Status.CANCELLED);

    assertFalse(done.isDone());
    assertFalse(coordinator.finishedOperation("read"));
    assertFalse(done.isDone());
    assertTrue(coordinator.finishedOperation("timer"));
    assertEquals(Status.Code.CANCELLED, done.join().getCode());
  }

  @Test
  void testFirstShutdownStatusWins() {
    ShutdownCoordinator coordinator = new ShutdownCoordinator();
    CompletableFuture<Status> done = coordinator.start(new CompletableFuture<>());
    coordinator.startOperation("stream", () -> {});

    coordinator.markAsShutdown("stream", Status.PERMISSION_DENIED);
    coordinator.markAsShutdown("application", Status.OK);
    coordinator.finishedOperation("stream");

    assertEquals(Status.Code.PERMISSION_DENIED, done.join().getCode());
  }

  @Test
  void testStartAfterSignal_CompletesPromiseImmediately() {
    ShutdownCoordinator coordinator = new ShutdownCoordinator();
    coordinator.markAsShutdown("test", Status.UNAVAILABLE);

    CompletableFuture<Status> done = coordinator.start(new CompletableFuture<>());

    assertTrue(done.isDone());
    assertEquals(Status.Code.UNAVAILABLE, done.join().getCode());
  }

  @Test
  void testFinishedOperationWithoutShutdown_DoesNotComplete() {
    ShutdownCoordinator coordinator = new ShutdownCoordinator();
    CompletableFuture<Status> done = coordinator.start(new CompletableFuture<>());

    coordinator.startOperation("read", () -> {});
    assertFalse(coordinator.finishedOperation("read"));

    assertFalse(done.isDone());
    assertEquals(0, coordinator.outstandingOperations());
  }

  @Test
  void testExtraFinishedOperation_NeverGoesNegative() {
    ShutdownCoordinator coordinator = new ShutdownCoordinator();
    coordinator.finishedOperation("unknown");
    assertEquals(0, coordinator.outstandingOperations());

    coordinator.startOperation("read", () -> {});
    assertEquals(1, coordinator.outstandingOperations());
  }

  @Test
  void testCompletionSignalsOnlyOnce() {
    ShutdownCoordinator coordinator = new ShutdownCoordinator();
    CompletableFuture<Status> done = coordinator.start(new CompletableFuture<>());
    coordinator.startOperation("read", () -> {});
    coordinator.markAsShutdown("test", Status.OK);

    assertTrue(coordinator.finishedOperation("read"));
    assertFalse(coordinator.finishedOperation("read"));
    assertTrue(done.isDone());
  }

  // ==================== Operations ====================

  @Test
  void testStartOperationAfterShutdown_IsRefused() {
    ShutdownCoordinator coordinator = new ShutdownCoordinator();
    coordinator.markAsShutdown("test", Status.OK);
    AtomicBoolean ran = new AtomicBoolean(false);

    assertFalse(coordinator.startOperation("read", () -> ran.set(true)));

    assertFalse(ran.get());
    assertEquals(0, coordinator.outstandingOperations());
  }

  @Test
  void testStartOperation_RunsWithoutHoldingTheLock() {
    ShutdownCoordinator coordinator = new ShutdownCoordinator();
    AtomicBoolean holdsLock = new AtomicBoolean(true);

    coordinator.startOperation("read", () -> holdsLock.set(Thread.holdsLock(coordinator)));

    assertFalse(holdsLock.get());
  }

  @Test
  void testOperationMayFinishInline_CompletesShutdown() {
    ShutdownCoordinator coordinator = new ShutdownCoordinator();
    CompletableFuture<Status> done = coordinator.start(new CompletableFuture<>());
    coordinator.startOperation("stream", () -> {});
    coordinator.markAsShutdown("test", Status.OK);

    // An operation that started before shutdown may finish from within another callback.
    coordinator.finishedOperation("stream");

    assertTrue(done.isDone());
  }

  @Test
  void testStartAsyncOperation_RunsOnExecutor() {
    ShutdownCoordinator coordinator = new ShutdownCoordinator();
    AtomicReference<Runnable> submitted = new AtomicReference<>();
    Executor executor = submitted::set;
    AtomicBoolean ran = new AtomicBoolean(false);

    assertTrue(coordinator.startAsyncOperation("handler", executor, () -> ran.set(true)));

    assertFalse(ran.get());
    assertEquals(1, coordinator.outstandingOperations());
    submitted.get().run();
    assertTrue(ran.get());
  }

  @Test
  void testStartAsyncOperation_RejectedByExecutor_RollsBack() {
    ShutdownCoordinator coordinator = new ShutdownCoordinator();
    CompletableFuture<Status> done = coordinator.start(new CompletableFuture<>());
    Executor rejecting =
        command -> {
          throw new RejectedExecutionException("closed");
        };

    assertFalse(coordinator.startAsyncOperation("handler", rejecting, () -> {}));
    assertEquals(0, coordinator.outstandingOperations());

    coordinator.markAsShutdown("test", Status.OK);
    assertTrue(done.isDone());
  }
}
