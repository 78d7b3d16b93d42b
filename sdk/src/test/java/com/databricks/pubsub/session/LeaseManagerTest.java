package com.databricks.pubsub.session;

import static com.databricks.pubsub.session.FakeBatchSource.batch;
import static org.junit.jupiter.api.Assertions.*;

import com.databricks.pubsub.FakeClock;
import com.databricks.pubsub.ManualScheduler;
import com.databricks.pubsub.StreamingPullResponse;
import com.databricks.pubsub.SubscriberOptions;
import com.databricks.pubsub.stream.BatchCallback;
import io.grpc.Status;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for {@link LeaseManager}. */
class LeaseManagerTest {

  private FakeBatchSource child;
  private ManualScheduler scheduler;
  private ShutdownCoordinator coordinator;
  private FakeClock clock;
  private Instant t0;
  private final List<StreamingPullResponse> forwarded = new ArrayList<>();

  @BeforeEach
  void setUp() {
    child = new FakeBatchSource();
    scheduler = new ManualScheduler();
    coordinator = new ShutdownCoordinator("test");
    clock = new FakeClock();
    t0 = clock.instant();
  }

  private LeaseManager newManager(Duration maxLeaseExtension) {
    SubscriberOptions options =
        SubscriberOptions.builder()
            .setMinLeaseExtension(Duration.ofSeconds(10))
            .setMaxLeaseExtension(maxLeaseExtension)
            .setMaxHandlingTime(Duration.ofSeconds(60))
            .build();
    LeaseManager manager =
        new LeaseManager(child, scheduler.executor(), coordinator, options, clock);
    manager.start(
        new BatchCallback() {
          @Override
          public void onBatch(StreamingPullResponse response) {
            forwarded.add(response);
          }

          @Override
          public void onError(Status status) {}
        });
    return manager;
  }

  // ==================== Tracking ====================

  @Test
  void testBatch_CreatesLeasesAndSchedulesRefresh() {
    LeaseManager manager = newManager(Duration.ofSeconds(30));

    child.deliver(batch("a1", "a2"));

    List<Lease> leases = manager.leases();
    assertEquals(2, leases.size());
    assertEquals("a1", leases.get(0).ackId());
    assertEquals(t0.plusSeconds(10), leases.get(0).estimatedServerDeadline());
    assertEquals(t0.plusSeconds(60), leases.get(0).handlingDeadline());
    assertEquals(1, forwarded.size());
    assertEquals(1, scheduler.pendingCount());
    assertEquals(8_000, scheduler.nextDelayMillis());
  }

  @Test
  void testSecondBatch_KeepsEarlierTimer() {
    newManager(Duration.ofSeconds(30));
    child.deliver(batch("a1"));
    clock.advance(Duration.ofSeconds(3));

    child.deliver(batch("a2"));

    assertEquals(1, scheduler.pendingCount());
    assertEquals(8_000, scheduler.nextDelayMillis());
  }

  @Test
  void testAckAndNack_RemoveLeases() {
    LeaseManager manager = newManager(Duration.ofSeconds(30));
    child.deliver(batch("a1", "a2", "a3"));

    manager.ackMessage("a1");
    manager.nackMessage("a2");

    assertEquals(1, manager.leases().size());
    assertEquals("a3", manager.leases().get(0).ackId());
    assertEquals(List.of("a1"), child.acked());
    assertEquals(List.of("a2"), child.nacked());
  }

  // ==================== Refresh ====================

  @Test
  void testRefresh_ExtendsAllLeasesInOneCall() {
    LeaseManager manager = newManager(Duration.ofSeconds(30));
    child.deliver(batch("a1", "a2"));

    scheduler.runNext();

    assertEquals(List.of(List.of("a1", "a2")), child.extendedIds());
    assertEquals(Duration.ofSeconds(30), child.extensions().get(0));
    assertEquals(t0.plusSeconds(30), manager.leases().get(0).estimatedServerDeadline());
    assertEquals(1, scheduler.pendingCount());
    assertEquals(28_000, scheduler.nextDelayMillis());
  }

  @Test
  void testRefresh_ShortExtensionRefreshesAtHalfway() {
    newManager(Duration.ofSeconds(4));
    child.deliver(batch("a1"));

    scheduler.runNext();

    assertEquals(Duration.ofSeconds(4), child.extensions().get(0));
    assertEquals(2_000, scheduler.nextDelayMillis());
  }

  @Test
  void testRefresh_CappedByRemainingHandlingTime() {
    LeaseManager manager = newManager(Duration.ofSeconds(30));
    child.deliver(batch("a1"));
    clock.advance(Duration.ofMillis(54_500));

    manager.refresh();

    // 5.5 seconds remain, rounded down to whole seconds.
    assertEquals(Duration.ofSeconds(5), child.extensions().get(0));
  }

  @Test
  void testRefresh_SkipsLeasesNearHandlingDeadline() {
    LeaseManager manager = newManager(Duration.ofSeconds(30));
    child.deliver(batch("a1"));
    clock.advance(Duration.ofSeconds(30));
    child.deliver(batch("a2"));
    clock.advance(Duration.ofMillis(29_500));

    manager.refresh();

    assertEquals(List.of(List.of("a2")), child.extendedIds());
    assertEquals(Duration.ofSeconds(30), child.extensions().get(0));
    // The expired lease stays tracked; the application may still settle it.
    assertEquals(2, manager.leases().size());
  }

  @Test
  void testRefresh_NeverSendsZeroExtension() {
    LeaseManager manager = newManager(Duration.ofSeconds(30));
    child.deliver(batch("a1"));
    clock.advance(Duration.ofMillis(59_200));

    manager.refresh();

    assertTrue(child.extensions().isEmpty());
  }

  @Test
  void testRefresh_NoLeasesLeavesTimerIdle() {
    LeaseManager manager = newManager(Duration.ofSeconds(30));
    child.deliver(batch("a1"));
    manager.ackMessage("a1");

    scheduler.runNext();

    assertTrue(child.extensions().isEmpty());
    assertEquals(0, scheduler.pendingCount());
    assertEquals(0, coordinator.outstandingOperations());
  }

  @Test
  void testFailedExtension_KeepsDeadlineAndReschedules() {
    LeaseManager manager = newManager(Duration.ofSeconds(30));
    child.holdExtensions();
    child.deliver(batch("a1"));
    scheduler.runNext();

    child.completeExtension(Status.UNAVAILABLE);

    assertEquals(t0.plusSeconds(10), manager.leases().get(0).estimatedServerDeadline());
    assertEquals(1, scheduler.pendingCount());
  }

  @Test
  void testBatchDuringRefresh_RequestsEarlierRefresh() {
    newManager(Duration.ofSeconds(30));
    child.holdExtensions();
    child.deliver(batch("a1"));
    scheduler.runNext();
    assertEquals(0, scheduler.pendingCount());

    child.deliver(batch("a2"));
    assertEquals(0, scheduler.pendingCount());
    child.completeExtension(Status.OK);

    assertEquals(1, scheduler.pendingCount());
    assertEquals(8_000, scheduler.nextDelayMillis());
  }

  // ==================== Shutdown ====================

  @Test
  void testShutdown_NacksOutstandingLeases() {
    LeaseManager manager = newManager(Duration.ofSeconds(30));
    child.deliver(batch("a1", "a2"));
    manager.ackMessage("a1");

    manager.shutdown();
    manager.shutdown();

    assertEquals(List.of(List.of("a2")), child.bulkNacks());
    assertEquals(1, child.shutdownCount());
    assertEquals(0, scheduler.pendingCount());
    assertEquals(0, coordinator.outstandingOperations());
    assertTrue(manager.leases().isEmpty());
  }

  @Test
  void testShutdown_WithoutLeasesSendsNoNack() {
    LeaseManager manager = newManager(Duration.ofSeconds(30));

    manager.shutdown();

    assertTrue(child.bulkNacks().isEmpty());
    assertEquals(1, child.shutdownCount());
  }

  @Test
  void testBatchAfterShutdown_IsNacked() {
    LeaseManager manager = newManager(Duration.ofSeconds(30));
    manager.shutdown();

    child.deliver(batch("late"));

    assertTrue(forwarded.isEmpty());
    assertEquals(List.of(List.of("late")), child.bulkNacks());
    assertEquals(0, scheduler.pendingCount());
  }
}
