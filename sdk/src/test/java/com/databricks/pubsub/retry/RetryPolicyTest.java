package com.databricks.pubsub.retry;

import static org.junit.jupiter.api.Assertions.*;

import com.databricks.pubsub.FakeClock;
import io.grpc.Status;
import java.time.Duration;
import org.junit.jupiter.api.Test;

/** Tests for the retry and backoff policies. */
class RetryPolicyTest {

  // ==================== Error classification ====================

  @Test
  void testTransientCodes() {
    assertTrue(GrpcErrorHandling.isTransient(Status.Code.UNAVAILABLE));
    assertTrue(GrpcErrorHandling.isTransient(Status.Code.DEADLINE_EXCEEDED));
    assertTrue(GrpcErrorHandling.isTransient(Status.Code.RESOURCE_EXHAUSTED));
    assertFalse(GrpcErrorHandling.isTransient(Status.Code.NOT_FOUND));
    assertFalse(GrpcErrorHandling.isTransient(Status.Code.OK));
  }

  @Test
  void testPermanentStatuses() {
    assertTrue(GrpcErrorHandling.isPermanent(Status.PERMISSION_DENIED));
    assertTrue(GrpcErrorHandling.isPermanent(Status.NOT_FOUND));
    assertFalse(GrpcErrorHandling.isPermanent(Status.UNAVAILABLE));
    assertFalse(GrpcErrorHandling.isPermanent(Status.OK));
  }

  // ==================== LimitedErrorCountRetryPolicy ====================

  @Test
  void testLimitedErrorCount_RetriesUpToLimit() {
    RetryPolicy policy = new LimitedErrorCountRetryPolicy(2);

    assertTrue(policy.onFailure(Status.UNAVAILABLE));
    assertTrue(policy.onFailure(Status.UNAVAILABLE));
    assertFalse(policy.onFailure(Status.UNAVAILABLE));
    assertTrue(policy.isExhausted());
  }

  @Test
  void testLimitedErrorCount_PermanentFailureStopsAtOnce() {
    RetryPolicy policy = new LimitedErrorCountRetryPolicy(5);

    assertFalse(policy.onFailure(Status.PERMISSION_DENIED));
    assertFalse(policy.isExhausted());
  }

  @Test
  void testLimitedErrorCount_ZeroNeverRetries() {
    assertFalse(new LimitedErrorCountRetryPolicy(0).onFailure(Status.UNAVAILABLE));
  }

  @Test
  void testLimitedErrorCount_RejectsNegative() {
    assertThrows(IllegalArgumentException.class, () -> new LimitedErrorCountRetryPolicy(-1));
  }

  // ==================== LimitedTimeRetryPolicy ====================

  @Test
  void testLimitedTime_RetriesUntilDeadline() {
    FakeClock clock = new FakeClock();
    LimitedTimeRetryPolicy policy = new LimitedTimeRetryPolicy(Duration.ofSeconds(30), clock);

    assertEquals(clock.instant().plusSeconds(30), policy.deadline());
    assertTrue(policy.onFailure(Status.UNAVAILABLE));
    clock.advance(Duration.ofSeconds(29));
    assertTrue(policy.onFailure(Status.UNAVAILABLE));
    clock.advance(Duration.ofSeconds(1));
    assertFalse(policy.onFailure(Status.UNAVAILABLE));
    assertTrue(policy.isExhausted());
  }

  @Test
  void testLimitedTime_PermanentFailureStopsAtOnce() {
    LimitedTimeRetryPolicy policy =
        new LimitedTimeRetryPolicy(Duration.ofMinutes(1), new FakeClock());

    assertFalse(policy.onFailure(Status.INVALID_ARGUMENT));
  }

  @Test
  void testLimitedTime_RejectsNegative() {
    assertThrows(
        IllegalArgumentException.class, () -> new LimitedTimeRetryPolicy(Duration.ofSeconds(-1)));
  }

  // ==================== ExponentialBackoffPolicy ====================

  @Test
  void testExponentialBackoff_GrowsToMaximum() {
    BackoffPolicy backoff =
        new ExponentialBackoffPolicy(Duration.ofMillis(100), Duration.ofMillis(250), 2.0);

    assertEquals(Duration.ofMillis(100), backoff.nextDelay());
    assertEquals(Duration.ofMillis(200), backoff.nextDelay());
    assertEquals(Duration.ofMillis(250), backoff.nextDelay());
    assertEquals(Duration.ofMillis(250), backoff.nextDelay());
  }

  @Test
  void testExponentialBackoff_ScalingOfOneIsConstant() {
    BackoffPolicy backoff =
        new ExponentialBackoffPolicy(Duration.ofMillis(50), Duration.ofSeconds(1), 1.0);

    assertEquals(Duration.ofMillis(50), backoff.nextDelay());
    assertEquals(Duration.ofMillis(50), backoff.nextDelay());
  }

  @Test
  void testExponentialBackoff_RejectsInvalidArguments() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new ExponentialBackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(1), 0.5));
    assertThrows(
        IllegalArgumentException.class,
        () -> new ExponentialBackoffPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1), 1.3));
  }
}
