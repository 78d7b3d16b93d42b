package com.databricks.pubsub;

import static org.junit.jupiter.api.Assertions.*;

import com.databricks.pubsub.retry.LimitedErrorCountRetryPolicy;
import com.databricks.pubsub.retry.LimitedTimeRetryPolicy;
import java.time.Duration;
import org.junit.jupiter.api.Test;

/** Tests for {@link SubscriberOptions}. */
class SubscriberOptionsTest {

  // ==================== Defaults ====================

  @Test
  void testDefaults() {
    SubscriberOptions options = SubscriberOptions.getDefault();

    assertEquals(1000, options.maxOutstandingMessages());
    assertEquals(100L * 1024 * 1024, options.maxOutstandingBytes());
    assertEquals(500, options.outstandingMessagesLowWatermark());
    assertEquals(50L * 1024 * 1024, options.outstandingBytesLowWatermark());
    assertEquals(Duration.ofSeconds(10), options.minLeaseExtension());
    assertEquals(Duration.ofSeconds(600), options.maxLeaseExtension());
    assertEquals(Duration.ofSeconds(600), options.maxHandlingTime());
    assertEquals(Duration.ofSeconds(5), options.shutdownPollingPeriod());
    assertEquals(Duration.ofSeconds(30), options.streamKeepAlivePeriod());
    assertTrue(options.maxConcurrency() >= 1);
    assertTrue(options.retryPolicy().get() instanceof LimitedTimeRetryPolicy);
    assertEquals(Duration.ofMillis(100), options.backoffPolicy().get().nextDelay());
  }

  @Test
  void testPolicySuppliers_ReturnFreshInstances() {
    SubscriberOptions options = SubscriberOptions.getDefault();

    assertNotSame(options.retryPolicy().get(), options.retryPolicy().get());
    assertNotSame(options.backoffPolicy().get(), options.backoffPolicy().get());
  }

  // ==================== Builder ====================

  @Test
  void testBuilder_CustomValues() {
    SubscriberOptions options =
        SubscriberOptions.builder()
            .setMaxOutstandingMessages(10)
            .setMaxOutstandingBytes(4096)
            .setOutstandingMessagesLowWatermark(3)
            .setOutstandingBytesLowWatermark(1024)
            .setMaxHandlingTime(Duration.ofMinutes(2))
            .setMaxConcurrency(4)
            .setRetryPolicy(() -> new LimitedErrorCountRetryPolicy(3))
            .build();

    assertEquals(10, options.maxOutstandingMessages());
    assertEquals(4096, options.maxOutstandingBytes());
    assertEquals(3, options.outstandingMessagesLowWatermark());
    assertEquals(1024, options.outstandingBytesLowWatermark());
    assertEquals(Duration.ofMinutes(2), options.maxHandlingTime());
    assertEquals(4, options.maxConcurrency());
    assertTrue(options.retryPolicy().get() instanceof LimitedErrorCountRetryPolicy);
  }

  @Test
  void testBuilder_LowWatermarksDefaultToHalf() {
    SubscriberOptions options =
        SubscriberOptions.builder()
            .setMaxOutstandingMessages(9)
            .setMaxOutstandingBytes(100)
            .build();

    assertEquals(4, options.outstandingMessagesLowWatermark());
    assertEquals(50, options.outstandingBytesLowWatermark());
  }

  @Test
  void testBuilder_LowWatermarkClampedToHighWatermark() {
    SubscriberOptions options =
        SubscriberOptions.builder()
            .setMaxOutstandingMessages(5)
            .setOutstandingMessagesLowWatermark(50)
            .build();

    assertEquals(5, options.outstandingMessagesLowWatermark());
  }

  @Test
  void testToBuilder_PreservesValues() {
    SubscriberOptions original =
        SubscriberOptions.builder()
            .setMaxOutstandingMessages(42)
            .setStreamKeepAlivePeriod(Duration.ofSeconds(7))
            .build();

    SubscriberOptions copy = original.toBuilder().setMaxConcurrency(2).build();

    assertEquals(42, copy.maxOutstandingMessages());
    assertEquals(Duration.ofSeconds(7), copy.streamKeepAlivePeriod());
    assertEquals(2, copy.maxConcurrency());
  }

  @Test
  void testBuilder_RejectsInvalidValues() {
    assertThrows(
        IllegalArgumentException.class,
        () -> SubscriberOptions.builder().setMaxOutstandingMessages(0));
    assertThrows(
        IllegalArgumentException.class,
        () -> SubscriberOptions.builder().setMaxOutstandingBytes(0));
    assertThrows(
        IllegalArgumentException.class,
        () -> SubscriberOptions.builder().setOutstandingMessagesLowWatermark(-1));
    assertThrows(
        IllegalArgumentException.class,
        () -> SubscriberOptions.builder().setMaxHandlingTime(Duration.ZERO));
    assertThrows(
        IllegalArgumentException.class,
        () -> SubscriberOptions.builder().setMaxLeaseExtension(Duration.ofMillis(500)));
    assertThrows(
        IllegalArgumentException.class, () -> SubscriberOptions.builder().setMaxConcurrency(0));
    assertThrows(
        NullPointerException.class, () -> SubscriberOptions.builder().setRetryPolicy(null));
  }

  // ==================== Stream ack deadline ====================

  @Test
  void testStreamAckDeadline_ClampedToBrokerRange() {
    assertEquals(
        Duration.ofSeconds(10),
        SubscriberOptions.builder()
            .setMinLeaseExtension(Duration.ofSeconds(2))
            .build()
            .streamAckDeadline());
    assertEquals(
        Duration.ofSeconds(45),
        SubscriberOptions.builder()
            .setMinLeaseExtension(Duration.ofSeconds(45))
            .build()
            .streamAckDeadline());
    assertEquals(
        Duration.ofSeconds(600),
        SubscriberOptions.builder()
            .setMinLeaseExtension(Duration.ofHours(1))
            .build()
            .streamAckDeadline());
  }
}
