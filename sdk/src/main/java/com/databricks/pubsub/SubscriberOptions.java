package com.databricks.pubsub;

import com.databricks.pubsub.retry.BackoffPolicy;
import com.databricks.pubsub.retry.ExponentialBackoffPolicy;
import com.databricks.pubsub.retry.LimitedTimeRetryPolicy;
import com.databricks.pubsub.retry.RetryPolicy;
import java.time.Duration;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.Supplier;
import javax.annotation.Nonnull;

/**
 * Configuration options for a subscriber session.
 *
 * <p>This class provides the settings that control flow control, lease management, shutdown
 * detection and reconnection of the streaming pull pipeline. Instances are immutable and are
 * passed explicitly to every component of the pipeline.
 *
 * <p>Use the builder pattern to create instances:
 *
 * <pre>{@code
 * SubscriberOptions options = SubscriberOptions.builder()
 *     .setMaxOutstandingMessages(500)
 *     .setMaxHandlingTime(Duration.ofMinutes(5))
 *     .build();
 * }</pre>
 */
public class SubscriberOptions {

  /** The broker accepts stream ack deadlines in this range. */
  public static final Duration MIN_STREAM_ACK_DEADLINE = Duration.ofSeconds(10);

  public static final Duration MAX_STREAM_ACK_DEADLINE = Duration.ofSeconds(600);

  private long maxOutstandingMessages = 1000;
  private long maxOutstandingBytes = 100L * 1024 * 1024;
  private long outstandingMessagesLowWatermark = maxOutstandingMessages / 2;
  private long outstandingBytesLowWatermark = maxOutstandingBytes / 2;
  private Duration minLeaseExtension = Duration.ofSeconds(10);
  private Duration maxLeaseExtension = Duration.ofSeconds(600);
  private Duration maxHandlingTime = Duration.ofSeconds(600);
  private Duration shutdownPollingPeriod = Duration.ofSeconds(5);
  private Duration streamKeepAlivePeriod = Duration.ofSeconds(30);
  private int maxConcurrency = Math.max(1, Runtime.getRuntime().availableProcessors());
  private Supplier<RetryPolicy> retryPolicy =
      () -> new LimitedTimeRetryPolicy(Duration.ofSeconds(60));
  private Supplier<BackoffPolicy> backoffPolicy =
      () -> new ExponentialBackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(60), 1.3);

  private SubscriberOptions() {}

  private SubscriberOptions(SubscriberOptionsBuilder builder) {
    this.maxOutstandingMessages = builder.maxOutstandingMessages;
    this.maxOutstandingBytes = builder.maxOutstandingBytes;
    this.outstandingMessagesLowWatermark =
        Math.min(
            builder.outstandingMessagesLowWatermark.orElse(builder.maxOutstandingMessages / 2),
            builder.maxOutstandingMessages);
    this.outstandingBytesLowWatermark =
        Math.min(
            builder.outstandingBytesLowWatermark.orElse(builder.maxOutstandingBytes / 2),
            builder.maxOutstandingBytes);
    this.minLeaseExtension = builder.minLeaseExtension;
    this.maxLeaseExtension = builder.maxLeaseExtension;
    this.maxHandlingTime = builder.maxHandlingTime;
    this.shutdownPollingPeriod = builder.shutdownPollingPeriod;
    this.streamKeepAlivePeriod = builder.streamKeepAlivePeriod;
    this.maxConcurrency = builder.maxConcurrency;
    this.retryPolicy = builder.retryPolicy;
    this.backoffPolicy = builder.backoffPolicy;
  }

  /**
   * Returns the high watermark for the number of messages buffered or being handled locally.
   *
   * <p>The pipeline stops pulling once this many messages are outstanding. The value is also sent
   * to the broker so it can apply its own flow control.
   *
   * @return the maximum number of outstanding messages
   */
  public long maxOutstandingMessages() {
    return maxOutstandingMessages;
  }

  /**
   * Returns the high watermark for the total size of messages buffered or being handled locally.
   *
   * @return the maximum number of outstanding bytes
   */
  public long maxOutstandingBytes() {
    return maxOutstandingBytes;
  }

  /**
   * Returns the message count at or below which pulling resumes after hitting the high watermark.
   *
   * <p>Never larger than {@link #maxOutstandingMessages()}.
   *
   * @return the low watermark for outstanding messages
   */
  public long outstandingMessagesLowWatermark() {
    return outstandingMessagesLowWatermark;
  }

  /**
   * Returns the byte count at or below which pulling resumes after hitting the high watermark.
   *
   * <p>Never larger than {@link #maxOutstandingBytes()}.
   *
   * @return the low watermark for outstanding bytes
   */
  public long outstandingBytesLowWatermark() {
    return outstandingBytesLowWatermark;
  }

  /**
   * Returns the minimum lease extension.
   *
   * <p>Sent to the broker as the stream ack deadline, and used as the initial estimate of the
   * server-side deadline of every received message.
   *
   * @return the minimum lease extension
   */
  public Duration minLeaseExtension() {
    return minLeaseExtension;
  }

  /**
   * Returns the maximum extension requested by a single lease-extension call.
   *
   * @return the maximum lease extension
   */
  public Duration maxLeaseExtension() {
    return maxLeaseExtension;
  }

  /**
   * Returns how long the pipeline keeps extending the lease of a message it received.
   *
   * <p>After this time the lease is left to expire and the broker may redeliver the message.
   *
   * @return the maximum handling time
   */
  public Duration maxHandlingTime() {
    return maxHandlingTime;
  }

  /**
   * Returns the period of the session liveness timer.
   *
   * @return the shutdown polling period
   */
  public Duration shutdownPollingPeriod() {
    return shutdownPollingPeriod;
  }

  /**
   * Returns the period between keep-alive writes on an active stream.
   *
   * @return the stream keep-alive period
   */
  public Duration streamKeepAlivePeriod() {
    return streamKeepAlivePeriod;
  }

  /**
   * Returns the maximum number of application callbacks running at the same time.
   *
   * @return the maximum callback concurrency
   */
  public int maxConcurrency() {
    return maxConcurrency;
  }

  /** Returns the factory for the retry policy of each stream connect sequence. */
  public Supplier<RetryPolicy> retryPolicy() {
    return retryPolicy;
  }

  /** Returns the factory for the backoff policy of each retried operation. */
  public Supplier<BackoffPolicy> backoffPolicy() {
    return backoffPolicy;
  }

  /**
   * Returns the stream ack deadline sent in the initial request, clamped to the range the broker
   * accepts.
   */
  public Duration streamAckDeadline() {
    if (minLeaseExtension.compareTo(MIN_STREAM_ACK_DEADLINE) < 0) {
      return MIN_STREAM_ACK_DEADLINE;
    }
    if (minLeaseExtension.compareTo(MAX_STREAM_ACK_DEADLINE) > 0) {
      return MAX_STREAM_ACK_DEADLINE;
    }
    return minLeaseExtension;
  }

  /**
   * Returns the default subscriber options.
   *
   * <p>Default values: maxOutstandingMessages: 1000, maxOutstandingBytes: 100MiB, low watermarks:
   * half the high watermarks, minLeaseExtension: 10s, maxLeaseExtension: 600s, maxHandlingTime:
   * 600s, shutdownPollingPeriod: 5s, streamKeepAlivePeriod: 30s, maxConcurrency: number of
   * processors, retry: 60s of transient failures, backoff: 100ms growing by 1.3 up to 60s.
   *
   * @return the default subscriber options
   */
  public static SubscriberOptions getDefault() {
    return new SubscriberOptions();
  }

  /**
   * Returns a new builder for creating SubscriberOptions.
   *
   * @return a new SubscriberOptionsBuilder
   */
  public static SubscriberOptionsBuilder builder() {
    return new SubscriberOptionsBuilder();
  }

  /**
   * Returns a builder initialized with this instance's values.
   *
   * @return a new builder pre-populated with this instance's values
   */
  public SubscriberOptionsBuilder toBuilder() {
    return new SubscriberOptionsBuilder()
        .setMaxOutstandingMessages(maxOutstandingMessages)
        .setMaxOutstandingBytes(maxOutstandingBytes)
        .setOutstandingMessagesLowWatermark(outstandingMessagesLowWatermark)
        .setOutstandingBytesLowWatermark(outstandingBytesLowWatermark)
        .setMinLeaseExtension(minLeaseExtension)
        .setMaxLeaseExtension(maxLeaseExtension)
        .setMaxHandlingTime(maxHandlingTime)
        .setShutdownPollingPeriod(shutdownPollingPeriod)
        .setStreamKeepAlivePeriod(streamKeepAlivePeriod)
        .setMaxConcurrency(maxConcurrency)
        .setRetryPolicy(retryPolicy)
        .setBackoffPolicy(backoffPolicy);
  }

  /**
   * Builder for creating SubscriberOptions instances.
   *
   * <p>All parameters have sensible defaults if not specified. Low watermarks that are not set
   * explicitly are derived from the high watermarks when {@link #build()} is called.
   */
  public static class SubscriberOptionsBuilder {
    private final SubscriberOptions defaultOptions = SubscriberOptions.getDefault();

    private long maxOutstandingMessages = defaultOptions.maxOutstandingMessages();
    private long maxOutstandingBytes = defaultOptions.maxOutstandingBytes();
    private OptionalLong outstandingMessagesLowWatermark = OptionalLong.empty();
    private OptionalLong outstandingBytesLowWatermark = OptionalLong.empty();
    private Duration minLeaseExtension = defaultOptions.minLeaseExtension();
    private Duration maxLeaseExtension = defaultOptions.maxLeaseExtension();
    private Duration maxHandlingTime = defaultOptions.maxHandlingTime();
    private Duration shutdownPollingPeriod = defaultOptions.shutdownPollingPeriod();
    private Duration streamKeepAlivePeriod = defaultOptions.streamKeepAlivePeriod();
    private int maxConcurrency = defaultOptions.maxConcurrency();
    private Supplier<RetryPolicy> retryPolicy = defaultOptions.retryPolicy();
    private Supplier<BackoffPolicy> backoffPolicy = defaultOptions.backoffPolicy();

    private SubscriberOptionsBuilder() {}

    /**
     * Sets the high watermark for outstanding messages.
     *
     * @param maxOutstandingMessages the maximum number of outstanding messages, at least 1
     * @return this builder for method chaining
     * @throws IllegalArgumentException if the value is less than 1
     */
    public SubscriberOptionsBuilder setMaxOutstandingMessages(long maxOutstandingMessages) {
      if (maxOutstandingMessages < 1) {
        throw new IllegalArgumentException(
            "maxOutstandingMessages must be positive: " + maxOutstandingMessages);
      }
      this.maxOutstandingMessages = maxOutstandingMessages;
      return this;
    }

    /**
     * Sets the high watermark for outstanding bytes.
     *
     * @param maxOutstandingBytes the maximum number of outstanding bytes, at least 1
     * @return this builder for method chaining
     * @throws IllegalArgumentException if the value is less than 1
     */
    public SubscriberOptionsBuilder setMaxOutstandingBytes(long maxOutstandingBytes) {
      if (maxOutstandingBytes < 1) {
        throw new IllegalArgumentException(
            "maxOutstandingBytes must be positive: " + maxOutstandingBytes);
      }
      this.maxOutstandingBytes = maxOutstandingBytes;
      return this;
    }

    /**
     * Sets the low watermark for outstanding messages. Values above the high watermark are clamped
     * to it.
     *
     * @param lowWatermark the message count at or below which pulling resumes
     * @return this builder for method chaining
     */
    public SubscriberOptionsBuilder setOutstandingMessagesLowWatermark(long lowWatermark) {
      if (lowWatermark < 0) {
        throw new IllegalArgumentException("lowWatermark must be non-negative: " + lowWatermark);
      }
      this.outstandingMessagesLowWatermark = OptionalLong.of(lowWatermark);
      return this;
    }

    /**
     * Sets the low watermark for outstanding bytes. Values above the high watermark are clamped to
     * it.
     *
     * @param lowWatermark the byte count at or below which pulling resumes
     * @return this builder for method chaining
     */
    public SubscriberOptionsBuilder setOutstandingBytesLowWatermark(long lowWatermark) {
      if (lowWatermark < 0) {
        throw new IllegalArgumentException("lowWatermark must be non-negative: " + lowWatermark);
      }
      this.outstandingBytesLowWatermark = OptionalLong.of(lowWatermark);
      return this;
    }

    /**
     * Sets the minimum lease extension.
     *
     * @param minLeaseExtension the minimum lease extension
     * @return this builder for method chaining
     */
    public SubscriberOptionsBuilder setMinLeaseExtension(@Nonnull Duration minLeaseExtension) {
      this.minLeaseExtension = requirePositive(minLeaseExtension, "minLeaseExtension");
      return this;
    }

    /**
     * Sets the maximum extension requested by a single lease-extension call.
     *
     * @param maxLeaseExtension the maximum lease extension, at least one second
     * @return this builder for method chaining
     */
    public SubscriberOptionsBuilder setMaxLeaseExtension(@Nonnull Duration maxLeaseExtension) {
      requirePositive(maxLeaseExtension, "maxLeaseExtension");
      if (maxLeaseExtension.getSeconds() < 1) {
        throw new IllegalArgumentException(
            "maxLeaseExtension must be at least one second: " + maxLeaseExtension);
      }
      this.maxLeaseExtension = maxLeaseExtension;
      return this;
    }

    /**
     * Sets how long the pipeline keeps extending the lease of a received message.
     *
     * @param maxHandlingTime the maximum handling time
     * @return this builder for method chaining
     */
    public SubscriberOptionsBuilder setMaxHandlingTime(@Nonnull Duration maxHandlingTime) {
      this.maxHandlingTime = requirePositive(maxHandlingTime, "maxHandlingTime");
      return this;
    }

    /**
     * Sets the period of the session liveness timer.
     *
     * @param shutdownPollingPeriod the polling period
     * @return this builder for method chaining
     */
    public SubscriberOptionsBuilder setShutdownPollingPeriod(
        @Nonnull Duration shutdownPollingPeriod) {
      this.shutdownPollingPeriod = requirePositive(shutdownPollingPeriod, "shutdownPollingPeriod");
      return this;
    }

    /**
     * Sets the period between keep-alive writes on an active stream.
     *
     * @param streamKeepAlivePeriod the keep-alive period
     * @return this builder for method chaining
     */
    public SubscriberOptionsBuilder setStreamKeepAlivePeriod(
        @Nonnull Duration streamKeepAlivePeriod) {
      this.streamKeepAlivePeriod = requirePositive(streamKeepAlivePeriod, "streamKeepAlivePeriod");
      return this;
    }

    /**
     * Sets the maximum number of application callbacks running at the same time.
     *
     * @param maxConcurrency the maximum concurrency, at least 1
     * @return this builder for method chaining
     */
    public SubscriberOptionsBuilder setMaxConcurrency(int maxConcurrency) {
      if (maxConcurrency < 1) {
        throw new IllegalArgumentException("maxConcurrency must be positive: " + maxConcurrency);
      }
      this.maxConcurrency = maxConcurrency;
      return this;
    }

    /**
     * Sets the factory for retry policies. A new policy is created for every connect sequence.
     *
     * @param retryPolicy the retry policy factory
     * @return this builder for method chaining
     */
    public SubscriberOptionsBuilder setRetryPolicy(@Nonnull Supplier<RetryPolicy> retryPolicy) {
      this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy cannot be null");
      return this;
    }

    /**
     * Sets the factory for backoff policies. A new policy is created for every retried operation.
     *
     * @param backoffPolicy the backoff policy factory
     * @return this builder for method chaining
     */
    public SubscriberOptionsBuilder setBackoffPolicy(
        @Nonnull Supplier<BackoffPolicy> backoffPolicy) {
      this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "backoffPolicy cannot be null");
      return this;
    }

    /**
     * Builds a new SubscriberOptions instance.
     *
     * @return a new SubscriberOptions with the configured settings
     */
    public SubscriberOptions build() {
      return new SubscriberOptions(this);
    }

    private static Duration requirePositive(Duration value, String name) {
      Objects.requireNonNull(value, name + " cannot be null");
      if (value.isNegative() || value.isZero()) {
        throw new IllegalArgumentException(name + " must be positive: " + value);
      }
      return value;
    }
  }
}
