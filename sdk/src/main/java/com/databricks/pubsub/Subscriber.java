package com.databricks.pubsub;

import com.databricks.pubsub.session.SubscriberSession;
import com.databricks.pubsub.stub.SubscriberStub;
import com.databricks.pubsub.tls.SecureTlsConfig;
import com.databricks.pubsub.tls.TlsConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main entry point for receiving messages from a subscription.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Subscriber subscriber = Subscriber.builder("broker.example.com:443").build();
 *
 * SubscriberSession session = subscriber.subscribe(
 *     "projects/my-project/subscriptions/my-subscription",
 *     SubscriberOptions.getDefault(),
 *     (message, ackHandler) -> {
 *         System.out.println(message.getData().toStringUtf8());
 *         ackHandler.ack();
 *     });
 *
 * // Later, stop receiving and wait for the session to wind down.
 * session.shutdown();
 * Status status = session.completion().join();
 *
 * // When done with the subscriber
 * subscriber.close();
 * }</pre>
 *
 * <p>All sessions created by one subscriber share a gRPC channel and an executor.
 */
public class Subscriber implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(Subscriber.class);

  /** The current version of the subscriber SDK. */
  public static final String VERSION = "0.1.0";

  private final String endpoint;
  private final TlsConfig tlsConfig;
  private final ScheduledExecutorService executor;
  private final SubscriberStubFactory stubFactory;
  private final Set<SubscriberSession> liveSessions = ConcurrentHashMap.newKeySet();

  /**
   * Creates a new Subscriber with default settings.
   *
   * @param endpoint The gRPC endpoint of the broker
   */
  public Subscriber(@Nonnull String endpoint) {
    this(
        Objects.requireNonNull(endpoint, "endpoint cannot be null"),
        new SecureTlsConfig(),
        createDefaultExecutor(),
        new SubscriberStubFactory());
  }

  /**
   * Creates a new Subscriber with custom configuration.
   *
   * <p>This constructor is package-private and intended for use by {@link SubscriberBuilder}.
   */
  Subscriber(
      @Nonnull String endpoint,
      @Nonnull TlsConfig tlsConfig,
      @Nonnull ScheduledExecutorService executor,
      @Nonnull SubscriberStubFactory stubFactory) {
    this.endpoint = endpoint;
    this.tlsConfig = tlsConfig;
    this.executor = executor;
    this.stubFactory = stubFactory;
  }

  /**
   * Creates a new builder for configuring a Subscriber instance.
   *
   * @param endpoint The gRPC endpoint of the broker
   * @return A new SubscriberBuilder instance
   * @see SubscriberBuilder
   */
  @Nonnull
  public static SubscriberBuilder builder(@Nonnull String endpoint) {
    return new SubscriberBuilder(endpoint);
  }

  /** Creates the default executor service. Package-private for use by {@link SubscriberBuilder}. */
  static ScheduledExecutorService createDefaultExecutor() {
    ThreadFactory factory =
        new ThreadFactory() {
          private final AtomicInteger counter = new AtomicInteger(0);

          @Override
          public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("Subscriber-worker-" + counter.getAndIncrement());
            return t;
          }
        };
    ScheduledThreadPoolExecutor executor =
        new ScheduledThreadPoolExecutor(
            Math.max(2, Runtime.getRuntime().availableProcessors()), factory);
    executor.setRemoveOnCancelPolicy(true);
    return executor;
  }

  /**
   * Starts receiving messages from a subscription.
   *
   * @param subscription The full subscription name
   * @param options The pipeline configuration
   * @param handler Invoked once per delivered message
   * @return The running session
   */
  @Nonnull
  public SubscriberSession subscribe(
      @Nonnull String subscription,
      @Nonnull SubscriberOptions options,
      @Nonnull MessageHandler handler) {
    Objects.requireNonNull(subscription, "subscription cannot be null");
    Objects.requireNonNull(options, "options cannot be null");
    Objects.requireNonNull(handler, "handler cannot be null");
    if (subscription.isEmpty()) {
      throw new NonRetriableException("subscription cannot be empty");
    }

    logger.debug("Subscribing to {}", subscription);
    SubscriberStub stub = stubFactory.createStub(endpoint, tlsConfig);
    SubscriberSession session =
        SubscriberSession.create(stub, executor, subscription, options, handler);
    liveSessions.add(session);
    session.completion().whenComplete((status, error) -> liveSessions.remove(session));
    session.start();
    return session;
  }

  /**
   * Starts receiving messages from a subscription with default options.
   *
   * @param subscription The full subscription name
   * @param handler Invoked once per delivered message
   * @return The running session
   */
  @Nonnull
  public SubscriberSession subscribe(
      @Nonnull String subscription, @Nonnull MessageHandler handler) {
    return subscribe(subscription, SubscriberOptions.getDefault(), handler);
  }

  /**
   * Closes the subscriber and releases resources.
   *
   * <p>This method performs a graceful shutdown:
   *
   * <ol>
   *   <li>Tears down every live session, which then completes with {@code CANCELLED} once its
   *       running handlers return
   *   <li>Stops accepting new tasks on the executor
   *   <li>Waits up to 10 seconds for in-flight tasks to complete
   *   <li>Forces shutdown if tasks don't complete in time
   *   <li>Shuts down the gRPC channel
   * </ol>
   *
   * <p>After calling this method, the subscriber cannot be reused.
   */
  @Override
  public void close() {
    logger.debug("Closing Subscriber");
    List<SubscriberSession> sessions = new ArrayList<>(liveSessions);
    for (SubscriberSession session : sessions) {
      session.onExecutorShutdown();
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
        logger.warn("Executor did not terminate gracefully, forcing shutdown");
        executor.shutdownNow();
        if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
          logger.error("Executor did not terminate after forced shutdown");
        }
      }
    } catch (InterruptedException e) {
      logger.warn("Interrupted while waiting for executor shutdown");
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      stubFactory.shutdown();
    }
  }

  /**
   * Returns the current version of the subscriber SDK.
   *
   * @return The SDK version string (e.g., "0.1.0")
   */
  public static String getVersion() {
    return VERSION;
  }
}
