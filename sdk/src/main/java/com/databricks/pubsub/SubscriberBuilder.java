package com.databricks.pubsub;

import com.databricks.pubsub.tls.SecureTlsConfig;
import com.databricks.pubsub.tls.TlsConfig;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import javax.annotation.Nonnull;

/**
 * Builder for creating {@link Subscriber} instances with custom configuration.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Subscriber subscriber = Subscriber.builder("localhost:8085")
 *     .tlsConfig(new InsecureTlsConfig())
 *     .executor(myExecutor)
 *     .build();
 * }</pre>
 *
 * @see Subscriber#builder(String)
 */
public final class SubscriberBuilder {
  private final String endpoint;
  private TlsConfig tlsConfig = new SecureTlsConfig();
  private Optional<ScheduledExecutorService> executor = Optional.empty();
  private Optional<SubscriberStubFactory> stubFactory = Optional.empty();

  /**
   * Creates a new SubscriberBuilder.
   *
   * <p>Use {@link Subscriber#builder(String)} instead of calling this constructor directly.
   *
   * @param endpoint The gRPC endpoint of the broker
   */
  SubscriberBuilder(@Nonnull String endpoint) {
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint cannot be null");
  }

  /**
   * Sets the TLS configuration of the connection. Defaults to {@link SecureTlsConfig}.
   *
   * @param tlsConfig The TLS configuration to use
   * @return This builder for method chaining
   */
  @Nonnull
  public SubscriberBuilder tlsConfig(@Nonnull TlsConfig tlsConfig) {
    this.tlsConfig = Objects.requireNonNull(tlsConfig, "tlsConfig cannot be null");
    return this;
  }

  /**
   * Sets a custom executor service for the subscriber.
   *
   * <p>The executor runs timers, stream continuations and message handlers of every session. If
   * not set, the subscriber creates a daemon thread pool. Shutting the executor down ends every
   * live session with {@link io.grpc.Status.Code#CANCELLED}.
   *
   * @param executor The executor service to use
   * @return This builder for method chaining
   */
  @Nonnull
  public SubscriberBuilder executor(@Nonnull ScheduledExecutorService executor) {
    this.executor = Optional.of(Objects.requireNonNull(executor, "executor cannot be null"));
    return this;
  }

  /**
   * Sets a custom stub factory for the subscriber.
   *
   * <p>This is primarily used for testing.
   *
   * @param stubFactory The stub factory to use
   * @return This builder for method chaining
   */
  @Nonnull
  SubscriberBuilder stubFactory(@Nonnull SubscriberStubFactory stubFactory) {
    this.stubFactory =
        Optional.of(Objects.requireNonNull(stubFactory, "stubFactory cannot be null"));
    return this;
  }

  /**
   * Builds the Subscriber instance.
   *
   * @return A new Subscriber instance
   */
  @Nonnull
  public Subscriber build() {
    return new Subscriber(
        endpoint,
        tlsConfig,
        executor.orElseGet(Subscriber::createDefaultExecutor),
        stubFactory.orElseGet(SubscriberStubFactory::new));
  }
}
