package com.databricks.pubsub;

import com.databricks.pubsub.stub.GrpcSubscriberStub;
import com.databricks.pubsub.stub.SubscriberStub;
import com.databricks.pubsub.tls.TlsConfig;
import io.grpc.ChannelCredentials;
import io.grpc.Grpc;
import io.grpc.ManagedChannel;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Factory for creating subscriber stubs with proper configuration.
 *
 * <p>This factory handles the creation of the gRPC channel with settings suited to long-lived
 * streaming pulls. The channel is cached and shared by every stub created by this factory instance,
 * so all sessions of one {@link Subscriber} reuse a single connection.
 */
class SubscriberStubFactory {

  private static final int DEFAULT_TLS_PORT = 443;
  private static final long KEEP_ALIVE_TIME_SECONDS = 30;
  private static final long KEEP_ALIVE_TIMEOUT_SECONDS = 10;

  private static final String HTTPS_PREFIX = "https://";
  private static final String HTTP_PREFIX = "http://";

  // Initialized on first use and shared by all stubs.
  private final AtomicReference<ManagedChannel> cachedChannel = new AtomicReference<>(null);

  /**
   * Gets or creates the cached gRPC channel.
   *
   * <p>Uses double-checked locking for thread-safe lazy initialization.
   *
   * @param endpoint The endpoint URL (may include an https:// or http:// prefix)
   * @param tlsConfig The TLS configuration of the connection
   * @return A configured ManagedChannel (cached)
   */
  ManagedChannel getOrCreateChannel(String endpoint, TlsConfig tlsConfig) {
    ManagedChannel channel = cachedChannel.get();
    if (channel != null) {
      return channel;
    }

    synchronized (this) {
      channel = cachedChannel.get();
      if (channel != null) {
        return channel;
      }

      channel = createChannel(endpoint, tlsConfig);
      cachedChannel.set(channel);
      return channel;
    }
  }

  /**
   * Creates a new subscriber stub on the cached channel.
   *
   * @param endpoint The endpoint URL
   * @param tlsConfig The TLS configuration of the connection
   * @return A configured SubscriberStub
   */
  SubscriberStub createStub(String endpoint, TlsConfig tlsConfig) {
    ManagedChannel channel = getOrCreateChannel(endpoint, tlsConfig);
    return new GrpcSubscriberStub(
        SubscriberGrpc.newStub(channel).withMaxInboundMessageSize(Integer.MAX_VALUE));
  }

  /** Shuts down the cached channel if it exists. */
  void shutdown() {
    ManagedChannel channel = cachedChannel.getAndSet(null);
    if (channel != null) {
      channel.shutdown();
    }
  }

  private ManagedChannel createChannel(String endpoint, TlsConfig tlsConfig) {
    EndpointInfo endpointInfo = parseEndpoint(endpoint);
    ChannelCredentials credentials = tlsConfig.toChannelCredentials();

    return Grpc.newChannelBuilder(endpointInfo.host + ":" + endpointInfo.port, credentials)
        .keepAliveTime(KEEP_ALIVE_TIME_SECONDS, TimeUnit.SECONDS)
        .keepAliveTimeout(KEEP_ALIVE_TIMEOUT_SECONDS, TimeUnit.SECONDS)
        .keepAliveWithoutCalls(true)
        .maxInboundMessageSize(Integer.MAX_VALUE)
        .build();
  }

  /** Container for parsed endpoint information. */
  static class EndpointInfo {
    final String host;
    final int port;

    EndpointInfo(String host, int port) {
      this.host = host;
      this.port = port;
    }
  }

  /**
   * Parses an endpoint string to extract host and port information.
   *
   * @param endpoint The endpoint string (may include https:// or http:// prefix)
   * @return Parsed endpoint information
   * @throws NonRetriableException if the port is not a number
   */
  static EndpointInfo parseEndpoint(String endpoint) {
    String cleanEndpoint = endpoint;
    if (cleanEndpoint.startsWith(HTTPS_PREFIX)) {
      cleanEndpoint = cleanEndpoint.substring(HTTPS_PREFIX.length());
    } else if (cleanEndpoint.startsWith(HTTP_PREFIX)) {
      cleanEndpoint = cleanEndpoint.substring(HTTP_PREFIX.length());
    }

    String[] parts = cleanEndpoint.split(":", 2);
    String host = parts[0];
    try {
      int port = parts.length > 1 ? Integer.parseInt(parts[1]) : DEFAULT_TLS_PORT;
      return new EndpointInfo(host, port);
    } catch (NumberFormatException e) {
      throw new NonRetriableException("Invalid port in endpoint: " + endpoint, e);
    }
  }
}
