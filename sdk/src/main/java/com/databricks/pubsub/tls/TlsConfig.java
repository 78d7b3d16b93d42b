package com.databricks.pubsub.tls;

import io.grpc.ChannelCredentials;

/**
 * Strategy for the transport security of the channel to the broker.
 *
 * <p>By default the subscriber uses {@link SecureTlsConfig}. Custom implementations can supply a
 * private certificate authority or client certificates:
 *
 * <pre>{@code
 * public class CustomTlsConfig extends TlsConfig {
 *     private final File caCertFile;
 *
 *     public CustomTlsConfig(File caCertFile) {
 *         this.caCertFile = caCertFile;
 *     }
 *
 *     @Override
 *     public ChannelCredentials toChannelCredentials() {
 *         try {
 *             return TlsChannelCredentials.newBuilder()
 *                 .trustManager(caCertFile)
 *                 .build();
 *         } catch (IOException e) {
 *             throw new RuntimeException("Failed to load CA certificate", e);
 *         }
 *     }
 * }
 *
 * Subscriber subscriber = Subscriber.builder("broker.example.com:443")
 *     .tlsConfig(new CustomTlsConfig(new File("/path/to/ca-cert.pem")))
 *     .build();
 * }</pre>
 *
 * @see com.databricks.pubsub.SubscriberBuilder#tlsConfig(TlsConfig)
 */
public abstract class TlsConfig {

  /**
   * Converts this configuration to gRPC channel credentials.
   *
   * @return the credentials of the channel
   */
  public abstract ChannelCredentials toChannelCredentials();
}
