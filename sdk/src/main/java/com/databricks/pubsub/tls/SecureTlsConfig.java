package com.databricks.pubsub.tls;

import io.grpc.ChannelCredentials;
import io.grpc.TlsChannelCredentials;

/**
 * TLS using the system's trusted CA certificates.
 *
 * <p>This is the default configuration of {@link com.databricks.pubsub.SubscriberBuilder}.
 */
public class SecureTlsConfig extends TlsConfig {

  @Override
  public ChannelCredentials toChannelCredentials() {
    return TlsChannelCredentials.create();
  }
}
