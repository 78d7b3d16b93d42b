package com.databricks.pubsub.tls;

import io.grpc.ChannelCredentials;
import io.grpc.InsecureChannelCredentials;

/** Plaintext connection, for local emulators and tests only. */
public class InsecureTlsConfig extends TlsConfig {

  @Override
  public ChannelCredentials toChannelCredentials() {
    return InsecureChannelCredentials.create();
  }
}
