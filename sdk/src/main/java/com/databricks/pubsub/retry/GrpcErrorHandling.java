package com.databricks.pubsub.retry;

import io.grpc.Status;
import java.util.EnumSet;
import java.util.Set;

/** Utility for classifying gRPC errors as transient or permanent. */
public final class GrpcErrorHandling {
  private static final Set<Status.Code> TRANSIENT_CODES =
      EnumSet.of(
          Status.Code.DEADLINE_EXCEEDED,
          Status.Code.UNAVAILABLE,
          Status.Code.ABORTED,
          Status.Code.INTERNAL,
          Status.Code.RESOURCE_EXHAUSTED);

  private GrpcErrorHandling() {}

  public static boolean isTransient(Status.Code code) {
    return TRANSIENT_CODES.contains(code);
  }

  /** Anything that is neither OK nor transient. */
  public static boolean isPermanent(Status status) {
    return !status.isOk() && !isTransient(status.getCode());
  }
}
