package com.databricks.pubsub.retry;

import com.google.protobuf.Any;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.rpc.ErrorInfo;
import io.grpc.Status;
import io.grpc.protobuf.StatusProto;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retry policy for acknowledge and modify-ack-deadline calls on a single ack id when the
 * subscription has exactly-once delivery enabled.
 *
 * <p>With exactly-once delivery the broker reports failures per ack id. A failed call carries a
 * {@code google.rpc.ErrorInfo} detail whose metadata maps each failed ack id to a reason. Reasons
 * starting with {@value #TRANSIENT_FAILURE_PREFIX} may be retried; any other reason is permanent.
 * Ack ids that are absent from the metadata of such an error succeeded.
 *
 * <p>When the error carries no per-id metadata, the gRPC status code decides (see {@link
 * GrpcErrorHandling}).
 *
 * <p>Retries stop once the deadline passes, whatever the classification.
 */
public final class LeaseRetryPolicy {
  private static final Logger logger = LoggerFactory.getLogger(LeaseRetryPolicy.class);

  public static final String TRANSIENT_FAILURE_PREFIX = "TRANSIENT_FAILURE_";

  /** How a failed call affected one ack id. */
  public enum Outcome {
    /** The call succeeded for this ack id even though other ids failed. */
    SUCCEEDED,
    /** The failure is transient for this ack id and the budget allows another attempt. */
    RETRY,
    /** The failure is permanent for this ack id, or the budget is spent. */
    FAILED
  }

  private final String ackId;
  private final Instant deadline;
  private final Clock clock;

  public LeaseRetryPolicy(@Nonnull String ackId, @Nonnull Instant deadline, @Nonnull Clock clock) {
    this.ackId = ackId;
    this.deadline = deadline;
    this.clock = clock;
  }

  public String ackId() {
    return ackId;
  }

  public Instant deadline() {
    return deadline;
  }

  public boolean isExhausted() {
    return !clock.instant().isBefore(deadline);
  }

  /**
   * Records a failure of a call that included this ack id.
   *
   * @return true if the call should be retried for this ack id
   */
  public boolean onFailure(@Nonnull Throwable error) {
    return classify(error) == Outcome.RETRY;
  }

  /** Returns true if {@code error} is a permanent failure for this ack id. */
  public boolean isPermanentFailure(@Nonnull Throwable error) {
    Map<String, String> failures = ackIdFailures(error);
    if (!failures.isEmpty()) {
      String reason = failures.get(ackId);
      return reason != null && !reason.startsWith(TRANSIENT_FAILURE_PREFIX);
    }
    return GrpcErrorHandling.isPermanent(Status.fromThrowable(error));
  }

  /** Classifies the effect of {@code error} on this ack id. */
  public Outcome classify(@Nonnull Throwable error) {
    Map<String, String> failures = ackIdFailures(error);
    boolean transientFailure;
    if (!failures.isEmpty()) {
      String reason = failures.get(ackId);
      if (reason == null) {
        return Outcome.SUCCEEDED;
      }
      transientFailure = reason.startsWith(TRANSIENT_FAILURE_PREFIX);
    } else {
      transientFailure = GrpcErrorHandling.isTransient(Status.fromThrowable(error).getCode());
    }
    if (!transientFailure || isExhausted()) {
      return Outcome.FAILED;
    }
    return Outcome.RETRY;
  }

  /**
   * Returns the status to report for this ack id after {@code error} was classified as {@link
   * Outcome#FAILED}.
   */
  public Status failureStatus(@Nonnull Throwable error) {
    Status status = Status.fromThrowable(error);
    String reason = ackIdFailures(error).get(ackId);
    if (reason != null) {
      status = status.augmentDescription("ack id " + ackId + " failed: " + reason);
    }
    return status;
  }

  /** Extracts the per-ack-id failure reasons of an error, or an empty map if it has none. */
  static Map<String, String> ackIdFailures(@Nullable Throwable error) {
    if (error == null) {
      return Collections.emptyMap();
    }
    com.google.rpc.Status details = StatusProto.fromThrowable(error);
    if (details == null) {
      return Collections.emptyMap();
    }
    for (Any any : details.getDetailsList()) {
      if (!any.is(ErrorInfo.class)) {
        continue;
      }
      try {
        return any.unpack(ErrorInfo.class).getMetadataMap();
      } catch (InvalidProtocolBufferException e) {
        logger.warn("Ignoring malformed ErrorInfo detail: {}", e.getMessage());
      }
    }
    return Collections.emptyMap();
  }
}
