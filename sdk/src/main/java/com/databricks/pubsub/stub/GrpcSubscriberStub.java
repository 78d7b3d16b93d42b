package com.databricks.pubsub.stub;

import com.databricks.pubsub.AcknowledgeRequest;
import com.databricks.pubsub.ModifyAckDeadlineRequest;
import com.databricks.pubsub.StreamingPullRequest;
import com.databricks.pubsub.StreamingPullResponse;
import com.databricks.pubsub.SubscriberGrpc;
import com.google.protobuf.Empty;
import io.grpc.Status;
import io.grpc.stub.ClientCallStreamObserver;
import io.grpc.stub.ClientResponseObserver;
import io.grpc.stub.StreamObserver;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SubscriberStub} backed by the grpc-java async stub.
 *
 * <p>Streaming pulls use manual inbound flow control: a response is only requested from the broker
 * when the pipeline issues a {@link PullStream#read()}.
 */
public class GrpcSubscriberStub implements SubscriberStub {
  private static final Logger logger = LoggerFactory.getLogger(GrpcSubscriberStub.class);

  private final SubscriberGrpc.SubscriberStub grpcStub;

  public GrpcSubscriberStub(@Nonnull SubscriberGrpc.SubscriberStub grpcStub) {
    this.grpcStub = Objects.requireNonNull(grpcStub, "grpcStub cannot be null");
  }

  @Override
  public PullStream streamingPull() {
    return new GrpcPullStream(grpcStub);
  }

  @Override
  public CompletableFuture<Void> acknowledge(AcknowledgeRequest request) {
    UnaryObserver observer = new UnaryObserver();
    grpcStub.acknowledge(request, observer);
    return observer.result;
  }

  @Override
  public CompletableFuture<Void> modifyAckDeadline(ModifyAckDeadlineRequest request) {
    UnaryObserver observer = new UnaryObserver();
    grpcStub.modifyAckDeadline(request, observer);
    return observer.result;
  }

  private static class UnaryObserver implements StreamObserver<Empty> {
    private final CompletableFuture<Void> result = new CompletableFuture<>();

    @Override
    public void onNext(Empty value) {}

    @Override
    public void onError(Throwable t) {
      result.completeExceptionally(t);
    }

    @Override
    public void onCompleted() {
      result.complete(null);
    }
  }

  /** Adapts one streaming pull call to the future-based {@link PullStream} contract. */
  static class GrpcPullStream
      implements PullStream, ClientResponseObserver<StreamingPullRequest, StreamingPullResponse> {
    private final SubscriberGrpc.SubscriberStub grpcStub;
    private final Queue<StreamingPullResponse> received = new ArrayDeque<>();
    private final CompletableFuture<Status> finished = new CompletableFuture<>();

    private ClientCallStreamObserver<StreamingPullRequest> call;
    private CompletableFuture<Optional<StreamingPullResponse>> pendingRead;
    private boolean closed = false;

    GrpcPullStream(SubscriberGrpc.SubscriberStub grpcStub) {
      this.grpcStub = grpcStub;
    }

    @Override
    public CompletableFuture<Boolean> start() {
      synchronized (this) {
        if (closed) {
          return CompletableFuture.completedFuture(false);
        }
      }
      try {
        grpcStub.streamingPull(this);
        return CompletableFuture.completedFuture(true);
      } catch (RuntimeException e) {
        logger.warn("Failed to start streaming pull: {}", e.getMessage());
        onError(e);
        return CompletableFuture.completedFuture(false);
      }
    }

    @Override
    public void beforeStart(ClientCallStreamObserver<StreamingPullRequest> requestStream) {
      requestStream.disableAutoRequestWithInitial(0);
      synchronized (this) {
        call = requestStream;
      }
    }

    @Override
    public CompletableFuture<Boolean> write(StreamingPullRequest request) {
      ClientCallStreamObserver<StreamingPullRequest> current;
      synchronized (this) {
        if (closed || call == null) {
          return CompletableFuture.completedFuture(false);
        }
        current = call;
      }
      try {
        current.onNext(request);
        return CompletableFuture.completedFuture(true);
      } catch (RuntimeException e) {
        logger.debug("Write on streaming pull failed: {}", e.getMessage());
        return CompletableFuture.completedFuture(false);
      }
    }

    @Override
    public CompletableFuture<Optional<StreamingPullResponse>> read() {
      ClientCallStreamObserver<StreamingPullRequest> current;
      CompletableFuture<Optional<StreamingPullResponse>> result = new CompletableFuture<>();
      synchronized (this) {
        StreamingPullResponse next = received.poll();
        if (next != null) {
          result.complete(Optional.of(next));
          return result;
        }
        if (closed || call == null) {
          result.complete(Optional.empty());
          return result;
        }
        pendingRead = result;
        current = call;
      }
      current.request(1);
      return result;
    }

    @Override
    public CompletableFuture<Boolean> writesDone() {
      ClientCallStreamObserver<StreamingPullRequest> current;
      synchronized (this) {
        if (closed || call == null) {
          return CompletableFuture.completedFuture(false);
        }
        current = call;
      }
      try {
        current.onCompleted();
        return CompletableFuture.completedFuture(true);
      } catch (RuntimeException e) {
        logger.debug("Half-close on streaming pull failed: {}", e.getMessage());
        return CompletableFuture.completedFuture(false);
      }
    }

    @Override
    public CompletableFuture<Status> finish() {
      return finished;
    }

    @Override
    public void cancel() {
      ClientCallStreamObserver<StreamingPullRequest> current;
      synchronized (this) {
        current = call;
      }
      if (current != null) {
        current.cancel("streaming pull cancelled", null);
      } else {
        onError(Status.CANCELLED.withDescription("streaming pull cancelled").asRuntimeException());
      }
    }

    @Override
    public void onNext(StreamingPullResponse response) {
      CompletableFuture<Optional<StreamingPullResponse>> read;
      synchronized (this) {
        read = pendingRead;
        pendingRead = null;
        if (read == null) {
          received.add(response);
          return;
        }
      }
      read.complete(Optional.of(response));
    }

    @Override
    public void onError(Throwable t) {
      close(Status.fromThrowable(t));
    }

    @Override
    public void onCompleted() {
      close(Status.OK);
    }

    private void close(Status status) {
      CompletableFuture<Optional<StreamingPullResponse>> read;
      synchronized (this) {
        if (closed) {
          return;
        }
        closed = true;
        read = pendingRead;
        pendingRead = null;
      }
      logger.debug("Streaming pull closed with status {}", status.getCode());
      if (read != null) {
        read.complete(Optional.empty());
      }
      finished.complete(status);
    }
  }
}
