package com.databricks.pubsub.stub;

import static org.junit.jupiter.api.Assertions.*;

import com.databricks.pubsub.AcknowledgeRequest;
import com.databricks.pubsub.ModifyAckDeadlineRequest;
import com.databricks.pubsub.ReceivedMessage;
import com.databricks.pubsub.StreamingPullRequest;
import com.databricks.pubsub.StreamingPullResponse;
import com.databricks.pubsub.SubscriberGrpc;
import com.google.protobuf.Empty;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.StreamObserver;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/** Tests for {@link GrpcSubscriberStub} against an in-process broker. */
@Timeout(30)
class GrpcSubscriberStubTest {

  private Server server;
  private ManagedChannel channel;
  private GrpcSubscriberStub stub;
  private FakeBroker broker;

  @BeforeEach
  void setUp() throws Exception {
    String name = InProcessServerBuilder.generateName();
    broker = new FakeBroker();
    server = InProcessServerBuilder.forName(name).addService(broker).build().start();
    channel = InProcessChannelBuilder.forName(name).build();
    stub = new GrpcSubscriberStub(SubscriberGrpc.newStub(channel));
  }

  @AfterEach
  void tearDown() throws Exception {
    channel.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
    server.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
  }

  private static StreamingPullResponse response(String ackId) {
    return StreamingPullResponse.newBuilder()
        .addReceivedMessages(ReceivedMessage.newBuilder().setAckId(ackId))
        .build();
  }

  /** Records requests; lets the test drive the server side of a streaming pull. */
  private static class FakeBroker extends SubscriberGrpc.SubscriberImplBase {
    final BlockingQueue<StreamingPullRequest> pullRequests = new LinkedBlockingQueue<>();
    final BlockingQueue<Object> unaryRequests = new LinkedBlockingQueue<>();
    final CompletableFuture<StreamObserver<StreamingPullResponse>> responses =
        new CompletableFuture<>();
    final CompletableFuture<Status> clientClosed = new CompletableFuture<>();

    @Override
    public StreamObserver<StreamingPullRequest> streamingPull(
        StreamObserver<StreamingPullResponse> responseObserver) {
      responses.complete(responseObserver);
      return new StreamObserver<StreamingPullRequest>() {
        @Override
        public void onNext(StreamingPullRequest request) {
          pullRequests.add(request);
        }

        @Override
        public void onError(Throwable t) {
          clientClosed.complete(Status.fromThrowable(t));
        }

        @Override
        public void onCompleted() {
          clientClosed.complete(Status.OK);
        }
      };
    }

    @Override
    public void acknowledge(AcknowledgeRequest request, StreamObserver<Empty> responseObserver) {
      unaryRequests.add(request);
      if (request.getAckIdsList().contains("bad")) {
        responseObserver.onError(
            Status.INVALID_ARGUMENT.withDescription("unknown ack id").asRuntimeException());
        return;
      }
      responseObserver.onNext(Empty.getDefaultInstance());
      responseObserver.onCompleted();
    }

    @Override
    public void modifyAckDeadline(
        ModifyAckDeadlineRequest request, StreamObserver<Empty> responseObserver) {
      unaryRequests.add(request);
      responseObserver.onNext(Empty.getDefaultInstance());
      responseObserver.onCompleted();
    }
  }

  // ==================== Unary calls ====================

  @Test
  void testAcknowledge_Succeeds() throws Exception {
    AcknowledgeRequest request =
        AcknowledgeRequest.newBuilder().setSubscription("subs").addAckIds("a1").build();

    stub.acknowledge(request).get(5, TimeUnit.SECONDS);

    assertEquals(request, broker.unaryRequests.poll(5, TimeUnit.SECONDS));
  }

  @Test
  void testAcknowledge_FailureCarriesStatus() {
    AcknowledgeRequest request =
        AcknowledgeRequest.newBuilder().setSubscription("subs").addAckIds("bad").build();

    ExecutionException e =
        assertThrows(
            ExecutionException.class, () -> stub.acknowledge(request).get(5, TimeUnit.SECONDS));

    assertEquals(Status.Code.INVALID_ARGUMENT, Status.fromThrowable(e.getCause()).getCode());
  }

  @Test
  void testModifyAckDeadline_Succeeds() throws Exception {
    ModifyAckDeadlineRequest request =
        ModifyAckDeadlineRequest.newBuilder()
            .setSubscription("subs")
            .addAckIds("a1")
            .setAckDeadlineSeconds(0)
            .build();

    stub.modifyAckDeadline(request).get(5, TimeUnit.SECONDS);

    assertEquals(request, broker.unaryRequests.poll(5, TimeUnit.SECONDS));
  }

  // ==================== Streaming pull ====================

  @Test
  void testStreamingPull_WriteAndRead() throws Exception {
    PullStream stream = stub.streamingPull();
    assertTrue(stream.start().get(5, TimeUnit.SECONDS));

    StreamingPullRequest initial =
        StreamingPullRequest.newBuilder().setSubscription("subs").setClientId("c1").build();
    assertTrue(stream.write(initial).get(5, TimeUnit.SECONDS));
    assertEquals(initial, broker.pullRequests.poll(5, TimeUnit.SECONDS));

    StreamObserver<StreamingPullResponse> server = broker.responses.get(5, TimeUnit.SECONDS);
    server.onNext(response("a1"));
    server.onNext(response("a2"));

    Optional<StreamingPullResponse> first = stream.read().get(5, TimeUnit.SECONDS);
    Optional<StreamingPullResponse> second = stream.read().get(5, TimeUnit.SECONDS);
    assertEquals("a1", first.get().getReceivedMessages(0).getAckId());
    assertEquals("a2", second.get().getReceivedMessages(0).getAckId());

    server.onCompleted();

    assertFalse(stream.read().get(5, TimeUnit.SECONDS).isPresent());
    assertEquals(Status.Code.OK, stream.finish().get(5, TimeUnit.SECONDS).getCode());
  }

  @Test
  void testStreamingPull_ServerErrorEndsPendingRead() throws Exception {
    PullStream stream = stub.streamingPull();
    stream.start().get(5, TimeUnit.SECONDS);
    stream.write(StreamingPullRequest.newBuilder().setSubscription("subs").build());
    StreamObserver<StreamingPullResponse> server = broker.responses.get(5, TimeUnit.SECONDS);

    CompletableFuture<Optional<StreamingPullResponse>> read = stream.read();
    server.onError(Status.UNAVAILABLE.withDescription("going away").asRuntimeException());

    assertFalse(read.get(5, TimeUnit.SECONDS).isPresent());
    assertEquals(Status.Code.UNAVAILABLE, stream.finish().get(5, TimeUnit.SECONDS).getCode());
    assertFalse(stream.write(StreamingPullRequest.getDefaultInstance()).get(5, TimeUnit.SECONDS));
  }

  @Test
  void testStreamingPull_Cancel() throws Exception {
    PullStream stream = stub.streamingPull();
    stream.start().get(5, TimeUnit.SECONDS);
    stream.write(StreamingPullRequest.newBuilder().setSubscription("subs").build());
    CompletableFuture<Optional<StreamingPullResponse>> read = stream.read();

    stream.cancel();

    assertFalse(read.get(5, TimeUnit.SECONDS).isPresent());
    assertEquals(Status.Code.CANCELLED, stream.finish().get(5, TimeUnit.SECONDS).getCode());
    assertEquals(Status.Code.CANCELLED, broker.clientClosed.get(5, TimeUnit.SECONDS).getCode());
  }

  @Test
  void testStreamingPull_CancelBeforeStart() throws Exception {
    PullStream stream = stub.streamingPull();

    stream.cancel();

    assertFalse(stream.start().get(5, TimeUnit.SECONDS));
    assertEquals(Status.Code.CANCELLED, stream.finish().get(5, TimeUnit.SECONDS).getCode());
  }
}
