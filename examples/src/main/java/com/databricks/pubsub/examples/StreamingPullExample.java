package com.databricks.pubsub.examples;

import com.databricks.pubsub.*;
import com.databricks.pubsub.session.SubscriberSession;
import io.grpc.Status;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Example demonstrating a streaming pull with default settings.
 *
 * <p>This example receives messages from a subscription, prints them and acknowledges each one.
 * It stops after {@code NUM_MESSAGES} messages or {@code MAX_WAIT_SECONDS} seconds, whichever
 * comes first.
 *
 * <p>Run with: {@code java -cp <classpath> com.databricks.pubsub.examples.StreamingPullExample}
 */
public class StreamingPullExample {

    // Configuration - update these with your values
    private static final String ENDPOINT = "broker.example.com:443";
    private static final String SUBSCRIPTION = "projects/my-project/subscriptions/my-subscription";

    private static final int NUM_MESSAGES = 100;
    private static final int MAX_WAIT_SECONDS = 60;

    public static void main(String[] args) throws InterruptedException {
        System.out.println("Starting streaming pull example...");
        System.out.println("===========================================");

        CountDownLatch received = new CountDownLatch(NUM_MESSAGES);
        AtomicInteger failedAcks = new AtomicInteger();

        try (Subscriber subscriber = Subscriber.builder(ENDPOINT).build()) {
            System.out.println("✓ Subscriber initialized (SDK " + Subscriber.getVersion() + ")");

            SubscriberSession session = subscriber.subscribe(SUBSCRIPTION, (message, ackHandler) -> {
                System.out.println("  Received " + message.getMessageId() + ": "
                    + message.getData().toStringUtf8());
                ackHandler.ack().thenAccept(status -> {
                    if (!status.isOk()) {
                        failedAcks.incrementAndGet();
                    }
                });
                received.countDown();
            });
            System.out.println("✓ Session started on " + SUBSCRIPTION);

            boolean done = received.await(MAX_WAIT_SECONDS, TimeUnit.SECONDS);
            System.out.println(done
                ? "\n✓ Received " + NUM_MESSAGES + " messages"
                : "\nTimed out after " + MAX_WAIT_SECONDS + " seconds");

            // Nacks anything still buffered and waits for the pipeline to wind down.
            session.shutdown();
            Status status = session.completion().join();

            System.out.println("\n===========================================");
            System.out.println("Session finished with status: " + status.getCode());
            System.out.println("  Messages received: " + (NUM_MESSAGES - received.getCount()));
            System.out.println("  Failed acks: " + failedAcks.get());
            System.out.println("===========================================");
        } catch (SubscriberException e) {
            System.err.println("\n✗ Failed to subscribe: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }
}
