package com.databricks.pubsub.examples;

import com.databricks.pubsub.*;
import com.databricks.pubsub.session.SubscriberSession;
import com.databricks.pubsub.tls.InsecureTlsConfig;
import io.grpc.Status;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Example demonstrating flow control and lease settings against a local emulator.
 *
 * <p>The handler simulates slow processing. With at most 50 outstanding messages the subscriber
 * stops pulling while the handlers catch up, and extends the leases of the messages it holds so
 * the broker does not redeliver them. Messages with an ordering key are handled one at a time per
 * key.
 *
 * <p><b>Use Case:</b> Consumers whose processing time varies, or that must bound memory use.
 */
public class FlowControlExample {

    private static final String ENDPOINT = "localhost:8085";
    private static final String SUBSCRIPTION = "projects/local/subscriptions/slow-consumer";

    public static void main(String[] args) throws InterruptedException {
        System.out.println("Starting flow control example...");
        System.out.println("===========================================");

        SubscriberOptions options = SubscriberOptions.builder()
            .setMaxOutstandingMessages(50)            // Stop pulling at 50 messages
            .setOutstandingMessagesLowWatermark(10)   // Resume at 10
            .setMaxOutstandingBytes(8L * 1024 * 1024) // Or at 8 MiB
            .setMaxHandlingTime(Duration.ofMinutes(2)) // Stop extending leases after 2 minutes
            .setMaxConcurrency(4)                      // At most 4 handlers at once
            .build();
        System.out.println("✓ Subscriber options configured");

        ScheduledExecutorService executor = Executors.newScheduledThreadPool(8);
        Subscriber subscriber = Subscriber.builder(ENDPOINT)
            .tlsConfig(new InsecureTlsConfig())
            .executor(executor)
            .build();

        SubscriberSession session = subscriber.subscribe(SUBSCRIPTION, options, (message, ackHandler) -> {
            try {
                Thread.sleep(500);
                System.out.println("  Processed " + message.getMessageId()
                    + (message.getOrderingKey().isEmpty() ? "" : " (key " + message.getOrderingKey() + ")"));
                ackHandler.ack();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ackHandler.nack();
            }
        });
        System.out.println("✓ Session started");

        TimeUnit.SECONDS.sleep(30);

        session.shutdown();
        System.out.println("✓ Shutdown requested");
        Status status = session.completion().join();
        System.out.println("Session finished: " + status.getCode());

        subscriber.close();
        System.out.println("Session state: " + session.state());
    }
}
