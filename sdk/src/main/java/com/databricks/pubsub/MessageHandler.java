package com.databricks.pubsub;

/**
 * Application callback invoked once per delivered message.
 *
 * <p>Handlers run on the subscriber's executor and may be called concurrently, up to {@link
 * SubscriberOptions#maxConcurrency()} at a time. Each message must eventually be settled with
 * {@link AckHandler#ack()} or {@link AckHandler#nack()}; the next message is only dispatched once
 * a slot is freed that way. A handler that throws has its message nacked.
 *
 * <p>Example:
 *
 * <pre>{@code
 * MessageHandler handler = (message, ackHandler) -> {
 *     process(message.getData());
 *     ackHandler.ack();
 * };
 * }</pre>
 */
@FunctionalInterface
public interface MessageHandler {

  void onMessage(PubsubMessage message, AckHandler ackHandler);
}
