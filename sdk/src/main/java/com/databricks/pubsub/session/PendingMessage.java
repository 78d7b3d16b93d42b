package com.databricks.pubsub.session;

import com.databricks.pubsub.PubsubMessage;
import com.databricks.pubsub.ReceivedMessage;

/** A received message waiting in the {@link MessageDispatchQueue}, or handed to the application. */
public final class PendingMessage {
  private final ReceivedMessage received;
  private final long size;

  PendingMessage(ReceivedMessage received) {
    this.received = received;
    this.size = FlowController.messageSize(received);
  }

  public String ackId() {
    return received.getAckId();
  }

  public PubsubMessage message() {
    return received.getMessage();
  }

  public int deliveryAttempt() {
    return received.getDeliveryAttempt();
  }

  /** Empty when the message has no ordering key. */
  public String orderingKey() {
    return received.getMessage().getOrderingKey();
  }

  public long size() {
    return size;
  }
}
