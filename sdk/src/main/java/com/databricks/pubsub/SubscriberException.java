package com.databricks.pubsub;

/**
 * Base exception class for all subscriber errors.
 *
 * <p>This is an unchecked exception (extends {@link RuntimeException}). Callers can catch this
 * exception or let it propagate up the call stack.
 *
 * <p>The subscriber throws two types of exceptions:
 *
 * <ul>
 *   <li>{@link SubscriberException} - Retriable errors (network issues, temporary broker errors)
 *   <li>{@link NonRetriableException} - Non-retriable errors (missing subscription, permission
 *       denied, invalid configuration)
 * </ul>
 *
 * <p>Per-message acknowledgement failures are never thrown; they are reported through the status
 * returned by {@link AckHandler#ack()} and {@link AckHandler#nack()}.
 */
public class SubscriberException extends RuntimeException {

  /**
   * Constructs a new SubscriberException with the specified detail message.
   *
   * @param message the detail message
   */
  public SubscriberException(String message) {
    super(message);
  }

  /**
   * Constructs a new SubscriberException with the specified detail message and cause.
   *
   * @param message the detail message
   * @param cause the cause of the exception
   */
  public SubscriberException(String message, Throwable cause) {
    super(message, cause);
  }
}
