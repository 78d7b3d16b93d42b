package com.databricks.pubsub;

/**
 * An exception that indicates a non-retriable error has occurred.
 *
 * <p>This exception is thrown when the error is permanent and cannot be resolved by retrying.
 * Common causes include:
 *
 * <ul>
 *   <li>The subscription does not exist
 *   <li>The caller lacks permission on the subscription
 *   <li>The transport could not open a stream at all
 *   <li>Invalid configuration parameters
 * </ul>
 *
 * <p>When this exception is thrown, the operation should not be retried without first fixing the
 * underlying issue. Contrast with {@link SubscriberException} which indicates a retriable error.
 *
 * @see SubscriberException
 */
public class NonRetriableException extends SubscriberException {

  /**
   * Constructs a new NonRetriableException with the specified detail message.
   *
   * @param message the detail message
   */
  public NonRetriableException(String message) {
    super(message);
  }

  /**
   * Constructs a new NonRetriableException with the specified detail message and cause.
   *
   * @param message the detail message
   * @param cause the cause of the exception
   */
  public NonRetriableException(String message, Throwable cause) {
    super(message, cause);
  }
}
