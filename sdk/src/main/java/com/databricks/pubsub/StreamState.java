package com.databricks.pubsub;

/**
 * Represents the lifecycle state of the streaming pull connection.
 *
 * <p>State transitions follow this pattern:
 *
 * <pre>
 * NULL → ACTIVE → DISCONNECTING → FINISHING → NULL (reconnect or done)
 *                       ↑
 *      read/write failure or shutdown while a read or write is in flight
 * </pre>
 *
 * <p>The connect sequence (start, initial write, first read) runs in {@link #NULL}; the stream
 * only becomes {@link #ACTIVE} once the first response has been read.
 */
public enum StreamState {
  /** No stream is open, or a stream is being connected */
  NULL,

  /** The stream is open and reading batches */
  ACTIVE,

  /** The stream is being torn down, waiting for in-flight reads and writes */
  DISCONNECTING,

  /** Finish has been issued and its status is pending */
  FINISHING
}
