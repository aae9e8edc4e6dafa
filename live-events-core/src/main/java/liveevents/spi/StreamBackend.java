package liveevents.spi;

/**
 * Destination that durably accepts encoded event records.
 *
 * <p>The default implementation writes to Amazon Kinesis ({@code live-events-kinesis});
 * tests and alternative transports implement this interface directly and are injected
 * through {@link liveevents.Client} or {@link liveevents.LiveEvents#streamClient(StreamBackend)}.
 *
 * <h2>Execution Model</h2>
 * <p>{@link #deliver} is only ever called from the single delivery worker thread, one
 * record at a time, in enqueue order. Network timeouts are the backend's responsibility;
 * the worker never cancels a call in progress.
 *
 * <h2>Error Handling</h2>
 * <p>Implementations signal failure by throwing, preferably a
 * {@link liveevents.DeliveryException}. The worker logs the failure and drops the record.
 */
public interface StreamBackend {

  /**
   * Writes one record to the named stream.
   *
   * @param streamName   destination stream
   * @param data         UTF-8 encoded JSON record
   * @param partitionKey key used by the backend to route the record to a shard
   * @throws liveevents.DeliveryException if the write fails
   */
  void deliver(String streamName, byte[] data, String partitionKey);

  /**
   * Checks whether the named stream can currently accept records.
   *
   * @param streamName destination stream
   * @return {@code true} if the stream is reachable; the default assumes it is
   */
  default boolean isAvailable(String streamName) {
    return true;
  }
}
