package liveevents.worker;

import liveevents.spi.StreamBackend;

import java.util.Arrays;
import java.util.Objects;

/**
 * One encoded record waiting for delivery, together with the backend that must receive it.
 *
 * <p>Owned by the {@link AsyncWorker} queue until dequeued, then by the worker thread for
 * the duration of the backend call.
 */
public final class DeliveryJob {
  private final StreamBackend backend;
  private final String streamName;
  private final String partitionKey;
  private final byte[] data;
  private final String eventName;

  public DeliveryJob(StreamBackend backend, String streamName, String partitionKey,
      byte[] data, String eventName) {
    this.backend = Objects.requireNonNull(backend, "backend");
    this.streamName = Objects.requireNonNull(streamName, "streamName");
    this.partitionKey = Objects.requireNonNull(partitionKey, "partitionKey");
    Objects.requireNonNull(data, "data");
    this.data = Arrays.copyOf(data, data.length);
    this.eventName = Objects.requireNonNull(eventName, "eventName");
  }

  public StreamBackend backend() {
    return backend;
  }

  public String streamName() {
    return streamName;
  }

  public String partitionKey() {
    return partitionKey;
  }

  /** Encoded record; the returned array is shared, callers must not modify it. */
  byte[] data() {
    return data;
  }

  public int size() {
    return data.length;
  }

  public String eventName() {
    return eventName;
  }

  @Override
  public String toString() {
    return "DeliveryJob{eventName=" + eventName
        + ", streamName=" + streamName
        + ", partitionKey=" + partitionKey
        + ", bytes=" + data.length + '}';
  }
}
