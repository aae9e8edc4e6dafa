package liveevents.kinesis;

import liveevents.DeliveryException;
import liveevents.spi.StreamBackend;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.kinesis.KinesisClient;
import software.amazon.awssdk.services.kinesis.model.DescribeStreamSummaryRequest;
import software.amazon.awssdk.services.kinesis.model.PutRecordRequest;
import software.amazon.awssdk.services.kinesis.model.PutRecordResponse;
import software.amazon.awssdk.services.kinesis.model.StreamStatus;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link StreamBackend} that writes each record with a single Kinesis {@code PutRecord} call.
 *
 * <p>Calls are synchronous and made from the delivery worker thread only. SDK failures
 * (service errors, throttling, network problems after the SDK's own retries) surface as
 * {@link DeliveryException}.
 */
public final class KinesisStreamBackend implements StreamBackend, AutoCloseable {
  private static final Logger logger = Logger.getLogger(KinesisStreamBackend.class.getName());

  private final KinesisClient kinesis;

  public KinesisStreamBackend(KinesisClient kinesis) {
    this.kinesis = Objects.requireNonNull(kinesis, "kinesis");
  }

  @Override
  public void deliver(String streamName, byte[] data, String partitionKey) {
    PutRecordRequest request = PutRecordRequest.builder()
        .streamName(streamName)
        .partitionKey(partitionKey)
        .data(SdkBytes.fromByteArray(data))
        .build();
    try {
      PutRecordResponse response = kinesis.putRecord(request);
      logger.finest(() -> "Put record to " + streamName + " shard=" + response.shardId()
          + " seq=" + response.sequenceNumber());
    } catch (SdkException e) {
      throw new DeliveryException("PutRecord to stream " + streamName + " failed", e);
    }
  }

  /**
   * Describes the stream and reports whether it accepts writes.
   *
   * @param streamName stream to check
   * @return {@code true} if the stream is {@code ACTIVE} or {@code UPDATING}
   * @throws DeliveryException if the stream cannot be described
   */
  @Override
  public boolean isAvailable(String streamName) {
    try {
      StreamStatus status = kinesis.describeStreamSummary(DescribeStreamSummaryRequest.builder()
              .streamName(streamName)
              .build())
          .streamDescriptionSummary()
          .streamStatus();
      return status == StreamStatus.ACTIVE || status == StreamStatus.UPDATING;
    } catch (SdkException e) {
      throw new DeliveryException("DescribeStreamSummary for stream " + streamName + " failed", e);
    }
  }

  public KinesisClient kinesisClient() {
    return kinesis;
  }

  @Override
  public void close() {
    kinesis.close();
  }
}
