package liveevents.kinesis;

import liveevents.Client;
import liveevents.LiveEvents;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.kinesis.model.PutRecordRequest;
import software.amazon.awssdk.services.kinesis.model.ResourceNotFoundException;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KinesisClientIntegrationTest {

  @BeforeEach
  void setUp() {
    LiveEvents.reset();
  }

  @AfterEach
  void tearDown() {
    LiveEvents.reset();
  }

  @Test
  void clientWithoutBackendUsesKinesis() {
    Client client = new Client(Map.of(
        "stream_name", "live-events",
        "aws_endpoint", "http://localhost:4567/"));

    KinesisStreamBackend backend = assertInstanceOf(KinesisStreamBackend.class, client.streamBackend());
    assertEquals("http://localhost:4567/",
        backend.kinesisClient().serviceClientConfiguration().endpointOverride().orElseThrow().toString());
    backend.close();
  }

  @Test
  void postedEventReachesKinesis() {
    FakeKinesisClient fake = new FakeKinesisClient();
    Client client = new Client(Map.of("stream_name", "live-events", "aws_region", "us-east-1"),
        new KinesisStreamBackend(fake.client()));

    LiveEvents.setContext(Map.of("user_id", 42));
    client.postEvent("course_created", Map.of("course_id", 7),
        Instant.parse("2015-03-01T12:34:56.789Z"), null, null);
    LiveEvents.worker().stop();

    assertEquals(1, fake.puts.size());
    PutRecordRequest request = fake.puts.get(0);
    assertEquals("live-events", request.streamName());
    assertEquals("42", request.partitionKey());
    assertEquals("{\"attributes\":{\"event_name\":\"course_created\","
            + "\"event_time\":\"2015-03-01T12:34:56.789Z\",\"user_id\":42},"
            + "\"body\":{\"course_id\":7}}",
        request.data().asUtf8String());
  }

  @Test
  void isValidDescribesStream() {
    FakeKinesisClient fake = new FakeKinesisClient();
    Client client = new Client(Map.of("stream_name", "live-events", "aws_region", "us-east-1"),
        new KinesisStreamBackend(fake.client()));

    assertTrue(client.isValid());

    fake.failure = ResourceNotFoundException.builder()
        .message("gone").build();
    assertFalse(client.isValid());
  }
}
