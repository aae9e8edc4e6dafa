package liveevents;

import liveevents.spi.StreamBackend;
import liveevents.worker.AsyncWorker;
import liveevents.worker.DeliveryJob;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Posts events to a stream through the process-wide {@link AsyncWorker}.
 *
 * <p>{@link #postEvent} merges the ambient context with the call-site context, builds and
 * encodes the event, and queues it. It never waits on the network and never reports
 * delivery failures; only configuration and serialization problems reach the caller.
 *
 * <h2>Backend resolution</h2>
 * <p>Resolved once, at construction:
 * <ol>
 *   <li>the backend passed to the constructor;</li>
 *   <li>otherwise the process-wide backend set with
 *       {@link LiveEvents#streamClient(StreamBackend)};</li>
 *   <li>otherwise the default backend built by {@link StreamBackends#createDefault}
 *       from {@link #awsConfig(Map)}.</li>
 * </ol>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Client client = new Client(Map.of(
 *     "stream_name", "live-events",
 *     "aws_region", "us-east-1"));
 * client.postEvent("course_created", Map.of("id", 42), Instant.now(),
 *     Map.of("user_id", 7), null);
 * }</pre>
 *
 * @see LiveEvents
 */
public final class Client {
  private static final Logger logger = Logger.getLogger(Client.class.getName());

  /** Per-record limit of the Kinesis PutRecord API. */
  public static final int MAX_RECORD_BYTES = 1_000_000;

  static final String USER_ID = "user_id";
  private static final int RANDOM_PARTITIONS = 1000;

  private final String streamName;
  private final StreamBackend streamBackend;
  private final EventSerializer serializer;
  private final ContextStore contextStore;
  private final AsyncWorker worker;

  /**
   * Creates a client from the process-wide settings ({@link #config()}).
   *
   * @throws ConfigurationException if live events are not configured
   */
  public Client() {
    this(null, null, null);
  }

  public Client(Map<String, ?> config) {
    this(config, null, null);
  }

  public Client(Map<String, ?> config, StreamBackend streamBackend) {
    this(config, streamBackend, null);
  }

  /**
   * Creates a client.
   *
   * @param config        settings keyed by {@link ConfigKeys}; {@code null} reads {@link #config()}
   * @param streamBackend backend to deliver to; {@code null} resolves one as described above
   * @param streamName    destination stream; {@code null} reads it from {@code config}
   * @throws ConfigurationException if no stream name or backend can be resolved
   */
  public Client(Map<String, ?> config, StreamBackend streamBackend, String streamName) {
    this(config, streamBackend, streamName, LiveEvents.contextStore(), LiveEvents.worker());
  }

  Client(Map<String, ?> config, StreamBackend streamBackend, String streamName,
      ContextStore contextStore, AsyncWorker worker) {
    Map<String, ?> settings = config != null ? config : config();
    if (settings == null) {
      throw new ConfigurationException("Live events are not configured: "
          + ConfigKeys.STREAM_NAME + " and " + ConfigKeys.AWS_REGION + " or "
          + ConfigKeys.AWS_ENDPOINT + " are required");
    }
    this.streamName = streamName != null ? streamName : ConfigKeys.streamName(settings);
    if (this.streamName == null) {
      throw new ConfigurationException(ConfigKeys.STREAM_NAME + " is required");
    }
    this.contextStore = Objects.requireNonNull(contextStore, "contextStore");
    this.worker = Objects.requireNonNull(worker, "worker");
    this.serializer = new EventSerializer();

    StreamBackend backend = streamBackend != null ? streamBackend : LiveEvents.streamClient();
    this.streamBackend = backend != null ? backend : StreamBackends.createDefault(awsConfig(settings));
  }

  /**
   * Returns a snapshot of the process-wide settings, or {@code null} when they lack a
   * stream name or both region and endpoint.
   *
   * @return settings copy, or {@code null}
   */
  public static Map<String, Object> config() {
    Map<String, ?> settings = LiveEvents.settings();
    if (settings == null || ConfigKeys.streamName(settings) == null) {
      return null;
    }
    if (ConfigKeys.lookup(settings, ConfigKeys.AWS_REGION) == null
        && ConfigKeys.lookup(settings, ConfigKeys.AWS_ENDPOINT) == null) {
      return null;
    }
    return new LinkedHashMap<>(settings);
  }

  /**
   * Parses raw settings into a backend connection descriptor.
   *
   * @param rawConfig settings keyed by {@link ConfigKeys}
   * @return the descriptor
   * @see AwsConfig#from(Map)
   */
  public static AwsConfig awsConfig(Map<String, ?> rawConfig) {
    return AwsConfig.from(rawConfig);
  }

  /**
   * Queues an event for delivery.
   *
   * @param eventName    name of the event
   * @param payload      event body; {@code null} is sent as an empty object
   * @param time         when the event happened; {@code null} means now
   * @param context      call-site attributes, overriding ambient context on collision
   * @param partitionKey shard key; {@code null} or empty derives one from {@code user_id}
   *                     or picks a random one
   * @throws SerializationException if the payload or context cannot be encoded
   */
  public void postEvent(String eventName, Map<String, ?> payload, Instant time,
      Map<String, ?> context, String partitionKey) {
    Map<String, Object> merged = contextStore.mergedWith(context);
    Event event = serializer.toEvent(eventName, payload, time == null ? Instant.now() : time, merged);
    byte[] data = serializer.encode(event);
    if (data.length > MAX_RECORD_BYTES) {
      worker.metrics().incrementDropped(eventName);
      logger.log(Level.SEVERE, "Dropping live event " + eventName + ": record is "
          + data.length + " bytes, limit is " + MAX_RECORD_BYTES);
      return;
    }
    String key = resolvePartitionKey(partitionKey, merged);
    worker.push(new DeliveryJob(streamBackend, streamName, key, data, eventName));
  }

  /**
   * Checks the backend for the configured stream.
   *
   * @return {@code true} if the stream is reachable
   */
  public boolean isValid() {
    try {
      return streamBackend.isAvailable(streamName);
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Stream " + streamName + " is not available", e);
      return false;
    }
  }

  public String streamName() {
    return streamName;
  }

  public StreamBackend streamBackend() {
    return streamBackend;
  }

  static String resolvePartitionKey(String partitionKey, Map<String, ?> context) {
    if (partitionKey != null && !partitionKey.isEmpty()) {
      return partitionKey;
    }
    Object userId = context.get(USER_ID);
    if (userId != null && !userId.toString().isEmpty()) {
      return userId.toString();
    }
    return Integer.toString(ThreadLocalRandom.current().nextInt(RANDOM_PARTITIONS));
  }
}
