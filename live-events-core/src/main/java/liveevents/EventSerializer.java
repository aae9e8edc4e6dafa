package liveevents;

import liveevents.util.JsonCodec;

import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Converts events to and from the wire format
 * {@code {"attributes": {...}, "body": {...}}} encoded as UTF-8 JSON.
 *
 * <p>The context key {@value #COMPACT_LIVE_EVENTS} is a client-side control flag and is
 * never written into the attributes.
 */
public final class EventSerializer {
  public static final String ATTRIBUTES = "attributes";
  public static final String BODY = "body";
  public static final String COMPACT_LIVE_EVENTS = "compact_live_events";

  private final JsonCodec codec;

  public EventSerializer() {
    this(JsonCodec.getDefault());
  }

  public EventSerializer(JsonCodec codec) {
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  /**
   * Builds the canonical event for a post.
   *
   * @param eventName name of the event
   * @param payload   event body; {@code null} is treated as empty
   * @param time      when the event happened
   * @param context   merged ambient and call-site context
   * @return the event
   */
  public Event toEvent(String eventName, Map<String, ?> payload, Instant time, Map<String, ?> context) {
    Map<String, Object> attributes = new LinkedHashMap<>();
    if (context != null) {
      attributes.putAll(context);
      attributes.remove(COMPACT_LIVE_EVENTS);
    }
    return Event.of(eventName, time, attributes, payload);
  }

  /**
   * Encodes an event.
   *
   * @param event the event
   * @return UTF-8 JSON bytes
   * @throws SerializationException if an attribute or body value has no JSON form
   */
  public byte[] encode(Event event) {
    Map<String, Object> wire = new LinkedHashMap<>();
    wire.put(ATTRIBUTES, event.attributes());
    wire.put(BODY, event.body());
    try {
      return codec.toJson(wire).getBytes(StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      throw new SerializationException(
          "Cannot encode event " + event.eventName() + ": " + e.getMessage(), e);
    }
  }

  /**
   * Decodes a record produced by {@link #encode}.
   *
   * @param data UTF-8 JSON bytes
   * @return the event
   * @throws SerializationException if the bytes are not a valid wire record
   */
  @SuppressWarnings("unchecked")
  public Event decode(byte[] data) {
    try {
      Map<String, Object> wire = codec.parseObject(new String(data, StandardCharsets.UTF_8));
      Object attributes = wire.get(ATTRIBUTES);
      Object body = wire.get(BODY);
      if (!(attributes instanceof Map)) {
        throw new IllegalArgumentException("missing attributes object");
      }
      if (body != null && !(body instanceof Map)) {
        throw new IllegalArgumentException("body must be an object");
      }
      return Event.fromWire((Map<String, Object>) attributes, (Map<String, Object>) body);
    } catch (IllegalArgumentException | DateTimeException e) {
      throw new SerializationException("Cannot decode live event record: " + e.getMessage(), e);
    }
  }
}
