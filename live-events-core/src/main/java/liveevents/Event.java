package liveevents;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable wire record: an attribute map (metadata) and a body (payload).
 *
 * <p>Attributes always carry {@value #EVENT_NAME} and {@value #EVENT_TIME}; the event
 * time is truncated to milliseconds and rendered as ISO-8601 UTC with exactly three
 * fractional digits, e.g. {@code 2015-03-01T12:34:56.789Z}. Context entries are merged
 * after the two reserved keys and can never replace them.
 *
 * @see EventSerializer
 */
public final class Event {
  public static final String EVENT_NAME = "event_name";
  public static final String EVENT_TIME = "event_time";

  private static final DateTimeFormatter EVENT_TIME_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  private final String eventName;
  private final Instant eventTime;
  private final Map<String, Object> attributes;
  private final Map<String, Object> body;

  private Event(String eventName, Instant eventTime,
      Map<String, Object> attributes, Map<String, Object> body) {
    this.eventName = eventName;
    this.eventTime = eventTime;
    this.attributes = Collections.unmodifiableMap(attributes);
    this.body = Collections.unmodifiableMap(body);
  }

  /**
   * Creates an event from its parts.
   *
   * @param eventName name of the event; must not be empty
   * @param eventTime when the event happened
   * @param context   attribute entries to merge in; may be {@code null}
   * @param body      event payload; {@code null} becomes an empty body
   * @return a new event
   */
  public static Event of(String eventName, Instant eventTime,
      Map<String, ?> context, Map<String, ?> body) {
    Objects.requireNonNull(eventName, "eventName");
    Objects.requireNonNull(eventTime, "eventTime");
    if (eventName.isEmpty()) {
      throw new IllegalArgumentException("eventName cannot be empty");
    }
    Instant time = eventTime.truncatedTo(ChronoUnit.MILLIS);

    Map<String, Object> attrs = new LinkedHashMap<>();
    attrs.put(EVENT_NAME, eventName);
    attrs.put(EVENT_TIME, formatTime(time));
    if (context != null) {
      for (Map.Entry<String, ?> entry : context.entrySet()) {
        if (entry.getKey() == null) {
          throw new IllegalArgumentException("context cannot contain null keys");
        }
        attrs.putIfAbsent(entry.getKey(), entry.getValue());
      }
    }
    return new Event(eventName, time, attrs, copyOf(body));
  }

  /**
   * Rebuilds an event from decoded wire maps.
   *
   * @param attributes decoded {@code attributes} object
   * @param body       decoded {@code body} object
   * @return the event
   * @throws IllegalArgumentException if a reserved attribute is missing or malformed
   */
  static Event fromWire(Map<String, Object> attributes, Map<String, Object> body) {
    Object name = attributes.get(EVENT_NAME);
    Object time = attributes.get(EVENT_TIME);
    if (!(name instanceof String) || !(time instanceof String)) {
      throw new IllegalArgumentException(
          "attributes must contain string " + EVENT_NAME + " and " + EVENT_TIME);
    }
    return new Event((String) name, Instant.parse((String) time), copyOf(attributes), copyOf(body));
  }

  private static Map<String, Object> copyOf(Map<String, ?> source) {
    Map<String, Object> copy = new LinkedHashMap<>();
    if (source != null) {
      copy.putAll(source);
    }
    return copy;
  }

  /**
   * Formats an instant the way {@value #EVENT_TIME} is written on the wire.
   *
   * @param time the instant
   * @return ISO-8601 UTC text with millisecond precision
   */
  public static String formatTime(Instant time) {
    return EVENT_TIME_FORMAT.format(time);
  }

  public String eventName() {
    return eventName;
  }

  public Instant eventTime() {
    return eventTime;
  }

  public Map<String, Object> attributes() {
    return attributes;
  }

  public Map<String, Object> body() {
    return body;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Event other)) return false;
    return eventName.equals(other.eventName)
        && eventTime.equals(other.eventTime)
        && attributes.equals(other.attributes)
        && body.equals(other.body);
  }

  @Override
  public int hashCode() {
    return Objects.hash(eventName, eventTime, attributes, body);
  }

  @Override
  public String toString() {
    return "Event{eventName=" + eventName + ", eventTime=" + formatTime(eventTime)
        + ", attributes=" + attributes.keySet() + '}';
  }
}
