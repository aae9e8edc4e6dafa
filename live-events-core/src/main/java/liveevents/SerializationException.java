package liveevents;

/**
 * Thrown synchronously from {@link Client#postEvent} when the payload or context
 * contains a value that has no JSON representation.
 */
public final class SerializationException extends LiveEventsException {

  public SerializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
