package liveevents;

/**
 * Thrown when a {@link Client} cannot be constructed because a required setting is
 * missing or no stream backend can be resolved.
 */
public final class ConfigurationException extends LiveEventsException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
