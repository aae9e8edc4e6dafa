package liveevents;

/**
 * Raised by a {@link liveevents.spi.StreamBackend} when a record could not be written.
 *
 * <p>The worker treats every delivery failure as non-fatal: the record is logged and
 * discarded, and the worker moves on to the next queued record. There is no retry.
 */
public class DeliveryException extends LiveEventsException {

  public DeliveryException(String message) {
    super(message);
  }

  public DeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
