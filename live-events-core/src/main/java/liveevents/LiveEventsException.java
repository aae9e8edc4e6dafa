package liveevents;

/**
 * Base type for all exceptions raised by the live events library.
 *
 * <p>Only configuration and serialization problems reach the caller of
 * {@link Client#postEvent}. Delivery failures are absorbed by the
 * {@linkplain liveevents.worker.AsyncWorker worker}.
 */
public class LiveEventsException extends RuntimeException {

  public LiveEventsException(String message) {
    super(message);
  }

  public LiveEventsException(String message, Throwable cause) {
    super(message, cause);
  }
}
