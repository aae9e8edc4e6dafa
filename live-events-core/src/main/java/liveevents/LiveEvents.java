package liveevents;

import liveevents.spi.MetricsExporter;
import liveevents.spi.StreamBackend;
import liveevents.worker.AsyncWorker;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntSupplier;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Process-wide entry point: ambient context, settings, the shared worker, and a lazily
 * created default {@link Client}.
 *
 * <h2>Lifecycle</h2>
 * <p>Configure once at process start ({@link #settings(Supplier)},
 * {@link #maxQueueSize(IntSupplier)}, optionally {@link #streamClient(StreamBackend)} and
 * {@link #metrics(MetricsExporter)}), post events from any thread, and call
 * {@code LiveEvents.worker().stop()} before exit to flush queued events.
 * {@link #reset()} restores the initial state for test isolation.
 *
 * <p>Setters are meant for setup phases; they are not linearizable with live traffic.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * LiveEvents.settings(() -> Map.of("stream_name", "live-events", "aws_region", "us-east-1"));
 * LiveEvents.setContext(Map.of("user_id", 123));
 * LiveEvents.postEvent("logged_in", Map.of("redirect", "/"), "123");
 * LiveEvents.worker().stop();
 * }</pre>
 */
public final class LiveEvents {
  private static final Logger logger = Logger.getLogger(LiveEvents.class.getName());

  private static final IntSupplier DEFAULT_MAX_QUEUE_SIZE = () -> AsyncWorker.DEFAULT_MAX_QUEUE_SIZE;
  private static final Supplier<Map<String, ?>> NO_SETTINGS = Collections::emptyMap;

  private static final ContextStore CONTEXT = new ContextStore();

  private static volatile IntSupplier maxQueueSize = DEFAULT_MAX_QUEUE_SIZE;
  private static volatile Supplier<? extends Map<String, ?>> settings = NO_SETTINGS;
  private static volatile StreamBackend streamClient;
  private static volatile Client client;

  private static final AsyncWorker WORKER = AsyncWorker.builder()
      .maxQueueSize(() -> maxQueueSize.getAsInt())
      .build();

  private LiveEvents() {
  }

  /**
   * Merges entries into the ambient context sent with every subsequent event.
   *
   * @param context entries to add or replace
   */
  public static void setContext(Map<String, ?> context) {
    CONTEXT.set(context);
  }

  /** Removes all ambient context. */
  public static void clearContext() {
    CONTEXT.clear();
  }

  public static Map<String, Object> currentContext() {
    return CONTEXT.current();
  }

  static ContextStore contextStore() {
    return CONTEXT;
  }

  /**
   * Posts an event through the default client. Does nothing when live events are not
   * configured (see {@link Client#config()}).
   *
   * @param eventName    name of the event
   * @param payload      event body
   * @param time         when the event happened; {@code null} means now
   * @param partitionKey shard key; {@code null} derives one
   * @param context      call-site context; may be {@code null}
   */
  public static void postEvent(String eventName, Map<String, ?> payload, Instant time,
      String partitionKey, Map<String, ?> context) {
    if (Client.config() == null) {
      logger.fine(() -> "Live events not configured; skipping " + eventName);
      return;
    }
    client().postEvent(eventName, payload, time, context, partitionKey);
  }

  public static void postEvent(String eventName, Map<String, ?> payload, Instant time,
      String partitionKey) {
    postEvent(eventName, payload, time, partitionKey, null);
  }

  public static void postEvent(String eventName, Map<String, ?> payload, String partitionKey) {
    postEvent(eventName, payload, null, partitionKey, null);
  }

  /**
   * Returns the default client, creating it from {@link Client#config()} on first use.
   *
   * @return the shared client
   * @throws ConfigurationException if live events are not configured
   */
  public static Client client() {
    Client current = client;
    if (current == null) {
      synchronized (LiveEvents.class) {
        current = client;
        if (current == null) {
          current = new Client();
          client = current;
        }
      }
    }
    return current;
  }

  /** Returns the process-wide delivery worker. */
  public static AsyncWorker worker() {
    return WORKER;
  }

  /**
   * Sets the queue bound, evaluated on every push.
   *
   * @param size supplier of the maximum number of queued events
   */
  public static void maxQueueSize(IntSupplier size) {
    maxQueueSize = Objects.requireNonNull(size, "size");
  }

  public static int maxQueueSize() {
    return maxQueueSize.getAsInt();
  }

  /**
   * Installs a backend used by every client created afterwards, including the default
   * client, which is discarded so the next post picks the new backend up.
   *
   * @param backend the backend, or {@code null} to go back to the default backend
   */
  public static void streamClient(StreamBackend backend) {
    synchronized (LiveEvents.class) {
      streamClient = backend;
      client = null;
    }
  }

  public static StreamBackend streamClient() {
    return streamClient;
  }

  /**
   * Sets the source of the settings map (keys in {@link ConfigKeys}). The supplier is
   * called whenever settings are read. The default client is discarded.
   *
   * @param source settings supplier
   */
  public static void settings(Supplier<? extends Map<String, ?>> source) {
    Objects.requireNonNull(source, "source");
    synchronized (LiveEvents.class) {
      settings = source;
      client = null;
    }
  }

  /** Returns the current settings, possibly empty, never {@code null}. */
  public static Map<String, ?> settings() {
    Map<String, ?> current = settings.get();
    return current == null ? Collections.emptyMap() : current;
  }

  public static void metrics(MetricsExporter metrics) {
    WORKER.metrics(metrics);
  }

  /**
   * Stops the worker (delivering what is queued) and restores every setting to its
   * initial value.
   */
  public static void reset() {
    WORKER.stop();
    WORKER.metrics(null);
    WORKER.drainTimeout(AsyncWorker.DEFAULT_DRAIN_TIMEOUT);
    CONTEXT.clear();
    synchronized (LiveEvents.class) {
      maxQueueSize = DEFAULT_MAX_QUEUE_SIZE;
      settings = NO_SETTINGS;
      streamClient = null;
      client = null;
    }
  }
}
