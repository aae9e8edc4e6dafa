package liveevents;

import liveevents.spi.StreamBackend;
import liveevents.spi.StreamBackendFactory;

import java.util.List;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/**
 * Locates the default {@link StreamBackend} implementation.
 *
 * <p>Factories are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/liveevents.spi.StreamBackendFactory}. The first one found
 * wins; adding {@code live-events-kinesis} to the class path registers the Kinesis
 * backend.
 */
public final class StreamBackends {
  private static final Logger logger = Logger.getLogger(StreamBackends.class.getName());

  private static final List<StreamBackendFactory> FACTORIES = ServiceLoader
      .load(StreamBackendFactory.class)
      .stream()
      .map(ServiceLoader.Provider::get)
      .toList();

  private StreamBackends() {
  }

  /**
   * Returns all registered factories.
   *
   * @return factories in discovery order
   */
  public static List<StreamBackendFactory> factories() {
    return FACTORIES;
  }

  /**
   * Builds the default backend from {@code config}.
   *
   * @param config connection settings
   * @return a new backend
   * @throws ConfigurationException if no factory is registered
   */
  public static StreamBackend createDefault(AwsConfig config) {
    if (FACTORIES.isEmpty()) {
      throw new ConfigurationException("No StreamBackendFactory registered; add live-events-kinesis "
          + "to the class path or inject a StreamBackend");
    }
    StreamBackendFactory factory = FACTORIES.get(0);
    logger.fine(() -> "Creating default stream backend '" + factory.name() + "' with " + config);
    return factory.create(config);
  }
}
