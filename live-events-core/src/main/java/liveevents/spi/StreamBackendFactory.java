package liveevents.spi;

import liveevents.AwsConfig;

/**
 * Builds the default {@link StreamBackend} from resolved connection settings.
 *
 * <p>Factories are discovered with {@link java.util.ServiceLoader} from
 * {@code META-INF/services/liveevents.spi.StreamBackendFactory}. The
 * {@code live-events-kinesis} module registers one.
 *
 * @see liveevents.StreamBackends
 */
public interface StreamBackendFactory {

  /**
   * Short identifier used in log messages, e.g. {@code "kinesis"}.
   *
   * @return factory name
   */
  String name();

  /**
   * Creates a backend connected according to {@code config}.
   *
   * @param config endpoint, region and credential settings
   * @return a new backend
   */
  StreamBackend create(AwsConfig config);
}
