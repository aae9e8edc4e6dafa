package liveevents.spring.boot;

import liveevents.Client;
import liveevents.LiveEvents;
import liveevents.spi.MetricsExporter;
import liveevents.spi.StreamBackend;
import liveevents.worker.AsyncWorker;

import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.Collections;
import java.util.Map;

/**
 * Auto-configuration for live events.
 *
 * <p>Installs the {@link LiveEventsProperties} into the process-wide {@link LiveEvents}
 * facade (settings, queue bound, drain timeout, metrics) and exposes the shared
 * {@link AsyncWorker} and default {@link Client} as beans. A {@link StreamBackend} bean,
 * if present, replaces the default Kinesis backend. When the context closes the worker
 * is stopped, flushing queued events, and the facade's metrics go back to
 * {@link MetricsExporter#NOOP}.
 *
 * @see LiveEventsProperties
 * @see LiveEventsMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(LiveEvents.class)
@ConditionalOnProperty(prefix = "live-events", name = "stream-name")
@EnableConfigurationProperties(LiveEventsProperties.class)
public class LiveEventsAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AsyncWorker liveEventsWorker(LiveEventsProperties props,
      ObjectProvider<MetricsExporter> metricsProvider) {
    Map<String, Object> settings = Collections.unmodifiableMap(props.toSettings());
    LiveEvents.settings(() -> settings);
    LiveEvents.maxQueueSize(props::getMaxQueueSize);
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      LiveEvents.metrics(metrics);
    }
    AsyncWorker worker = LiveEvents.worker();
    worker.drainTimeout(props.getDrainTimeout());
    return worker;
  }

  @Bean
  @ConditionalOnMissingBean
  public Client liveEventsClient(AsyncWorker liveEventsWorker,
      ObjectProvider<StreamBackend> backendProvider) {
    StreamBackend backend = backendProvider.getIfAvailable();
    if (backend != null) {
      LiveEvents.streamClient(backend);
    }
    return LiveEvents.client();
  }

  /**
   * Destroyed before the worker it depends on: flushes the queue, then uninstalls the
   * context's exporter so later events are not reported to closed meters.
   */
  @Bean
  public DisposableBean liveEventsShutdown(AsyncWorker liveEventsWorker) {
    return () -> {
      liveEventsWorker.stop();
      LiveEvents.metrics(null);
    };
  }
}
