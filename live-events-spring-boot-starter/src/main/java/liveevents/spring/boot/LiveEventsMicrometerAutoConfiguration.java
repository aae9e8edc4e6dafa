package liveevents.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import liveevents.micrometer.MicrometerMetricsExporter;
import liveevents.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath,
 * a {@link MeterRegistry} bean exists and {@code live-events.metrics.enabled} is true
 * (default).
 *
 * <p>Runs before {@link LiveEventsAutoConfiguration} so the {@link MetricsExporter}
 * bean is installed into the worker.
 */
@AutoConfiguration(before = LiveEventsAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "live-events.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(LiveEventsProperties.class)
public class LiveEventsMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter liveEventsMetricsExporter(
      MeterRegistry meterRegistry, LiveEventsProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
