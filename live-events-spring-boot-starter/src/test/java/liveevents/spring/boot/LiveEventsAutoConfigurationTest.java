package liveevents.spring.boot;

import liveevents.Client;
import liveevents.ConfigurationException;
import liveevents.LiveEvents;
import liveevents.kinesis.KinesisStreamBackend;
import liveevents.spi.StreamBackend;
import liveevents.worker.AsyncWorker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LiveEventsAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(LiveEventsAutoConfiguration.class));

  @BeforeEach
  void setUp() {
    LiveEvents.reset();
  }

  @AfterEach
  void tearDown() {
    LiveEvents.reset();
  }

  @Test
  void notLoadedWithoutStreamName() {
    runner.run(ctx -> {
      assertFalse(ctx.containsBean("liveEventsClient"));
      assertFalse(ctx.containsBean("liveEventsWorker"));
    });
  }

  @Test
  void createsWorkerAndClient() {
    runner.withUserConfiguration(BackendConfig.class)
        .withPropertyValues("live-events.stream-name=events", "live-events.aws-region=us-east-1")
        .run(ctx -> {
          assertSame(LiveEvents.worker(), ctx.getBean(AsyncWorker.class));
          Client client = ctx.getBean(Client.class);
          assertSame(LiveEvents.client(), client);
          assertEquals("events", client.streamName());
        });
  }

  @Test
  void userBackendReceivesEventsAndShutdownFlushes() {
    ListBackend backend = new ListBackend();
    runner.withBean(StreamBackend.class, () -> backend)
        .withPropertyValues("live-events.stream-name=events", "live-events.aws-region=us-east-1")
        .run(ctx -> {
          assertSame(backend, ctx.getBean(Client.class).streamBackend());
          LiveEvents.postEvent("logged_in", Map.of("redirect", "/"), "123");
        });

    assertEquals(1, backend.records.size());
    assertTrue(backend.records.get(0).contains("\"event_name\":\"logged_in\""));
    assertFalse(LiveEvents.worker().isRunning());
  }

  @Test
  void defaultsToKinesisBackend() {
    runner.withPropertyValues(
            "live-events.stream-name=events",
            "live-events.aws-endpoint=http://localhost:4567/",
            "live-events.aws-access-key-id=id",
            "live-events.aws-secret-access-key=secret")
        .run(ctx -> {
          Client client = ctx.getBean(Client.class);
          KinesisStreamBackend backend = assertInstanceOf(KinesisStreamBackend.class, client.streamBackend());
          assertEquals("http://localhost:4567/", backend.kinesisClient()
              .serviceClientConfiguration().endpointOverride().orElseThrow().toString());
          backend.close();
        });
  }

  @Test
  void failsWithoutRegionOrEndpoint() {
    runner.withPropertyValues("live-events.stream-name=events").run(ctx -> {
      Throwable failure = ctx.getStartupFailure();
      assertNotNull(failure);
      Throwable root = failure;
      while (root.getCause() != null) {
        root = root.getCause();
      }
      assertInstanceOf(ConfigurationException.class, root);
    });
  }

  @Test
  void installsSettingsAndQueueSize() {
    runner.withUserConfiguration(BackendConfig.class)
        .withPropertyValues(
            "live-events.stream-name=events",
            "live-events.aws-region=us-east-1",
            "live-events.max-queue-size=5")
        .run(ctx -> {
          assertEquals(5, LiveEvents.maxQueueSize());
          assertEquals(Map.of("stream_name", "events", "aws_region", "us-east-1"),
              LiveEvents.settings());
        });
  }

  @Test
  void backsOffWhenClientBeanPresent() {
    runner.withUserConfiguration(BackendConfig.class, CustomClientConfig.class)
        .withPropertyValues("live-events.stream-name=events", "live-events.aws-region=us-east-1")
        .run(ctx -> assertEquals("custom", ctx.getBean(Client.class).streamName()));
  }

  static final class ListBackend implements StreamBackend {
    final List<String> records = new CopyOnWriteArrayList<>();

    @Override
    public void deliver(String streamName, byte[] data, String partitionKey) {
      records.add(new String(data, StandardCharsets.UTF_8));
    }
  }

  @Configuration
  static class BackendConfig {
    @Bean
    StreamBackend streamBackend() {
      return new ListBackend();
    }
  }

  @Configuration
  static class CustomClientConfig {
    @Bean
    Client customClient(StreamBackend backend) {
      return new Client(Map.of("stream_name", "custom", "aws_region", "us-east-1"), backend);
    }
  }
}
