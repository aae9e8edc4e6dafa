package liveevents.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void incrementEnqueuedTagsEventName() {
    exporter.incrementEnqueued("course_created");
    exporter.incrementEnqueued("course_created");
    exporter.incrementEnqueued("logged_in");

    assertEquals(2.0, counter("live_events.events.enqueued", "course_created").count());
    assertEquals(1.0, counter("live_events.events.enqueued", "logged_in").count());
  }

  @Test
  void incrementSendSuccess() {
    exporter.incrementSendSuccess("e");
    assertEquals(1.0, counter("live_events.events.sends", "e").count());
  }

  @Test
  void incrementSendError() {
    exporter.incrementSendError("e");
    assertEquals(1.0, counter("live_events.events.send_errors", "e").count());
  }

  @Test
  void incrementQueueFull() {
    exporter.incrementQueueFull("e");
    exporter.incrementQueueFull("e");
    assertEquals(2.0, counter("live_events.events.queue_full_errors", "e").count());
  }

  @Test
  void incrementDropped() {
    exporter.incrementDropped("e");
    assertEquals(1.0, counter("live_events.events.dropped", "e").count());
  }

  @Test
  void recordQueueDepth() {
    exporter.recordQueueDepth(42);
    assertEquals(42.0, gauge("live_events.queue.depth").value());

    exporter.recordQueueDepth(0);
    assertEquals(0.0, gauge("live_events.queue.depth").value());
  }

  @Test
  void recordDeliveryLatencyMs() {
    exporter.recordDeliveryLatencyMs(10);
    exporter.recordDeliveryLatencyMs(30);

    DistributionSummary summary = registry.find("live_events.delivery.latency.ms").summary();
    assertNotNull(summary);
    assertEquals(2, summary.count());
    assertEquals(40.0, summary.totalAmount());
  }

  @Test
  void customPrefix() {
    MicrometerMetricsExporter custom = new MicrometerMetricsExporter(registry, "canvas.live_events");

    custom.incrementSendSuccess("e");

    assertEquals(1.0, counter("canvas.live_events.events.sends", "e").count());
  }

  @Test
  void rejectsBadPrefix() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "x."));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementEnqueued("e");
    exporter.recordQueueDepth(5);

    exporter.close();
    exporter.incrementEnqueued("e");
    exporter.recordQueueDepth(9);

    assertNull(registry.find("live_events.events.enqueued").counter());
    assertNull(registry.find("live_events.queue.depth").gauge());
    assertNull(registry.find("live_events.delivery.latency.ms").summary());
  }

  private Counter counter(String name, String event) {
    Counter counter = registry.find(name).tag("event", event).counter();
    assertNotNull(counter, "counter " + name + " for " + event);
    return counter;
  }

  private Gauge gauge(String name) {
    Gauge gauge = registry.find(name).gauge();
    assertNotNull(gauge, "gauge " + name);
    return gauge;
  }
}
