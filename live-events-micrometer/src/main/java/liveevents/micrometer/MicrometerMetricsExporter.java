package liveevents.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import liveevents.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, a gauge and a distribution summary with a {@link MeterRegistry}
 * for export to Prometheus, StatsD, Datadog, and other monitoring backends.
 *
 * <h3>Counters (tagged {@code event=<event name>})</h3>
 * <ul>
 *   <li>{@code live_events.events.enqueued}: records accepted onto the queue</li>
 *   <li>{@code live_events.events.sends}: records the backend accepted</li>
 *   <li>{@code live_events.events.send_errors}: records the backend rejected</li>
 *   <li>{@code live_events.events.queue_full_errors}: records dropped, queue full</li>
 *   <li>{@code live_events.events.dropped}: records dropped, over the size limit</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code live_events.queue.depth}: current queue depth</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code live_events.delivery.latency.ms}: duration of each backend call</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    public static final String DEFAULT_PREFIX = "live_events";
    static final String EVENT_TAG = "event";

    private final MeterRegistry registry;
    private final String namePrefix;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Gauge depthGauge;
    private final DistributionSummary deliveryLatency;

    private final AtomicInteger depth = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "live_events"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * Creates an exporter with a custom metric name prefix.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "canvas.live_events"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.namePrefix = namePrefix;
        this.depthGauge = Gauge.builder(namePrefix + ".queue.depth", depth, AtomicInteger::get)
                .description("Live events waiting for delivery")
                .register(registry);
        this.deliveryLatency = DistributionSummary.builder(namePrefix + ".delivery.latency.ms")
                .description("Backend delivery call duration in milliseconds")
                .register(registry);
    }

    @Override
    public void incrementEnqueued(String eventName) {
        increment("enqueued", "Live events accepted onto the queue", eventName);
    }

    @Override
    public void incrementQueueFull(String eventName) {
        increment("queue_full_errors", "Live events dropped because the queue was full", eventName);
    }

    @Override
    public void incrementDropped(String eventName) {
        increment("dropped", "Live events dropped because they exceed the record size limit", eventName);
    }

    @Override
    public void incrementSendSuccess(String eventName) {
        increment("sends", "Live events delivered to the stream", eventName);
    }

    @Override
    public void incrementSendError(String eventName) {
        increment("send_errors", "Live events the stream rejected", eventName);
    }

    @Override
    public void recordQueueDepth(int depth) {
        if (closed) return;
        this.depth.set(depth);
    }

    @Override
    public void recordDeliveryLatencyMs(long latencyMs) {
        if (closed) return;
        deliveryLatency.record(latencyMs);
    }

    private void increment(String name, String description, String eventName) {
        if (closed) return;
        String meterName = namePrefix + ".events." + name;
        counters.computeIfAbsent(meterName + '|' + eventName, key -> Counter.builder(meterName)
                .description(description)
                .tag(EVENT_TAG, eventName)
                .register(registry))
            .increment();
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this when the exporter is no longer needed to prevent stale gauges.
     */
    @Override
    public void close() {
        closed = true;
        List<Meter> meters = new ArrayList<>(counters.values());
        meters.add(depthGauge);
        meters.add(deliveryLatency);
        counters.clear();
        RuntimeException first = null;
        for (Meter meter : meters) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
