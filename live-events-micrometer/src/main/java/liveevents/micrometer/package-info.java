/**
 * Micrometer bridge for live events delivery metrics.
 *
 * <p>Install with {@code LiveEvents.metrics(new MicrometerMetricsExporter(registry))}.
 */
package liveevents.micrometer;
