package liveevents.spi;

/**
 * Observability hook for exporting delivery counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, StatsD, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of records accepted onto the delivery queue.
     *
     * @param eventName name of the event
     */
    void incrementEnqueued(String eventName);

    /**
     * Increments the count of records dropped because the queue was full.
     *
     * @param eventName name of the event
     */
    void incrementQueueFull(String eventName);

    /**
     * Increments the count of records dropped before queueing because they exceed
     * the per-record size limit.
     *
     * @param eventName name of the event
     */
    void incrementDropped(String eventName);

    /**
     * Increments the count of records the backend accepted.
     *
     * @param eventName name of the event
     */
    void incrementSendSuccess(String eventName);

    /**
     * Increments the count of records the backend rejected or failed to receive.
     *
     * @param eventName name of the event
     */
    void incrementSendError(String eventName);

    /**
     * Records the current depth of the delivery queue.
     *
     * @param depth number of queued records
     */
    void recordQueueDepth(int depth);

    /**
     * Records how long a single backend call took.
     *
     * @param latencyMs call duration in milliseconds (always non-negative)
     */
    default void recordDeliveryLatencyMs(long latencyMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEnqueued(String eventName) {
        }

        @Override
        public void incrementQueueFull(String eventName) {
        }

        @Override
        public void incrementDropped(String eventName) {
        }

        @Override
        public void incrementSendSuccess(String eventName) {
        }

        @Override
        public void incrementSendError(String eventName) {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}
