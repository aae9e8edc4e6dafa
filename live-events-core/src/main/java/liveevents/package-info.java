/**
 * Root API for live events: asynchronous, best-effort delivery of structured event
 * records to a streaming backend.
 *
 * <h2>Core Design</h2>
 * <p>Application code calls {@link liveevents.LiveEvents#postEvent} (or
 * {@link liveevents.Client#postEvent} on an explicitly built client). The call merges the
 * process-wide {@linkplain liveevents.ContextStore ambient context} with the call-site
 * context, encodes an {@link liveevents.Event} as JSON
 * ({@code {"attributes": {...}, "body": {...}}}) and pushes it onto the
 * {@linkplain liveevents.worker.AsyncWorker worker}'s bounded queue. A single background
 * thread delivers queued records to a {@link liveevents.spi.StreamBackend} in FIFO order.
 *
 * <p>Producers never block on the network. A full queue drops the new record; a failed
 * delivery is logged and discarded. Nothing is retried or persisted, so records still
 * queued when the process dies are lost. Call {@code LiveEvents.worker().stop()} before
 * exit to flush.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>live-events-core</b>: event model, serializer, context, client, worker (zero external deps)</li>
 *   <li><b>live-events-kinesis</b>: default Amazon Kinesis backend, discovered through
 *       {@link java.util.ServiceLoader}</li>
 *   <li><b>live-events-micrometer</b>: optional Micrometer metrics bridge</li>
 *   <li><b>live-events-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * LiveEvents.settings(() -> Map.of(
 *     "stream_name", "live-events",
 *     "aws_region", "us-east-1"));
 * LiveEvents.maxQueueSize(() -> 5000);
 *
 * LiveEvents.setContext(Map.of("user_id", 123, "root_account_id", 1));
 * LiveEvents.postEvent("course_created", Map.of("course_id", 42), "123");
 *
 * // at shutdown
 * LiveEvents.worker().stop();
 * }</pre>
 *
 * <h2>Custom Backend</h2>
 * <pre>{@code
 * StreamBackend stdout = (stream, data, key) ->
 *     System.out.println(stream + " " + key + " " + new String(data, UTF_8));
 * LiveEvents.streamClient(stdout);
 * }</pre>
 *
 * @see liveevents.LiveEvents
 * @see liveevents.Client
 * @see liveevents.Event
 * @see liveevents.spi.StreamBackend
 * @see liveevents.worker.AsyncWorker
 */
package liveevents;
