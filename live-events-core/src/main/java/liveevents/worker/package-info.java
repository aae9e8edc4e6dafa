/**
 * Asynchronous delivery pipeline.
 *
 * <p>{@link liveevents.worker.AsyncWorker} owns a bounded FIFO of
 * {@link liveevents.worker.DeliveryJob}s and a single daemon thread that delivers them
 * one at a time. Full-queue pushes are dropped, failed deliveries are logged and
 * discarded, and {@code stop()} drains the queue before halting.
 *
 * @see liveevents.worker.AsyncWorker
 * @see liveevents.worker.DeliveryJob
 */
package liveevents.worker;
