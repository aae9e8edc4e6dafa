package liveevents.worker;

import liveevents.spi.MetricsExporter;
import liveevents.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single background thread that drains a bounded FIFO of {@link DeliveryJob}s and hands
 * each one to its {@link liveevents.spi.StreamBackend}.
 *
 * <p>Producers call {@link #push}, which never blocks: when the queue already holds
 * {@code maxQueueSize} jobs the new job is dropped, logged and counted. The bound is read
 * from an {@link IntSupplier} on every push so it can change at runtime.
 *
 * <p>A failed delivery is logged and discarded; the loop continues with the next job.
 * There is no retry and no dead-letter queue.
 *
 * <p>The thread starts lazily on the first push (or on {@link #start()}). {@link #stop()}
 * delivers everything still queued, blocking the caller until the queue is empty and
 * the thread has exited, bounded by the drain timeout. A later push starts a new thread.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class AsyncWorker {
  private static final Logger logger = Logger.getLogger(AsyncWorker.class.getName());

  public static final int DEFAULT_MAX_QUEUE_SIZE = 1000;
  public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(30);

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;
  private static final long FORCED_SHUTDOWN_WAIT_MS = 5000;

  private final BlockingQueue<DeliveryJob> queue = new LinkedBlockingQueue<>();
  private final Object pushLock = new Object();
  private final AtomicBoolean running = new AtomicBoolean(false);
  // bumped on every start and forced stop; a loop whose generation is stale exits
  private final AtomicInteger generation = new AtomicInteger();
  private final DaemonThreadFactory threadFactory = new DaemonThreadFactory("live-events-worker-");
  private final IntSupplier maxQueueSize;

  private volatile MetricsExporter metrics;
  private volatile Duration drainTimeout;

  // guarded by this
  private ExecutorService executor;
  // guarded by this; a forcibly stopped executor whose thread is still inside a delivery
  private ExecutorService abandoned;

  private AsyncWorker(Builder builder) {
    this.maxQueueSize = builder.maxQueueSize != null
        ? builder.maxQueueSize : () -> DEFAULT_MAX_QUEUE_SIZE;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.drainTimeout = Objects.requireNonNull(builder.drainTimeout, "drainTimeout");
    if (drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must not be negative");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Offers a job to the queue, starting the worker thread if needed.
   *
   * @param job the job to deliver
   * @return {@code true} if queued, {@code false} if dropped because the queue is full
   */
  public boolean push(DeliveryJob job) {
    Objects.requireNonNull(job, "job");
    int limit = Math.max(0, maxQueueSize.getAsInt());
    int depth;
    synchronized (pushLock) {
      if (queue.size() >= limit) {
        depth = -1;
      } else {
        queue.offer(job);
        depth = queue.size();
      }
    }
    MetricsExporter m = metrics;
    if (depth < 0) {
      m.incrementQueueFull(job.eventName());
      logger.log(Level.WARNING, "Live events queue full (max " + limit + "), dropping " + job);
      return false;
    }
    m.incrementEnqueued(job.eventName());
    m.recordQueueDepth(depth);
    if (!running.get()) {
      start();
    }
    return true;
  }

  /**
   * Starts the worker thread if it is not already running.
   *
   * <p>Does nothing while a thread abandoned by a timed-out {@link #stop()} is still
   * inside a delivery, so there is never more than one consumer; queued jobs wait for
   * the next push or {@code start()} after that thread has finished.
   */
  public synchronized void start() {
    if (running.get()) {
      return;
    }
    if (abandoned != null) {
      if (!abandoned.isTerminated()) {
        logger.fine("Previous live events worker still delivering; not starting a new one");
        return;
      }
      abandoned = null;
    }
    int loopGeneration = generation.incrementAndGet();
    executor = Executors.newSingleThreadExecutor(threadFactory);
    running.set(true);
    executor.submit(() -> runLoop(loopGeneration));
  }

  /**
   * Delivers every queued job, then halts the worker thread. Blocks until the queue is
   * drained or the drain timeout elapses; jobs left over after a timeout stay queued and
   * are delivered if the worker is started again. A thread that is still inside a
   * delivery after the timeout finishes that delivery and then exits without taking
   * another job.
   */
  public synchronized void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    ExecutorService current = executor;
    executor = null;
    current.shutdown();
    try {
      if (!current.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. "
            + "Remaining live events: " + queue.size());
        forceShutdown(current);
        long wait = Math.min(FORCED_SHUTDOWN_WAIT_MS, drainTimeout.toMillis());
        if (!current.awaitTermination(wait, TimeUnit.MILLISECONDS)) {
          logger.log(Level.WARNING, "Live events worker did not exit after interrupt; "
              + "a new worker starts once its current delivery returns");
        }
      }
    } catch (InterruptedException e) {
      forceShutdown(current);
      Thread.currentThread().interrupt();
    }
  }

  // guarded by this
  private void forceShutdown(ExecutorService current) {
    generation.incrementAndGet();
    current.shutdownNow();
    abandoned = current;
  }

  public boolean isRunning() {
    return running.get();
  }

  /**
   * Returns the number of jobs waiting for delivery.
   *
   * @return current queue depth
   */
  public int queueSize() {
    return queue.size();
  }

  public MetricsExporter metrics() {
    return metrics;
  }

  /**
   * Replaces the metrics exporter. Intended for setup, before events flow.
   *
   * @param metrics the exporter; {@code null} restores {@link MetricsExporter#NOOP}
   */
  public void metrics(MetricsExporter metrics) {
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
  }

  /**
   * Changes how long {@link #stop()} waits for the queue to drain.
   *
   * @param drainTimeout maximum wait; must not be negative
   */
  public void drainTimeout(Duration drainTimeout) {
    Objects.requireNonNull(drainTimeout, "drainTimeout");
    if (drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must not be negative");
    }
    this.drainTimeout = drainTimeout;
  }

  private void runLoop(int loopGeneration) {
    while (loopGeneration == generation.get() && !Thread.currentThread().isInterrupted()) {
      try {
        DeliveryJob job = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (job == null) {
          // A producer may enqueue just before stop() flips the flag; drain it first
          if (!running.get() && queue.isEmpty()) break;
          continue;
        }
        deliver(job);
        metrics.recordQueueDepth(queue.size());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Live events worker loop error", t);
      }
    }
  }

  private void deliver(DeliveryJob job) {
    MetricsExporter m = metrics;
    long start = System.nanoTime();
    try {
      job.backend().deliver(job.streamName(), job.data(), job.partitionKey());
      m.incrementSendSuccess(job.eventName());
    } catch (RuntimeException e) {
      m.incrementSendError(job.eventName());
      logger.log(Level.SEVERE, "Failed to deliver live event " + job.eventName()
          + " to stream=" + job.streamName() + " partitionKey=" + job.partitionKey(), e);
    } finally {
      m.recordDeliveryLatencyMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    }
  }

  /** Builder for {@link AsyncWorker}. */
  public static final class Builder {
    private IntSupplier maxQueueSize;
    private MetricsExporter metrics;
    private Duration drainTimeout = DEFAULT_DRAIN_TIMEOUT;

    private Builder() {}

    /**
     * Sets the queue bound, evaluated on every push.
     *
     * <p>Optional. Defaults to {@code 1000}.
     *
     * @param maxQueueSize supplier of the maximum number of queued jobs
     * @return this builder
     */
    public Builder maxQueueSize(IntSupplier maxQueueSize) {
      this.maxQueueSize = maxQueueSize;
      return this;
    }

    /**
     * Sets a fixed queue bound.
     *
     * @param maxQueueSize maximum number of queued jobs
     * @return this builder
     */
    public Builder maxQueueSize(int maxQueueSize) {
      this.maxQueueSize = () -> maxQueueSize;
      return this;
    }

    /**
     * Sets the metrics exporter for delivery counters and queue depth.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the maximum time {@link AsyncWorker#stop()} waits for queued jobs.
     *
     * <p>Optional. Defaults to 30 seconds.
     *
     * @param drainTimeout drain timeout
     * @return this builder
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    public AsyncWorker build() {
      return new AsyncWorker(this);
    }
  }
}
