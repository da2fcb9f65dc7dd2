package hookrelay.delivery;

import hookrelay.spi.MetricsExporter;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded FIFO between task producers (event listener, retry scheduler, test
 * triggers) and the single {@link DeliveryWorker}.
 *
 * <p>{@link #submit} blocks while the queue is full. After {@link #close()} new
 * submissions fail with {@link QueueClosedException}, blocked producers are released,
 * and the worker drains what is left.
 */
public final class DeliveryQueue {
  public static final int DEFAULT_CAPACITY = 1000;

  private static final long OFFER_SLICE_MS = 100;

  private final BlockingQueue<DeliveryTask> tasks;
  private final MetricsExporter metrics;
  private volatile boolean closed;

  public DeliveryQueue() {
    this(DEFAULT_CAPACITY, MetricsExporter.NOOP);
  }

  public DeliveryQueue(int capacity, MetricsExporter metrics) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.tasks = new ArrayBlockingQueue<>(capacity);
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Adds a task, waiting for space if the queue is full.
   *
   * @param task the task
   * @throws QueueClosedException if the queue is closed before the task is accepted
   * @throws InterruptedException if interrupted while waiting for space
   */
  public void submit(DeliveryTask task) throws InterruptedException {
    Objects.requireNonNull(task, "task");
    while (true) {
      if (closed) {
        metrics.incrementEnqueueRejected();
        throw new QueueClosedException();
      }
      if (tasks.offer(task, OFFER_SLICE_MS, TimeUnit.MILLISECONDS)) {
        metrics.incrementEnqueued();
        metrics.recordQueueDepth(tasks.size());
        return;
      }
    }
  }

  /**
   * Takes the next task, waiting up to {@code timeout}.
   *
   * @param timeout maximum wait
   * @return the next task, or {@code null} on timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public DeliveryTask poll(Duration timeout) throws InterruptedException {
    return tasks.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /** Stops accepting tasks. Already queued tasks stay available to {@link #poll}. */
  public void close() {
    closed = true;
  }

  public boolean isClosed() {
    return closed;
  }

  /** Whether the queue is closed and fully drained. */
  public boolean isDrained() {
    return closed && tasks.isEmpty();
  }

  public int size() {
    return tasks.size();
  }

  public int remainingCapacity() {
    return tasks.remainingCapacity();
  }
}
