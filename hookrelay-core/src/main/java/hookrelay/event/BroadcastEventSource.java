package hookrelay.event;

import hookrelay.spi.DomainEventSource;
import hookrelay.spi.DomainEventSubscription;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process fan-out of domain events to any number of subscribers.
 *
 * <p>Each subscription owns a bounded buffer. {@link #publish} never blocks: when a
 * subscriber's buffer is full its oldest event is discarded and counted, and the
 * subscriber learns how many it missed from {@link DomainEventSubscription#takeLagged()}.
 */
public final class BroadcastEventSource implements DomainEventSource, AutoCloseable {
  public static final int DEFAULT_BUFFER_SIZE = 1024;

  private final int bufferSize;
  private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
  private volatile boolean closed;

  public BroadcastEventSource() {
    this(DEFAULT_BUFFER_SIZE);
  }

  public BroadcastEventSource(int bufferSize) {
    if (bufferSize <= 0) {
      throw new IllegalArgumentException("bufferSize must be > 0");
    }
    this.bufferSize = bufferSize;
  }

  /**
   * Delivers an event to every open subscription.
   *
   * @param event the event
   * @return the number of subscriptions that received it
   */
  public int publish(DomainEvent event) {
    Objects.requireNonNull(event, "event");
    if (closed) {
      return 0;
    }
    int delivered = 0;
    for (Subscription subscription : subscriptions) {
      if (subscription.offer(event)) {
        delivered++;
      }
    }
    return delivered;
  }

  @Override
  public DomainEventSubscription subscribe() {
    Subscription subscription = new Subscription(bufferSize);
    if (closed) {
      subscription.close();
      return subscription;
    }
    subscriptions.add(subscription);
    return subscription;
  }

  public int subscriberCount() {
    return subscriptions.size();
  }

  /** Closes every subscription; receivers drain what is buffered and then see the close. */
  @Override
  public void close() {
    closed = true;
    for (Subscription subscription : subscriptions) {
      subscription.close();
    }
  }

  private final class Subscription implements DomainEventSubscription {
    private final LinkedBlockingDeque<DomainEvent> buffer;
    private final AtomicLong lagged = new AtomicLong();
    private final AtomicBoolean open = new AtomicBoolean(true);

    private Subscription(int capacity) {
      this.buffer = new LinkedBlockingDeque<>(capacity);
    }

    private boolean offer(DomainEvent event) {
      if (!open.get()) {
        return false;
      }
      while (!buffer.offerLast(event)) {
        if (buffer.pollFirst() != null) {
          lagged.incrementAndGet();
        }
      }
      return true;
    }

    @Override
    public DomainEvent receive(Duration timeout) throws InterruptedException {
      return buffer.pollFirst(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public long takeLagged() {
      return lagged.getAndSet(0);
    }

    @Override
    public boolean isClosed() {
      return !open.get() && buffer.isEmpty();
    }

    @Override
    public void close() {
      if (open.compareAndSet(true, false)) {
        subscriptions.remove(this);
      }
    }
  }
}
