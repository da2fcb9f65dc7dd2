package hookrelay.spi;

import hookrelay.event.DomainEvent;

import java.time.Duration;

/**
 * One consumer's view of a {@link DomainEventSource}.
 *
 * <p>Subscriptions are lossy: a consumer that falls behind misses events, and
 * {@link #takeLagged()} reports how many.
 */
public interface DomainEventSubscription extends AutoCloseable {

  /**
   * Waits up to {@code timeout} for the next event.
   *
   * @param timeout maximum wait
   * @return the next event, or {@code null} if none arrived in time
   * @throws InterruptedException if the waiting thread is interrupted
   */
  DomainEvent receive(Duration timeout) throws InterruptedException;

  /**
   * Returns the number of events dropped since the previous call and resets the count.
   *
   * @return dropped event count, {@code 0} if none
   */
  long takeLagged();

  /**
   * Whether the subscription is closed and has nothing left to deliver.
   *
   * @return {@code true} once no further events will arrive
   */
  boolean isClosed();

  @Override
  void close();
}
