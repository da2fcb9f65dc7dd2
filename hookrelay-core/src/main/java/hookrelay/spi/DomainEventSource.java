package hookrelay.spi;

/**
 * Publisher of domain events that the relay listens to.
 *
 * @see hookrelay.event.BroadcastEventSource
 */
public interface DomainEventSource {

  /**
   * Opens a new subscription that receives every event published after this call.
   *
   * @return the subscription; the caller must close it
   */
  DomainEventSubscription subscribe();
}
