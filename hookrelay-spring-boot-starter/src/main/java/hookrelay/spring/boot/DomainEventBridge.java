package hookrelay.spring.boot;

import hookrelay.event.BroadcastEventSource;
import hookrelay.event.DomainEvent;
import org.springframework.context.event.EventListener;

import java.util.Objects;

/**
 * Forwards {@link DomainEvent}s published through Spring's
 * {@link org.springframework.context.ApplicationEventPublisher} to the relay's
 * {@link BroadcastEventSource}. Publishing never blocks on webhook delivery.
 */
public class DomainEventBridge {
  private final BroadcastEventSource eventSource;

  public DomainEventBridge(BroadcastEventSource eventSource) {
    this.eventSource = Objects.requireNonNull(eventSource, "eventSource");
  }

  @EventListener
  public void onDomainEvent(DomainEvent event) {
    eventSource.publish(event);
  }
}
