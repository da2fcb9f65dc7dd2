package hookrelay.delivery;

/**
 * Thrown by {@link DeliveryQueue#submit} once the queue has been closed.
 */
public class QueueClosedException extends RuntimeException {

  public QueueClosedException() {
    super("Delivery queue is closed");
  }
}
