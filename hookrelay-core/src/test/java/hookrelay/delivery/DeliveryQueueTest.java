package hookrelay.delivery;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import hookrelay.WebhookPayload;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryQueueTest {

  private static DeliveryTask task(int attempt) {
    return new DeliveryTask(1L, "http://localhost/hook", "whsec_x", Map.of(),
        WebhookPayload.create("ticket.created", JsonNodeFactory.instance.objectNode()), attempt);
  }

  @Test
  void deliversInFifoOrder() throws Exception {
    DeliveryQueue queue = new DeliveryQueue(4, null);
    queue.submit(task(1));
    queue.submit(task(2));

    assertEquals(1, queue.poll(Duration.ofMillis(10)).attempt());
    assertEquals(2, queue.poll(Duration.ofMillis(10)).attempt());
    assertNull(queue.poll(Duration.ofMillis(10)));
  }

  @Test
  void submitBlocksWhileFull() throws Exception {
    DeliveryQueue queue = new DeliveryQueue(1, null);
    queue.submit(task(1));
    CountDownLatch accepted = new CountDownLatch(1);

    Thread producer = new Thread(() -> {
      try {
        queue.submit(task(2));
        accepted.countDown();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    });
    producer.start();

    assertFalse(accepted.await(300, TimeUnit.MILLISECONDS), "submit should wait for space");
    queue.poll(Duration.ofMillis(10));
    assertTrue(accepted.await(2, TimeUnit.SECONDS));
    producer.join(2000);
  }

  @Test
  void closeReleasesBlockedProducers() throws Exception {
    DeliveryQueue queue = new DeliveryQueue(1, null);
    queue.submit(task(1));
    AtomicReference<Throwable> failure = new AtomicReference<>();

    Thread producer = new Thread(() -> {
      try {
        queue.submit(task(2));
      } catch (Throwable t) {
        failure.set(t);
      }
    });
    producer.start();
    Thread.sleep(150);
    queue.close();
    producer.join(2000);

    assertInstanceOf(QueueClosedException.class, failure.get());
    assertFalse(queue.isDrained());
    assertNotNull(queue.poll(Duration.ofMillis(10)));
    assertTrue(queue.isDrained());
  }

  @Test
  void submitAfterCloseFails() {
    DeliveryQueue queue = new DeliveryQueue();
    queue.close();

    assertThrows(QueueClosedException.class, () -> queue.submit(task(1)));
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new DeliveryQueue(0, null));
  }
}
