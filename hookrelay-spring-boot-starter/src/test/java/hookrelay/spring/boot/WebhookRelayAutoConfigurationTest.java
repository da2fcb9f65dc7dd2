package hookrelay.spring.boot;

import hookrelay.WebhookRelay;
import hookrelay.delivery.TransportResponse;
import hookrelay.delivery.WebhookTransport;
import hookrelay.event.BroadcastEventSource;
import hookrelay.event.DomainEvent;
import hookrelay.history.DeliveryHistory;
import hookrelay.jdbc.DataSourceConnectionProvider;
import hookrelay.jdbc.store.AbstractJdbcWebhookStore;
import hookrelay.jdbc.store.H2WebhookStore;
import hookrelay.model.DeliveryStatus;
import hookrelay.model.WebhookDelivery;
import hookrelay.spi.ConnectionProvider;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WebhookRelayAutoConfigurationTest {

  private static ApplicationContextRunner runner(String schema) {
    return new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            DataSourceAutoConfiguration.class,
            SqlInitializationAutoConfiguration.class,
            WebhookRelayAutoConfiguration.class))
        .withPropertyValues(
            "spring.datasource.url=jdbc:h2:mem:relay_auto_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
            "spring.datasource.driver-class-name=org.h2.Driver",
            "spring.sql.init.schema-locations=classpath:" + schema,
            "hookrelay.retry.interval=100ms");
  }

  private final ApplicationContextRunner runner = runner("schema.sql");

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("webhookStore"));
      assertTrue(ctx.containsBean("connectionProvider"));
      assertTrue(ctx.containsBean("domainEventSource"));
      assertTrue(ctx.containsBean("domainEventBridge"));
      assertTrue(ctx.containsBean("webhookRelay"));
      assertTrue(ctx.containsBean("deliveryHistory"));

      assertInstanceOf(H2WebhookStore.class, ctx.getBean(AbstractJdbcWebhookStore.class));
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertSame(ctx.getBean(WebhookRelay.class).history(), ctx.getBean(DeliveryHistory.class));
    });
  }

  @Test
  void notLoadedWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(WebhookRelayAutoConfiguration.class))
        .run(ctx -> {
          assertFalse(ctx.containsBean("webhookRelay"));
          assertFalse(ctx.containsBean("webhookStore"));
        });
  }

  @Test
  void disabledWhenPropertyFalse() {
    runner.withPropertyValues("hookrelay.enabled=false").run(ctx -> {
      assertFalse(ctx.containsBean("webhookRelay"));
      assertFalse(ctx.containsBean("domainEventBridge"));
    });
  }

  @Test
  void respectsConditionalOnMissingBean() {
    runner.withUserConfiguration(CustomStoreConfig.class).run(ctx -> {
      AbstractJdbcWebhookStore store = ctx.getBean(AbstractJdbcWebhookStore.class);
      assertEquals("custom_hooks", store.webhooksTable());
      assertFalse(ctx.containsBean("webhookStore"));
    });
  }

  @Test
  void appliesCustomTableNames() {
    runner("schema-custom.sql")
        .withPropertyValues(
            "hookrelay.webhooks-table=hooks",
            "hookrelay.deliveries-table=hook_attempts",
            "hookrelay.subscriptions-table=hook_events")
        .run(ctx -> {
          AbstractJdbcWebhookStore store = ctx.getBean(AbstractJdbcWebhookStore.class);
          assertEquals("hooks", store.webhooksTable());
          assertEquals("hook_attempts", store.deliveriesTable());
          assertEquals("hook_events", store.subscriptionsTable());
        });
  }

  @Test
  void rejectsInvalidTableName() {
    runner.withPropertyValues("hookrelay.webhooks-table=bad name").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(IllegalArgumentException.class, findRootCause(ctx.getStartupFailure()));
    });
  }

  @Test
  void publishedApplicationEventsAreDelivered() {
    runner.withUserConfiguration(RecordingTransportConfig.class).run(ctx -> {
      JdbcTemplate jdbc = new JdbcTemplate(ctx.getBean(DataSource.class));
      jdbc.update("INSERT INTO webhooks (uuid, name, url, secret) VALUES (?, ?, ?, ?)",
          UUID.randomUUID().toString(), "ops", "https://ops.test/hook", "whsec_ops");
      Long webhookId = jdbc.queryForObject("SELECT id FROM webhooks WHERE name = 'ops'", Long.class);
      jdbc.update("INSERT INTO webhook_subscriptions (webhook_id, event_type) VALUES (?, ?)",
          webhookId, "ticket.created");

      BroadcastEventSource source = ctx.getBean(BroadcastEventSource.class);
      long deadline = System.currentTimeMillis() + 2_000;
      while (source.subscriberCount() == 0 && System.currentTimeMillis() < deadline) {
        Thread.sleep(10);
      }

      ctx.publishEvent(DomainEvent.of(DomainEvent.Kind.TICKET_CREATED, Map.of("ticket_id", 7)));

      RecordingTransport transport = ctx.getBean(RecordingTransport.class);
      assertTrue(transport.sent.await(5, TimeUnit.SECONDS));
      assertEquals("https://ops.test/hook", transport.urls.get(0));
      assertTrue(transport.bodies.get(0).contains("\"ticket.created\""));

      DeliveryHistory history = ctx.getBean(DeliveryHistory.class);
      List<WebhookDelivery> rows = List.of();
      deadline = System.currentTimeMillis() + 5_000;
      while (System.currentTimeMillis() < deadline) {
        rows = history.forWebhook(webhookId, 10, 0);
        if (!rows.isEmpty() && rows.get(0).status() == DeliveryStatus.DELIVERED) {
          break;
        }
        Thread.sleep(20);
      }
      assertEquals(1, rows.size());
      assertEquals(DeliveryStatus.DELIVERED, rows.get(0).status());
      assertEquals(202, rows.get(0).responseStatus());
    });
  }

  private static Throwable findRootCause(Throwable t) {
    Throwable root = t;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    return root;
  }

  @Configuration
  static class CustomStoreConfig {
    @Bean
    AbstractJdbcWebhookStore customStore() {
      return new H2WebhookStore().withTables("custom_hooks", "custom_deliveries", "custom_subscriptions");
    }
  }

  @Configuration
  static class RecordingTransportConfig {
    @Bean
    RecordingTransport recordingTransport() {
      return new RecordingTransport();
    }
  }

  static final class RecordingTransport implements WebhookTransport {
    final CountDownLatch sent = new CountDownLatch(1);
    final List<String> urls = new CopyOnWriteArrayList<>();
    final List<String> bodies = new CopyOnWriteArrayList<>();

    @Override
    public TransportResponse send(String url, Map<String, String> headers, byte[] body,
        Duration timeout) {
      urls.add(url);
      bodies.add(new String(body, StandardCharsets.UTF_8));
      sent.countDown();
      return new TransportResponse(202, "accepted", Map.of());
    }
  }
}
