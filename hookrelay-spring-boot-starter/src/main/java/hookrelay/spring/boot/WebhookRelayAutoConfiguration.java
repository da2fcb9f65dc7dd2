package hookrelay.spring.boot;

import hookrelay.WebhookRelay;
import hookrelay.delivery.ExponentialBackoffRetryPolicy;
import hookrelay.delivery.WebhookTransport;
import hookrelay.event.BroadcastEventSource;
import hookrelay.history.DeliveryHistory;
import hookrelay.jdbc.DataSourceConnectionProvider;
import hookrelay.jdbc.store.AbstractJdbcWebhookStore;
import hookrelay.jdbc.store.JdbcWebhookStores;
import hookrelay.spi.ConnectionProvider;
import hookrelay.spi.MetricsExporter;
import hookrelay.spi.WebhookStore;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.sql.init.dependency.DependsOnDatabaseInitialization;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the webhook relay.
 *
 * <p>Wires a started {@link WebhookRelay} from a {@link DataSource} and
 * {@link WebhookRelayProperties}. The store is detected from the JDBC URL, and
 * {@link hookrelay.event.DomainEvent}s published as Spring application events reach
 * the relay through a {@link BroadcastEventSource}. Every bean backs off when the
 * application defines its own.
 *
 * @see WebhookRelayProperties
 * @see WebhookRelayMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, SqlInitializationAutoConfiguration.class})
@ConditionalOnClass(WebhookRelay.class)
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "hookrelay", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(WebhookRelayProperties.class)
public class WebhookRelayAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(WebhookStore.class)
  public AbstractJdbcWebhookStore webhookStore(DataSource dataSource, WebhookRelayProperties props) {
    return JdbcWebhookStores.detect(dataSource)
        .withTables(props.getWebhooksTable(), props.getDeliveriesTable(), props.getSubscriptionsTable());
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public BroadcastEventSource domainEventSource(WebhookRelayProperties props) {
    return new BroadcastEventSource(props.getEventSource().getBufferSize());
  }

  @Bean
  @ConditionalOnMissingBean
  public DomainEventBridge domainEventBridge(BroadcastEventSource domainEventSource) {
    return new DomainEventBridge(domainEventSource);
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @DependsOnDatabaseInitialization
  public WebhookRelay webhookRelay(WebhookRelayProperties props,
      ConnectionProvider connectionProvider,
      WebhookStore webhookStore,
      BroadcastEventSource domainEventSource,
      ObjectProvider<WebhookTransport> transportProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    WebhookRelayProperties.Delivery delivery = props.getDelivery();
    WebhookRelayProperties.Retry retry = props.getRetry();
    WebhookRelay.Builder builder = WebhookRelay.builder()
        .connectionProvider(connectionProvider)
        .store(webhookStore)
        .eventSource(domainEventSource)
        .productName(props.getProductName())
        .queueCapacity(props.getQueue().getCapacity())
        .maxAttempts(delivery.getMaxAttempts())
        .autoDisableThreshold(delivery.getAutoDisableThreshold())
        .requestTimeout(delivery.getRequestTimeout())
        .responseBodyLimit(delivery.getResponseBodyLimit())
        .retryPolicy(new ExponentialBackoffRetryPolicy(
            retry.getInitialDelay().toMillis(), retry.getMaxDelay().toMillis()))
        .retryEnabled(retry.isEnabled())
        .retryInterval(retry.getInterval())
        .retryBatchSize(retry.getBatchSize())
        .drainTimeout(props.getDrainTimeout());

    WebhookTransport transport = transportProvider.getIfAvailable();
    if (transport != null) {
      builder.transport(transport);
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public DeliveryHistory deliveryHistory(WebhookRelay webhookRelay) {
    return webhookRelay.history();
  }
}
