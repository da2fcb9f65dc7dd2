package hookrelay.spring.boot;

import hookrelay.micrometer.MicrometerMetricsExporter;
import hookrelay.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath,
 * a {@link MeterRegistry} bean exists and {@code hookrelay.metrics.enabled} is true
 * (default).
 *
 * <p>Runs before {@link WebhookRelayAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the relay.
 */
@AutoConfiguration(before = WebhookRelayAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "hookrelay.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(WebhookRelayProperties.class)
public class WebhookRelayMicrometerAutoConfiguration {

  /**
   * The relay closes the exporter on shutdown, removing its meters.
   */
  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, WebhookRelayProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
