package publicador.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import publicador.micrometer.MicrometerMetricsExporter;
import publicador.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath and
 * {@code publicador.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link PublicadorAutoConfiguration} so the exporter is available to the
 * engine.
 */
@AutoConfiguration(before = PublicadorAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "publicador.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(PublicadorProperties.class)
public class PublicadorMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, PublicadorProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
