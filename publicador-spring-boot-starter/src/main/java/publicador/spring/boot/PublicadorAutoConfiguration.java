package publicador.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import publicador.PublicationEngine;
import publicador.dispatch.ExponentialBackoffRetryPolicy;
import publicador.format.BodyFormatter;
import publicador.gateway.PostingGateway;
import publicador.gateway.http.HttpPostingGateway;
import publicador.jdbc.DataSourceConnectionProvider;
import publicador.jdbc.JdbcPublicationStore;
import publicador.scheduler.PublicationScheduler;
import publicador.shutdown.ShutdownCoordinator;
import publicador.spi.ConnectionProvider;
import publicador.spi.MetricsExporter;
import publicador.spi.Notifier;
import publicador.spi.PublicationStore;
import publicador.util.JsonCodec;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * Auto-configuration for the publication dispatch engine.
 *
 * <p>Wires a {@link PublicationEngine} over the application's {@link DataSource}, the JDBC
 * store and the HTTP posting gateway, plus the {@link PublicationScheduler} unless
 * {@code publicador.scheduler.enabled=false}. Every bean backs off when the application
 * defines its own.
 *
 * @see PublicadorProperties
 * @see PublicadorMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(PublicationEngine.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(PublicadorProperties.class)
public class PublicadorAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public ShutdownCoordinator publicadorShutdownCoordinator() {
    return new ShutdownCoordinator();
  }

  @Bean
  @ConditionalOnMissingBean
  public PublicadorShutdownListener publicadorShutdownListener(ShutdownCoordinator shutdown) {
    return new PublicadorShutdownListener(shutdown);
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider publicadorConnectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(PublicationStore.class)
  public JdbcPublicationStore publicationStore(PublicadorProperties props) {
    return new JdbcPublicationStore(props.getTablePrefix(), JsonCodec.getDefault());
  }

  @Bean
  @ConditionalOnMissingBean(PostingGateway.class)
  public HttpPostingGateway postingGateway(PublicadorProperties props,
      ObjectProvider<ObjectMapper> objectMapperProvider) {
    PublicadorProperties.Gateway gateway = props.getGateway();
    if (gateway.getServiceUrl() == null || gateway.getServiceUrl().isBlank()) {
      throw new IllegalStateException(
          "publicador.gateway.service-url must be set when no PostingGateway bean is defined");
    }
    return HttpPostingGateway.builder()
        .serviceUrl(gateway.getServiceUrl())
        .apiToken(gateway.getApiToken())
        .idempotencyTtl(Duration.ofMinutes(gateway.getIdempotencyTtlMinutes()))
        .objectMapper(objectMapperProvider.getIfAvailable())
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public PublicationEngine publicationEngine(PublicadorProperties props,
      ConnectionProvider connectionProvider,
      PublicationStore publicationStore,
      PostingGateway postingGateway,
      ShutdownCoordinator shutdown,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<Notifier> notifierProvider,
      ObjectProvider<BodyFormatter> bodyFormatterProvider) {
    PublicadorProperties.Gateway gateway = props.getGateway();
    var builder = PublicationEngine.builder()
        .connectionProvider(connectionProvider)
        .store(publicationStore)
        .gateway(postingGateway)
        .shutdownCoordinator(shutdown)
        .retryPolicy(new ExponentialBackoffRetryPolicy(gateway.getRetryDelayMs(), gateway.getMaxRetryDelayMs()))
        .retryAttempts(gateway.getRetryAttempts())
        .requestTimeout(Duration.ofSeconds(gateway.getRequestTimeoutSecs()))
        .postProcessingTimeout(Duration.ofSeconds(props.getDispatch().getPostProcessingTimeoutSeconds()))
        .mediaBaseUrl(props.getMedia().getBaseUrl());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    Notifier notifier = notifierProvider.getIfAvailable();
    if (notifier != null) {
      builder.notifier(notifier);
    }
    BodyFormatter bodyFormatter = bodyFormatterProvider.getIfAvailable();
    if (bodyFormatter != null) {
      builder.bodyFormatter(bodyFormatter);
    }
    return builder.build();
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "publicador.scheduler", name = "enabled", matchIfMissing = true)
  public PublicationScheduler publicationScheduler(PublicadorProperties props,
      ConnectionProvider connectionProvider,
      PublicationStore publicationStore,
      PublicationEngine publicationEngine) {
    PublicadorProperties.Scheduler scheduler = props.getScheduler();
    return PublicationScheduler.builder()
        .connectionProvider(connectionProvider)
        .store(publicationStore)
        .engine(publicationEngine)
        .interval(Duration.ofSeconds(scheduler.getIntervalSeconds()))
        .window(Duration.ofMinutes(scheduler.getWindowMinutes()))
        .batchSize(scheduler.getBatchSize())
        .build();
  }
}
