/**
 * Root API of the publication dispatch engine: sends a ready publication to each of its
 * channels through an external posting gateway and reconciles the per-channel outcomes into
 * one publication status.
 *
 * <h2>Core Design</h2>
 * <p>{@link publicador.PublicationEngine#publish} first takes an exclusive processing lock
 * through a single conditional UPDATE ({@linkplain publicador.lock.PublicationLock lock}).
 * The {@linkplain publicador.dispatch.PublicationDispatcher dispatcher} then walks the posts
 * in creation order: a shutdown in progress aborts the post, the
 * {@linkplain publicador.channel.ChannelValidator channel validator} rejects unusable
 * channels, and the gateway call runs under a per-post timeout with exponential backoff on
 * retryable errors. Each post's outcome is written before the next post starts. The
 * {@linkplain publicador.dispatch.ResultAggregator aggregator} finally releases the lock with
 * PUBLISHED, PARTIAL or FAILED and notifies the author when not everything succeeded.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>publicador-core</b> - model, SPIs, engine, dispatcher, scheduler (zero external deps)</li>
 *   <li><b>publicador-jdbc</b> - JDBC {@link publicador.spi.PublicationStore}</li>
 *   <li><b>publicador-gateway-http</b> - {@link publicador.gateway.PostingGateway} over HTTP</li>
 *   <li><b>publicador-micrometer</b> - Micrometer {@link publicador.spi.MetricsExporter}</li>
 *   <li><b>publicador-spring-boot-starter</b> - Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var engine = PublicationEngine.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .store(new JdbcPublicationStore())
 *     .gateway(HttpPostingGateway.builder().serviceUrl("https://posting.internal").build())
 *     .postProcessingTimeout(Duration.ofSeconds(60))
 *     .build();
 *
 * PublishResult result = engine.publish(publicationId);
 * }</pre>
 *
 * @see publicador.PublicationEngine
 * @see publicador.scheduler.PublicationScheduler
 */
package publicador;
