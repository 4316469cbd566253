/**
 * Service provider interfaces: persistence, connections, notifications and metrics.
 *
 * @see publicador.spi.PublicationStore
 * @see publicador.spi.ConnectionProvider
 * @see publicador.spi.Notifier
 * @see publicador.spi.MetricsExporter
 */
package publicador.spi;
