/**
 * JDBC implementation of {@link publicador.spi.PublicationStore}.
 *
 * <p>{@link publicador.jdbc.JdbcPublicationStore} keeps every status transition in a single
 * statement; {@link publicador.jdbc.DataSourceConnectionProvider} adapts a
 * {@link javax.sql.DataSource}.
 *
 * @see publicador.jdbc.JdbcPublicationStore
 */
package publicador.jdbc;
