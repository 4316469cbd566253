/**
 * {@link publicador.gateway.PostingGateway} over HTTP: {@code java.net.http} transport and
 * Jackson JSON bodies.
 */
package publicador.gateway.http;
