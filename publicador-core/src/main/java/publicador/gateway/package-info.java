/**
 * Contract and payload types for the external posting service.
 *
 * @see publicador.gateway.PostingGateway
 */
package publicador.gateway;
