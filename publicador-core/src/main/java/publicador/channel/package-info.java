/**
 * Channel readiness checks and the standalone channel test.
 */
package publicador.channel;
