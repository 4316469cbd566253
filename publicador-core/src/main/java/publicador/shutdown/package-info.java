/**
 * Cooperative cancellation: a single flag consulted between posts.
 */
package publicador.shutdown;
