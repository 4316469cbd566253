/**
 * Internal helpers: thread factory, flat JSON codec, connection handling.
 */
package publicador.util;
