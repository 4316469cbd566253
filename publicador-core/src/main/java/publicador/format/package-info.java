/**
 * Payload construction: body rendering, hashtag formatting and media references.
 */
package publicador.format;
