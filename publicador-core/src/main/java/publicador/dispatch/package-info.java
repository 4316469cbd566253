/**
 * Per-post fan-out with timeout and retry, and reduction of outcomes to a publication status.
 *
 * @see publicador.dispatch.PublicationDispatcher
 * @see publicador.dispatch.ResultAggregator
 */
package publicador.dispatch;
