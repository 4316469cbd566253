/**
 * Publication-level mutual exclusion through an atomic conditional status update.
 *
 * @see publicador.lock.PublicationLock
 */
package publicador.lock;
