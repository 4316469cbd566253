/**
 * Time-triggered dispatch of SCHEDULED publications.
 */
package publicador.scheduler;
