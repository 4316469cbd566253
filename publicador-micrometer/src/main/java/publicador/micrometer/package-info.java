/**
 * Micrometer bridge for dispatch metrics.
 *
 * @see publicador.micrometer.MicrometerMetricsExporter
 */
package publicador.micrometer;
