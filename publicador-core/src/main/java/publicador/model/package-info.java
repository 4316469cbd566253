/**
 * Read-only records and status enums for publications, their per-channel posts and the
 * channels they are delivered to.
 */
package publicador.model;
