/**
 * Adapters implementing the application ports over JeroMQ, ImageIO, Jackson, the file system and
 * OpenTelemetry.
 */
package ca.gc.cra.frametap.infrastructure;
