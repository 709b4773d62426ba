/**
 * Neutral JSON wire codec for the multipart frame protocol.
 */
package ca.gc.cra.frametap.infrastructure.codec;
