/**
 * Staging-file naming and atomic publication shared by the image and log writers.
 */
package ca.gc.cra.frametap.infrastructure.persistence.io;
