/**
 * Image persistence: encode, stage, and atomically publish frames to the image directory.
 */
package ca.gc.cra.frametap.infrastructure.persistence.image;
