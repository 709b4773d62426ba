/**
 * {@code javax.imageio} adapters: JPEG/PNG codec and the publisher's frame producers.
 */
package ca.gc.cra.frametap.infrastructure.image;
