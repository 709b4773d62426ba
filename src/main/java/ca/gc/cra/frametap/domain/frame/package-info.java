/**
 * Envelopes, payloads and the wire topic vocabulary.
 */
package ca.gc.cra.frametap.domain.frame;
