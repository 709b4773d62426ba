/**
 * Transport-neutral model of frames and their annotations.
 */
package ca.gc.cra.frametap.domain;
