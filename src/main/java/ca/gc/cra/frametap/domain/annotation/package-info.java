/**
 * Annotation values as a closed variant, plus the flatten and reserved-key operations over them.
 */
package ca.gc.cra.frametap.domain.annotation;
