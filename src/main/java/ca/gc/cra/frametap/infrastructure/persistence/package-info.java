/**
 * File-system persistence: staged writes with atomic publication.
 */
package ca.gc.cra.frametap.infrastructure.persistence;
