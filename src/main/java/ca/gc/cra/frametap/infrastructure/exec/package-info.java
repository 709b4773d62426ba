/**
 * Thread and executor construction for background loops.
 */
package ca.gc.cra.frametap.infrastructure.exec;
