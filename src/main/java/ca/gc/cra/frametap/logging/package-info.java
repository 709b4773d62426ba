/**
 * Runtime log-level control and log-safe formatting helpers.
 */
package ca.gc.cra.frametap.logging;
