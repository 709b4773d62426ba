/**
 * Ports implemented by infrastructure adapters and the checked exceptions that cross them.
 */
package ca.gc.cra.frametap.application.port;
