/**
 * Application layer: ports, the per-frame flow primitives and the loops that drive them.
 */
package ca.gc.cra.frametap.application;
