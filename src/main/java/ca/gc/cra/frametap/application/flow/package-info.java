/**
 * Small stateful helpers owned by the subscriber loop: stats, inhibition and the display handoff.
 *
 * <p>Everything here except {@link ca.gc.cra.frametap.application.flow.HandoffQueue} is confined to
 * the network thread.</p>
 */
package ca.gc.cra.frametap.application.flow;
