/**
 * Display adapters driven by the render thread.
 */
package ca.gc.cra.frametap.infrastructure.display;
