/**
 * Loops that move frames between transports, sinks and the display.
 *
 * <p>{@link ca.gc.cra.frametap.application.pipeline.SubscriberLoop} runs on the caller thread and owns
 * the source, stats, inhibition gate and annotation window.
 * {@link ca.gc.cra.frametap.application.pipeline.DisplayLoop} runs on {@code frametap-display-0} and only
 * touches the handoff queue and the display port. Both stop on a shared
 * {@link ca.gc.cra.frametap.application.pipeline.CancellationToken}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.frametap.application.pipeline;
