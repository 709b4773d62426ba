package ca.gc.cra.frametap.application.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal shared by the subscriber and display loops. Each loop checks it once per
 * iteration.
 *
 * @since 0.1.0
 */
public final class CancellationToken {
  private final AtomicBoolean cancelled = new AtomicBoolean();

  /** Requests that every loop observing this token stop after its current iteration. */
  public void cancel() {
    cancelled.set(true);
  }

  /**
   * Returns whether {@link #cancel()} has been called.
   *
   * @return {@code true} once cancelled
   */
  public boolean isCancelled() {
    return cancelled.get();
  }
}
