package ca.gc.cra.frametap.application.pipeline;

import ca.gc.cra.frametap.application.flow.DisplayFrame;
import ca.gc.cra.frametap.application.flow.HandoffQueue;
import ca.gc.cra.frametap.application.port.DisplayPort;
import ca.gc.cra.frametap.domain.frame.ImagePayload;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Render-thread body: drains the handoff queue, keeps only the newest image per source, and hands them to
 * the {@link DisplayPort} at a fixed pace.
 *
 * <p>This is the queue's only consumer; it never touches the socket or the persistence sinks.</p>
 *
 * @since 0.1.0
 */
public final class DisplayLoop implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(DisplayLoop.class);

  private final HandoffQueue<DisplayFrame> queue;
  private final DisplayPort display;
  private final CancellationToken token;
  private final long periodNanos;

  /**
   * Creates a display loop.
   *
   * @param queue handoff queue filled by the subscriber loop
   * @param display render target
   * @param token stop signal
   * @param fps refresh rate, 1..240
   */
  public DisplayLoop(HandoffQueue<DisplayFrame> queue, DisplayPort display, CancellationToken token, int fps) {
    if (fps < 1 || fps > 240) {
      throw new IllegalArgumentException("displayFps must be between 1 and 240 (was " + fps + ")");
    }
    this.queue = Objects.requireNonNull(queue, "queue");
    this.display = Objects.requireNonNull(display, "display");
    this.token = Objects.requireNonNull(token, "token");
    this.periodNanos = TimeUnit.SECONDS.toNanos(1) / fps;
  }

  @Override
  public void run() {
    long ticks = 0;
    try {
      while (!token.isCancelled()) {
        long tickStart = System.nanoTime();
        renderOnce();
        ticks++;
        long remaining = periodNanos - (System.nanoTime() - tickStart);
        if (remaining > 0) {
          TimeUnit.NANOSECONDS.sleep(remaining);
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.debug("Display loop interrupted");
    } finally {
      try {
        display.close();
      } catch (RuntimeException ex) {
        log.error("Failed to close display", ex);
      }
      log.info("Display loop stopped after {} ticks", ticks);
    }
  }

  /**
   * Performs one render tick.
   *
   * @return number of sources shown this tick
   */
  int renderOnce() {
    List<DisplayFrame> drained = queue.drainAll();
    Map<String, ImagePayload> latest = new LinkedHashMap<>();
    for (DisplayFrame frame : drained) {
      latest.put(frame.sourceId(), frame.image());
    }
    if (drained.size() > latest.size()) {
      log.debug("Coalesced {} queued frames into {}", drained.size(), latest.size());
    }
    latest.forEach(display::show);
    display.refresh();
    return latest.size();
  }
}
