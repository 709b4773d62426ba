package ca.gc.cra.frametap.infrastructure.display;

import ca.gc.cra.frametap.application.port.ClockPort;
import ca.gc.cra.frametap.application.port.DisplayPort;
import ca.gc.cra.frametap.domain.frame.ImagePayload;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Headless {@link DisplayPort} that summarizes what would be on screen.
 * <p><strong>Why:</strong> The tool runs on servers without a windowing system; operators still
 * want to see which sources are live and at what resolution.</p>
 * <p><strong>Thread-safety:</strong> Confined to the render thread.</p>
 * <p><strong>Observability:</strong> Logs one INFO line per source every summary interval and a
 * DEBUG line whenever a source's geometry changes.</p>
 *
 * @since 0.1.0
 */
public final class LoggingDisplayAdapter implements DisplayPort {
  private static final Logger log = LoggerFactory.getLogger(LoggingDisplayAdapter.class);

  private final ClockPort clock;
  private final long summaryIntervalMillis;
  private final Map<String, SourceView> views = new TreeMap<>();
  private long lastSummaryMillis;

  /**
   * Creates the adapter.
   *
   * @param clock time source used to pace summaries
   * @param summaryIntervalMillis minimum spacing between summaries; must be positive
   */
  public LoggingDisplayAdapter(ClockPort clock, long summaryIntervalMillis) {
    this.clock = Objects.requireNonNull(clock, "clock");
    if (summaryIntervalMillis <= 0) {
      throw new IllegalArgumentException("summaryIntervalMillis must be positive");
    }
    this.summaryIntervalMillis = summaryIntervalMillis;
    this.lastSummaryMillis = clock.nowMillis();
  }

  @Override
  public void show(String sourceId, ImagePayload image) {
    String geometry = image.width() + "x" + image.height() + "x" + image.channels();
    SourceView view = views.computeIfAbsent(sourceId, id -> new SourceView());
    if (!geometry.equals(view.geometry)) {
      log.debug("Display source {} now {}", sourceId, geometry);
      view.geometry = geometry;
    }
    view.shown++;
  }

  @Override
  public void refresh() {
    long now = clock.nowMillis();
    if (now - lastSummaryMillis < summaryIntervalMillis) {
      return;
    }
    for (Map.Entry<String, SourceView> entry : views.entrySet()) {
      SourceView view = entry.getValue();
      log.info("Display {} {} ({} frames)", entry.getKey(), view.geometry, view.shown);
      view.shown = 0;
    }
    lastSummaryMillis = now;
  }

  @Override
  public void close() {
    log.info("Display closed after {} sources", views.size());
    views.clear();
  }

  /** Returns the number of frames shown for a source since the last summary. */
  long shownSinceSummary(String sourceId) {
    SourceView view = views.get(sourceId);
    return view == null ? 0 : view.shown;
  }

  private static final class SourceView {
    private String geometry = "";
    private long shown;
  }
}
