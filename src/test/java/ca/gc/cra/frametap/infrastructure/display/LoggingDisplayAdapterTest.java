package ca.gc.cra.frametap.infrastructure.display;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import ca.gc.cra.frametap.domain.frame.ImagePayload;
import ca.gc.cra.frametap.domain.frame.PixelEncoding;
import ca.gc.cra.frametap.domain.frame.PixelType;
import ca.gc.cra.frametap.testutil.ManualClock;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingDisplayAdapterTest {
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(LoggingDisplayAdapter.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
  }

  @Test
  void summarizesPerSourceOnceIntervalPasses() {
    ManualClock clock = new ManualClock(0);
    LoggingDisplayAdapter display = new LoggingDisplayAdapter(clock, 1_000);

    display.show("srcA", image(4, 2, 3));
    display.show("srcA", image(4, 2, 3));
    display.show("srcB", image(8, 8, 1));
    display.refresh();
    assertEquals(2, display.shownSinceSummary("srcA"));
    assertTrue(infoMessages().isEmpty());

    clock.advance(1_000);
    display.refresh();

    assertTrue(infoMessages().contains("Display srcA 2x4x3 (2 frames)"));
    assertTrue(infoMessages().contains("Display srcB 8x8x1 (1 frames)"));
    assertEquals(0, display.shownSinceSummary("srcA"));
  }

  @Test
  void closeForgetsSources() {
    LoggingDisplayAdapter display = new LoggingDisplayAdapter(new ManualClock(0), 10);
    display.show("srcA", image(1, 1, 1));
    display.close();
    assertEquals(0, display.shownSinceSummary("srcA"));
  }

  @Test
  void intervalMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new LoggingDisplayAdapter(new ManualClock(0), 0));
  }

  private java.util.List<String> infoMessages() {
    return appender.list.stream()
        .filter(event -> event.getLevel() == Level.INFO)
        .map(ILoggingEvent::getFormattedMessage)
        .toList();
  }

  private static ImagePayload image(int height, int width, int channels) {
    int[] shape = channels == 1 ? new int[] {height, width} : new int[] {height, width, channels};
    return new ImagePayload(PixelEncoding.RAW, PixelType.UINT8, shape, new byte[height * width * channels],
        MappingValue.EMPTY);
  }
}
