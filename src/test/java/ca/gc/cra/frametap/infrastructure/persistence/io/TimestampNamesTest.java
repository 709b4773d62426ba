package ca.gc.cra.frametap.infrastructure.persistence.io;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.frametap.domain.frame.ImageFormat;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class TimestampNamesTest {

  private final TimestampNames utc = new TimestampNames(ZoneOffset.UTC);

  @Test
  void formatsWithMillisecondPrecisionAndOffset() {
    assertEquals("1970-01-01_00:00:01.234+0000", utc.format(1.2349));
    assertEquals("2023-11-14_22:13:20.000+0000", utc.format(1_700_000_000d));
  }

  @Test
  void zoneIsReflectedInOffset() {
    TimestampNames toronto = new TimestampNames(ZoneId.of("America/Toronto"));
    assertEquals("2023-11-14_17:13:20.000-0500", toronto.format(1_700_000_000d));
  }

  @Test
  void imageNameJoinsTimestampIdAndExtension() {
    assertEquals("1970-01-01_00:00:10.500+0000_cam-1.jpg", utc.imageName(10.5, "cam-1", ImageFormat.JPEG));
    assertEquals("1970-01-01_00:00:10.500+0000_cam-1.png", utc.imageName(10.5, "cam-1", ImageFormat.PNG));
  }

  @Test
  void sanitizeStripsWhitespaceAndSeparators() {
    assertEquals("frontdoor", TimestampNames.sanitize(" front/do\\or\t"));
    assertEquals("", TimestampNames.sanitize(null));
    assertEquals("", TimestampNames.sanitize(" / "));
  }

  @Test
  void sanitizeStripsControlCharacters() {
    assertEquals("cama", TimestampNames.sanitize("cam\u0000a\u0007"));
    assertEquals("", TimestampNames.sanitize("\u0000"));
  }
}
