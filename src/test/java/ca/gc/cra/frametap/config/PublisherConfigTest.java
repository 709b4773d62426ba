package ca.gc.cra.frametap.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PublisherConfigTest {

  @Test
  void defaultsBindLocalPublisher() {
    PublisherConfig config = PublisherConfig.defaults();

    assertTrue(config.bindMode());
    assertEquals(List.of("tcp://*:5555"), config.endpoints());
    assertEquals("frametap", config.sourceId());
    assertTrue(config.jpeg());
    assertEquals(0, config.count());
  }

  @Test
  void fromMapParsesOptions() {
    PublisherConfig config = PublisherConfig.fromMap(Map.of(
        "connect", "tcp://relay:5556",
        "sourceId", "cam-7",
        "width", "64",
        "height", "48",
        "fps", "25",
        "jpeg", "false",
        "logEvery", "10",
        "count", "100",
        "topicSuffix", "true"));

    assertFalse(config.bindMode());
    assertEquals(List.of("tcp://relay:5556"), config.endpoints());
    assertEquals("cam-7", config.sourceId());
    assertEquals(64, config.width());
    assertEquals(48, config.height());
    assertEquals(25, config.fps());
    assertFalse(config.jpeg());
    assertEquals(10, config.logEvery());
    assertEquals(100, config.count());
    assertTrue(config.topicSuffix());
  }

  @Test
  void sourceIdMustNotContainSlash() {
    assertThrows(IllegalArgumentException.class, () -> PublisherConfig.fromMap(Map.of("sourceId", "a/b")));
  }

  @Test
  void dimensionsAndRatesAreBounded() {
    assertThrows(IllegalArgumentException.class, () -> PublisherConfig.fromMap(Map.of("width", "0")));
    assertThrows(IllegalArgumentException.class, () -> PublisherConfig.fromMap(Map.of("height", "5000")));
    assertThrows(IllegalArgumentException.class, () -> PublisherConfig.fromMap(Map.of("fps", "241")));
    assertThrows(IllegalArgumentException.class, () -> PublisherConfig.fromMap(Map.of("count", "-1")));
  }

  @Test
  void kafkaEgressNeedsBootstrap() {
    assertThrows(IllegalArgumentException.class, () -> PublisherConfig.fromMap(Map.of("egress", "KAFKA")));
    PublisherConfig config = PublisherConfig.fromMap(Map.of("egress", "KAFKA", "kafkaBootstrap", "localhost:9092"));
    assertEquals(IngressMode.KAFKA, config.egress());
  }

  @Test
  void publishDefaultsRoundTripThroughFromMap() {
    PublisherConfig config = PublisherConfig.fromMap(DefaultsForMode.asFlatMap("publish"));
    assertEquals(PublisherConfig.defaults().endpoints(), config.endpoints());
    assertEquals(320, config.width());
  }
}
