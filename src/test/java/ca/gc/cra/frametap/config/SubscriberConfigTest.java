package ca.gc.cra.frametap.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.frametap.domain.frame.ImageFormat;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SubscriberConfigTest {

  @Test
  void defaultsConnectToLocalPublisherAndDisplay() {
    SubscriberConfig config = SubscriberConfig.defaults();

    assertEquals(IngressMode.ZMQ, config.ingress());
    assertEquals(List.of("tcp://localhost:5555"), config.endpoints());
    assertFalse(config.bindMode());
    assertTrue(config.display());
    assertFalse(config.persistenceEnabled());
    assertEquals("source_id", config.fileIdKey());
    assertEquals(60.0, config.logIntervalSeconds());
  }

  @Test
  void fromMapParsesRecordingOptions() {
    Map<String, String> kv = new HashMap<>();
    kv.put("connect", "tcp://cam-a:5555, tcp://cam-b:5555");
    kv.put("imageDir", "/tmp/frames");
    kv.put("logDir", "/tmp/logs");
    kv.put("inhibit", "2.5");
    kv.put("logInterval", "30");
    kv.put("flatten", "yes");
    kv.put("csvFields", "source_id,frame_time,event");
    kv.put("imageEncoding", "png");
    kv.put("timezone", "UTC");
    kv.put("display", "false");
    kv.put("fileIdKey", "camera.serial");

    SubscriberConfig config = SubscriberConfig.fromMap(kv);

    assertEquals(List.of("tcp://cam-a:5555", "tcp://cam-b:5555"), config.connect());
    assertEquals(Optional.of(Path.of("/tmp/frames").toAbsolutePath().normalize()), config.imageDir());
    assertTrue(config.persistenceEnabled());
    assertEquals(2.5, config.inhibitSeconds());
    assertEquals(30.0, config.logIntervalSeconds());
    assertTrue(config.flatten());
    assertEquals(List.of("source_id", "frame_time", "event"), config.csvFields());
    assertEquals(ImageFormat.PNG, config.imageEncoding());
    assertEquals(ZoneId.of("UTC"), config.timezone());
    assertFalse(config.display());
    assertEquals("camera.serial", config.fileIdKey());
  }

  @Test
  void bindReplacesDefaultConnect() {
    SubscriberConfig config = SubscriberConfig.fromMap(Map.of("bind", "tcp://*:6000"));

    assertTrue(config.bindMode());
    assertEquals(List.of("tcp://*:6000"), config.endpoints());
    assertTrue(config.connect().isEmpty());
  }

  @Test
  void connectAndBindTogetherAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> SubscriberConfig.fromMap(
        Map.of("connect", "tcp://localhost:5555", "bind", "tcp://*:5555")));
  }

  @Test
  void kafkaIngressRequiresValidBootstrap() {
    assertThrows(IllegalArgumentException.class, () -> SubscriberConfig.fromMap(Map.of("ingress", "kafka")));
    assertThrows(IllegalArgumentException.class, () -> SubscriberConfig.fromMap(
        Map.of("ingress", "kafka", "kafkaBootstrap", "localhost")));

    SubscriberConfig config = SubscriberConfig.fromMap(
        Map.of("ingress", "KAFKA", "kafkaBootstrap", "broker-1:9092,broker-2:9092", "kafkaTopic", "lab.frames"));
    assertEquals(IngressMode.KAFKA, config.ingress());
    assertEquals("lab.frames", config.kafkaTopic());
  }

  @Test
  void rangesAreEnforced() {
    assertThrows(IllegalArgumentException.class, () -> SubscriberConfig.fromMap(Map.of("logInterval", "0.5")));
    assertThrows(IllegalArgumentException.class, () -> SubscriberConfig.fromMap(Map.of("inhibit", "-1")));
    assertThrows(IllegalArgumentException.class, () -> SubscriberConfig.fromMap(Map.of("jpegQuality", "0")));
    assertThrows(IllegalArgumentException.class, () -> SubscriberConfig.fromMap(Map.of("queueCapacity", "4096")));
    assertThrows(IllegalArgumentException.class, () -> SubscriberConfig.fromMap(Map.of("displayFps", "fast")));
    assertThrows(IllegalArgumentException.class, () -> SubscriberConfig.fromMap(Map.of("timezone", "Mars/Base")));
    assertThrows(IllegalArgumentException.class, () -> SubscriberConfig.fromMap(Map.of("imageEncoding", "gif")));
    assertThrows(IllegalArgumentException.class, () -> SubscriberConfig.fromMap(Map.of("ingress", "udp")));
  }

  @Test
  void invalidEndpointIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> SubscriberConfig.fromMap(Map.of("connect", "tcp://*:5555")));
  }

  @Test
  void viewDefaultsRoundTripThroughFromMap() {
    SubscriberConfig config = SubscriberConfig.fromMap(DefaultsForMode.asFlatMap("view"));
    assertEquals(SubscriberConfig.defaults().endpoints(), config.endpoints());
    assertTrue(config.display());
    assertEquals(5.0, config.statsIntervalSeconds());
  }
}
