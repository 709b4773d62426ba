package ca.gc.cra.frametap.adapter.kafka;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.frametap.application.port.TransportException;
import ca.gc.cra.frametap.domain.frame.MultipartMessage;
import ca.gc.cra.frametap.testutil.RecordingMetricsPort;
import java.nio.charset.StandardCharsets;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

class KafkaFramePublisherTest {

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void publishesFramedMessageKeyedBySource() throws TransportException {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());
    KafkaFramePublisher publisher = new KafkaFramePublisher(producer, "frametap.frames", metrics);
    MultipartMessage message = MultipartMessage.of(
        "LogFrame".getBytes(StandardCharsets.UTF_8), "cam-1".getBytes(StandardCharsets.UTF_8),
        "2.0".getBytes(StandardCharsets.UTF_8), "{}".getBytes(StandardCharsets.UTF_8));

    publisher.start();
    publisher.publish(message, "cam-1");
    publisher.close();

    assertEquals(1, producer.history().size());
    ProducerRecord<String, byte[]> record = producer.history().get(0);
    assertEquals("frametap.frames", record.topic());
    assertEquals("cam-1", record.key());
    assertArrayEquals(message.part(1), MultipartFraming.decode(record.value()).part(1));
    assertTrue(producer.closed());
    assertEquals(0, metrics.count("publisher.failed"));
  }

  @Test
  void asynchronousFailureIsCounted() throws TransportException {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(false, new StringSerializer(), new ByteArraySerializer());
    KafkaFramePublisher publisher = new KafkaFramePublisher(producer, "frametap.frames", metrics);

    publisher.publish(MultipartMessage.of(new byte[] {1}), "cam-1");
    assertTrue(producer.errorNext(new RuntimeException("leader not available")));

    assertEquals(1, metrics.count("publisher.failed"));
  }
}
