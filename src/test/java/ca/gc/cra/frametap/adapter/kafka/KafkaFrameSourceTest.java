package ca.gc.cra.frametap.adapter.kafka;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.frametap.application.port.TransportException;
import ca.gc.cra.frametap.domain.frame.MultipartMessage;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.Test;

class KafkaFrameSourceTest {

  private static final String TOPIC = "frametap.frames";

  @Test
  void pollsFramedMessagesAndHandsOnMalformedRecordsAsEmpty() throws TransportException {
    MockConsumer<String, byte[]> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    KafkaFrameSource source = new KafkaFrameSource(consumer, TOPIC, Duration.ofMillis(10));
    source.start();
    TopicPartition partition = new TopicPartition(TOPIC, 0);
    consumer.rebalance(List.of(partition));
    consumer.updateBeginningOffsets(Map.of(partition, 0L));

    MultipartMessage log = MultipartMessage.of(
        bytes("LogFrame"), bytes("srcA"), bytes("1.0"), bytes("{}"));
    consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 0L, "srcA", new byte[] {0, 0, 0}));
    consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 1L, "srcA", MultipartFraming.encode(log)));

    Optional<MultipartMessage> malformed = source.poll();
    assertTrue(malformed.isPresent());
    assertEquals(0, malformed.get().size());

    Optional<MultipartMessage> polled = source.poll();
    assertTrue(polled.isPresent());
    assertArrayEquals(bytes("LogFrame"), polled.get().part(0));
    assertArrayEquals(bytes("{}"), polled.get().part(3));
    assertTrue(source.poll().isEmpty());

    source.close();
    assertTrue(consumer.closed());
  }

  @Test
  void pollFailureBecomesTransportException() throws TransportException {
    MockConsumer<String, byte[]> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    KafkaFrameSource source = new KafkaFrameSource(consumer, TOPIC, Duration.ofMillis(10));
    source.start();
    consumer.setPollException(new KafkaException("broker unavailable"));

    assertThrows(TransportException.class, source::poll);
  }

  @Test
  void rejectsInvalidTopicNames() {
    MockConsumer<String, byte[]> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    assertThrows(IllegalArgumentException.class,
        () -> new KafkaFrameSource(consumer, "frames topic", Duration.ofMillis(10)));
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
