package ca.gc.cra.frametap.adapter.kafka;

import ca.gc.cra.frametap.application.port.FrameSource;
import ca.gc.cra.frametap.application.port.TransportException;
import ca.gc.cra.frametap.domain.frame.MultipartMessage;
import ca.gc.cra.frametap.logging.Logs;
import ca.gc.cra.frametap.validation.Strings;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.UUID;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link FrameSource} that reads framed multipart messages from a Kafka topic.
 * <p><strong>Why:</strong> Lets subscribers run where the ZeroMQ publisher is unreachable but a Kafka bridge
 * is available.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one consumer per source.</p>
 * <p><strong>Performance:</strong> Buffers each Kafka batch and hands records out one poll at a time.</p>
 * <p><strong>Observability:</strong> A record with malformed framing is handed on as an empty message so the
 * subscriber counts it as a received and dropped short message.</p>
 *
 * @since 0.1.0
 */
public final class KafkaFrameSource implements FrameSource {
  private static final Logger log = LoggerFactory.getLogger(KafkaFrameSource.class);

  private static final MultipartMessage UNFRAMED = new MultipartMessage(List.of());

  private final Consumer<String, byte[]> consumer;
  private final String topic;
  private final Duration pollTimeout;
  private final Deque<ConsumerRecord<String, byte[]>> pending = new ArrayDeque<>();

  /**
   * Creates a Kafka source.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers; must not be blank
   * @param topic Kafka topic carrying framed messages
   * @param pollTimeout maximum time a poll may block
   */
  public KafkaFrameSource(String bootstrapServers, String topic, Duration pollTimeout) {
    this(createConsumer(bootstrapServers), topic, pollTimeout);
  }

  KafkaFrameSource(Consumer<String, byte[]> consumer, String topic, Duration pollTimeout) {
    this.consumer = Objects.requireNonNull(consumer, "consumer");
    this.topic = Strings.sanitizeTopic("kafkaTopic", topic);
    this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
  }

  @Override
  public void start() throws TransportException {
    try {
      consumer.subscribe(List.of(topic));
    } catch (KafkaException ex) {
      throw new TransportException("Failed to subscribe to Kafka topic " + topic, ex);
    }
    log.info("Kafka frame source subscribed to {}", topic);
  }

  @Override
  public Optional<MultipartMessage> poll() throws TransportException {
    if (pending.isEmpty()) {
      try {
        consumer.poll(pollTimeout).forEach(pending::addLast);
      } catch (KafkaException ex) {
        throw new TransportException("Kafka poll failed on " + topic, ex);
      }
    }
    ConsumerRecord<String, byte[]> record = pending.pollFirst();
    if (record == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(MultipartFraming.decode(record.value()));
    } catch (IllegalArgumentException ex) {
      log.debug("Malformed record at {}-{}@{} (key {}): {}",
          record.topic(), record.partition(), record.offset(),
          Logs.truncate(record.key(), 64), ex.getMessage());
      return Optional.of(UNFRAMED);
    }
  }

  @Override
  public void close() {
    pending.clear();
    consumer.close(Duration.ofSeconds(5));
  }

  private static Consumer<String, byte[]> createConsumer(String bootstrapServers) {
    String trimmed = Strings.requireNonBlank("kafkaBootstrap", bootstrapServers);
    Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, trimmed);
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.GROUP_ID_CONFIG, "frametap-subscriber-" + UUID.randomUUID());
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
    props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 100);
    return new KafkaConsumer<>(props);
  }
}
