package ca.gc.cra.frametap.adapter.kafka;

import ca.gc.cra.frametap.application.port.FramePublisher;
import ca.gc.cra.frametap.application.port.MetricsPort;
import ca.gc.cra.frametap.application.port.TransportException;
import ca.gc.cra.frametap.domain.frame.MultipartMessage;
import ca.gc.cra.frametap.validation.Strings;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link FramePublisher} that writes framed multipart messages to Kafka, keyed by
 * source id.
 * <p><strong>Why:</strong> Keying by source keeps each publisher's frames ordered within a partition.</p>
 * <p><strong>Thread-safety:</strong> Mirrors the provided {@link Producer}; the default {@link KafkaProducer}
 * is thread-safe.</p>
 * <p><strong>Observability:</strong> Asynchronous send failures are logged and counted as
 * {@code publisher.failed}.</p>
 *
 * @since 0.1.0
 */
public final class KafkaFramePublisher implements FramePublisher {
  private static final Logger log = LoggerFactory.getLogger(KafkaFramePublisher.class);

  private final Producer<String, byte[]> producer;
  private final String topic;
  private final MetricsPort metrics;

  /**
   * Creates a Kafka publisher.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers; must not be blank
   * @param topic destination topic
   * @param metrics metrics sink for asynchronous failures
   */
  public KafkaFramePublisher(String bootstrapServers, String topic, MetricsPort metrics) {
    this(createProducer(bootstrapServers), topic, metrics);
  }

  KafkaFramePublisher(Producer<String, byte[]> producer, String topic, MetricsPort metrics) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = Strings.sanitizeTopic("kafkaTopic", topic);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void start() {
    log.info("Kafka frame publisher writing to {}", topic);
  }

  @Override
  public void publish(MultipartMessage message, String key) throws TransportException {
    ProducerRecord<String, byte[]> record = new ProducerRecord<>(topic, key, MultipartFraming.encode(message));
    try {
      producer.send(record, (metadata, ex) -> {
        if (ex != null) {
          metrics.increment("publisher.failed");
          log.warn("Kafka send to {} failed: {}", topic, ex.getMessage());
        }
      });
    } catch (KafkaException ex) {
      throw new TransportException("Kafka send to " + topic + " failed", ex);
    }
  }

  @Override
  public void close() {
    try {
      producer.flush();
    } finally {
      producer.close(Duration.ofSeconds(5));
    }
  }

  private static Producer<String, byte[]> createProducer(String bootstrapServers) {
    String trimmed = Strings.requireNonBlank("kafkaBootstrap", bootstrapServers);
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, trimmed);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.MAX_REQUEST_SIZE_CONFIG, 16 * 1024 * 1024);
    return new KafkaProducer<>(props);
  }
}
