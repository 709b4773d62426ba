package ca.gc.cra.frametap.infrastructure.codec;

import ca.gc.cra.frametap.application.pipeline.TopicRouter;
import ca.gc.cra.frametap.application.port.DecodeException;
import ca.gc.cra.frametap.application.port.DecodeException.Stage;
import ca.gc.cra.frametap.application.port.FrameCodec;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import ca.gc.cra.frametap.domain.frame.Envelope;
import ca.gc.cra.frametap.domain.frame.FrameTopic;
import ca.gc.cra.frametap.domain.frame.ImagePayload;
import ca.gc.cra.frametap.domain.frame.LogPayload;
import ca.gc.cra.frametap.domain.frame.MultipartMessage;
import ca.gc.cra.frametap.domain.frame.PixelEncoding;
import ca.gc.cra.frametap.domain.frame.PixelType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * <strong>What:</strong> {@link FrameCodec} using the neutral JSON encoding for timestamps, metadata, and
 * annotations.
 * <p><strong>Wire layout:</strong>
 * <ul>
 *   <li>image topics: {@code [topic, source_id, frame_time, meta, buffer, annotation]}</li>
 *   <li>{@code LogFrame}: {@code [topic, source_id, frame_time, annotation]}</li>
 * </ul>
 * {@code frame_time} is a JSON number of epoch seconds, {@code meta} is {@code {"dtype":..,"shape":[..]}}, and
 * {@code annotation} is a JSON object (an empty part or {@code null} means no annotation).</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class JsonWireCodec implements FrameCodec {
  private static final int TOPIC_PART = 0;
  private static final int SOURCE_PART = 1;
  private static final int TIME_PART = 2;
  private static final int META_PART = 3;
  private static final int BUFFER_PART = 4;
  private static final int IMAGE_ANNOTATION_PART = 5;
  private static final int LOG_ANNOTATION_PART = 3;

  @Override
  public Envelope decode(MultipartMessage message) throws DecodeException {
    if (message == null || message.size() < 2) {
      throw new DecodeException(Stage.SHORT_MESSAGE,
          "expected at least 2 parts (was " + (message == null ? 0 : message.size()) + ")");
    }
    String sourceId = utf8(message.part(SOURCE_PART));
    String rawTopic = utf8(message.part(TOPIC_PART));
    FrameTopic topic = TopicRouter.classify(rawTopic, sourceId);
    if (topic == FrameTopic.UNKNOWN) {
      throw new DecodeException(Stage.UNKNOWN_TOPIC, "unknown topic '" + rawTopic + "'");
    }
    if (message.size() != topic.partCount()) {
      throw new DecodeException(Stage.SHORT_MESSAGE,
          topic.wireName() + " expects " + topic.partCount() + " parts (was " + message.size() + ")");
    }
    double frameTime = readFrameTime(message.part(TIME_PART));
    if (!topic.carriesImage()) {
      MappingValue annotation = readAnnotation(message.part(LOG_ANNOTATION_PART));
      return new Envelope(topic, sourceId, frameTime, new LogPayload(annotation));
    }
    FrameMeta meta = readMeta(message.part(META_PART));
    byte[] buffer = message.part(BUFFER_PART);
    MappingValue annotation = readAnnotation(message.part(IMAGE_ANNOTATION_PART));
    PixelEncoding encoding = topic == FrameTopic.JPEG ? PixelEncoding.JPEG : PixelEncoding.RAW;
    ImagePayload image;
    try {
      image = new ImagePayload(encoding, meta.dtype(), meta.shape(), buffer, annotation);
    } catch (IllegalArgumentException ex) {
      throw new DecodeException(Stage.BAD_ENCODING, "invalid image metadata: " + ex.getMessage(), ex);
    }
    if (encoding == PixelEncoding.RAW && buffer.length != image.expectedRawLength()) {
      throw new DecodeException(Stage.BAD_ENCODING,
          "raw buffer holds " + buffer.length + " bytes but metadata requires " + image.expectedRawLength());
    }
    return new Envelope(topic, sourceId, frameTime, image);
  }

  @Override
  public MultipartMessage encode(Envelope envelope, boolean appendSourceSuffix) {
    FrameTopic topic = envelope.topic();
    if (topic == FrameTopic.UNKNOWN) {
      throw new IllegalArgumentException("cannot encode an envelope with an unknown topic");
    }
    String wireTopic = appendSourceSuffix ? topic.wireName() + '/' + envelope.sourceId() : topic.wireName();
    List<byte[]> parts = new ArrayList<>(topic.partCount());
    parts.add(wireTopic.getBytes(StandardCharsets.UTF_8));
    parts.add(envelope.sourceId().getBytes(StandardCharsets.UTF_8));
    parts.add(writeFrameTime(envelope.frameTime()));
    if (topic.carriesImage()) {
      if (!(envelope.payload() instanceof ImagePayload image)) {
        throw new IllegalArgumentException(topic.wireName() + " requires an image payload");
      }
      PixelEncoding expected = topic == FrameTopic.JPEG ? PixelEncoding.JPEG : PixelEncoding.RAW;
      if (image.encoding() != expected) {
        throw new IllegalArgumentException(
            topic.wireName() + " requires " + expected + " pixels (was " + image.encoding() + ")");
      }
      parts.add(writeMeta(image));
      parts.add(image.data());
    } else if (!(envelope.payload() instanceof LogPayload)) {
      throw new IllegalArgumentException(topic.wireName() + " requires a log payload");
    }
    parts.add(AnnotationJson.writeBytes(envelope.annotation()));
    return new MultipartMessage(parts);
  }

  private static double readFrameTime(byte[] part) throws DecodeException {
    try {
      JsonNode node = AnnotationJson.mapper().readTree(part);
      if (node == null || !node.isNumber()) {
        throw new DecodeException(Stage.BAD_ENCODING, "frame_time must be a JSON number");
      }
      double value = node.doubleValue();
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        throw new DecodeException(Stage.BAD_ENCODING, "frame_time must be finite");
      }
      return value;
    } catch (IOException ex) {
      throw new DecodeException(Stage.BAD_ENCODING, "frame_time is not valid JSON", ex);
    }
  }

  private static byte[] writeFrameTime(double frameTime) {
    return Double.toString(frameTime).getBytes(StandardCharsets.UTF_8);
  }

  private static FrameMeta readMeta(byte[] part) throws DecodeException {
    JsonNode node;
    try {
      node = AnnotationJson.mapper().readTree(part);
    } catch (IOException ex) {
      throw new DecodeException(Stage.BAD_ENCODING, "meta is not valid JSON", ex);
    }
    if (node == null || !node.isObject()) {
      throw new DecodeException(Stage.BAD_ENCODING, "meta must be a JSON object");
    }
    JsonNode dtypeNode = node.get("dtype");
    JsonNode shapeNode = node.get("shape");
    if (dtypeNode == null || !dtypeNode.isTextual() || shapeNode == null || !shapeNode.isArray()) {
      throw new DecodeException(Stage.BAD_ENCODING, "meta requires textual dtype and array shape");
    }
    PixelType dtype;
    try {
      dtype = PixelType.fromLabel(dtypeNode.textValue());
    } catch (IllegalArgumentException ex) {
      throw new DecodeException(Stage.BAD_ENCODING, ex.getMessage(), ex);
    }
    int[] shape = new int[shapeNode.size()];
    for (int i = 0; i < shape.length; i++) {
      JsonNode dim = shapeNode.get(i);
      if (!dim.isIntegralNumber() || !dim.canConvertToInt()) {
        throw new DecodeException(Stage.BAD_ENCODING, "meta shape must contain integers");
      }
      shape[i] = dim.intValue();
    }
    return new FrameMeta(dtype, shape);
  }

  private static byte[] writeMeta(ImagePayload image) {
    ObjectNode meta = AnnotationJson.mapper().createObjectNode();
    meta.put("dtype", image.dtype().label());
    ArrayNode shape = meta.putArray("shape");
    for (int dim : image.shape()) {
      shape.add(dim);
    }
    return meta.toString().getBytes(StandardCharsets.UTF_8);
  }

  private static MappingValue readAnnotation(byte[] part) throws DecodeException {
    try {
      return AnnotationJson.readMapping(part);
    } catch (IOException ex) {
      throw new DecodeException(Stage.BAD_ENCODING, "annotation is not a JSON object", ex);
    }
  }

  private static String utf8(byte[] bytes) {
    return new String(bytes, StandardCharsets.UTF_8);
  }

  private record FrameMeta(PixelType dtype, int[] shape) {}
}
