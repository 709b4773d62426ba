/**
 * Kafka bridge for the frame protocol: a consumer-backed frame source and a producer-backed publisher.
 * <p><strong>Role:</strong> Adapter layer; implements {@link ca.gc.cra.frametap.application.port.FrameSource}
 * and {@link ca.gc.cra.frametap.application.port.FramePublisher} over a single topic.</p>
 * <p><strong>Wire format:</strong> record values hold a length-prefixed multipart message; see
 * {@link ca.gc.cra.frametap.adapter.kafka.MultipartFraming}.</p>
 * <p><strong>Security:</strong> Assumes Kafka credentials provided via configuration; no secrets logged.</p>
 */
package ca.gc.cra.frametap.adapter.kafka;
