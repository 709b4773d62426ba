package ca.gc.cra.frametap.infrastructure.transport.zmq;

import ca.gc.cra.frametap.application.port.FramePublisher;
import ca.gc.cra.frametap.application.port.TransportException;
import ca.gc.cra.frametap.domain.frame.MultipartMessage;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zeromq.SocketType;
import org.zeromq.ZContext;
import org.zeromq.ZMQ;
import org.zeromq.ZMQException;

/**
 * {@link FramePublisher} backed by a JeroMQ PUB socket. The record key is ignored; ZeroMQ routes on the
 * topic part.
 *
 * @since 0.1.0
 */
public final class ZmqFramePublisher implements FramePublisher {
  private static final Logger log = LoggerFactory.getLogger(ZmqFramePublisher.class);

  private final List<String> endpoints;
  private final boolean bind;

  private ZContext context;
  private ZMQ.Socket socket;

  /**
   * Creates a PUB publisher.
   *
   * @param endpoints endpoints to bind or connect; at least one
   * @param bind {@code true} to bind, {@code false} to connect
   */
  public ZmqFramePublisher(List<String> endpoints, boolean bind) {
    this.endpoints = List.copyOf(Objects.requireNonNull(endpoints, "endpoints"));
    if (this.endpoints.isEmpty()) {
      throw new IllegalArgumentException("at least one endpoint is required");
    }
    this.bind = bind;
  }

  @Override
  public void start() throws TransportException {
    ZContext ctx = new ZContext();
    try {
      ZMQ.Socket pub = ctx.createSocket(SocketType.PUB);
      pub.setLinger(1_000);
      for (String endpoint : endpoints) {
        boolean ok = bind ? pub.bind(endpoint) : pub.connect(endpoint);
        if (!ok) {
          ctx.close();
          throw new TransportException("Failed to " + (bind ? "bind" : "connect") + " PUB socket to " + endpoint);
        }
      }
      context = ctx;
      socket = pub;
    } catch (ZMQException ex) {
      ctx.close();
      throw new TransportException("ZeroMQ PUB setup failed: " + ex.getMessage(), ex);
    }
    log.info("ZeroMQ PUB {} {}", bind ? "bound to" : "connected to", endpoints);
  }

  @Override
  public void publish(MultipartMessage message, String key) throws TransportException {
    if (socket == null) {
      throw new IllegalStateException("publisher not started");
    }
    try {
      int last = message.size() - 1;
      for (int i = 0; i <= last; i++) {
        if (!socket.send(message.part(i), i < last ? ZMQ.SNDMORE : 0)) {
          throw new TransportException("ZeroMQ send failed on part " + i);
        }
      }
    } catch (ZMQException ex) {
      throw new TransportException("ZeroMQ send failed: " + ex.getMessage(), ex);
    }
  }

  @Override
  public void close() {
    ZContext ctx = context;
    context = null;
    socket = null;
    if (ctx != null) {
      ctx.close();
      log.debug("ZeroMQ PUB context closed");
    }
  }
}
