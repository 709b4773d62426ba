package ca.gc.cra.frametap.infrastructure.transport.zmq;

import ca.gc.cra.frametap.application.port.FrameSource;
import ca.gc.cra.frametap.application.port.TransportException;
import ca.gc.cra.frametap.domain.frame.FrameTopic;
import ca.gc.cra.frametap.domain.frame.MultipartMessage;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zeromq.SocketType;
import org.zeromq.ZContext;
import org.zeromq.ZMQ;
import org.zeromq.ZMQException;

/**
 * <strong>What:</strong> {@link FrameSource} backed by a JeroMQ SUB socket.
 * <p><strong>Why:</strong> ZeroMQ is the native transport of the frame protocol; publishers bind PUB sockets
 * and subscribers connect, or the reverse for fan-in.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; the socket belongs to the thread that calls
 * {@link #start()} and {@link #poll()}.</p>
 * <p><strong>Performance:</strong> {@link #poll()} blocks for at most the configured receive timeout.</p>
 *
 * @since 0.1.0
 */
public final class ZmqFrameSource implements FrameSource {
  private static final Logger log = LoggerFactory.getLogger(ZmqFrameSource.class);

  private final List<String> endpoints;
  private final boolean bind;
  private final List<String> subscriptions;
  private final int receiveTimeoutMillis;

  private ZContext context;
  private ZMQ.Socket socket;

  /**
   * Creates a SUB source.
   *
   * @param endpoints endpoints to connect or bind; at least one
   * @param bind {@code true} to bind the endpoints instead of connecting
   * @param subscriptions topic prefixes; empty subscribes to every frame topic
   * @param receiveTimeoutMillis bounded receive timeout
   */
  public ZmqFrameSource(List<String> endpoints, boolean bind, List<String> subscriptions, int receiveTimeoutMillis) {
    this.endpoints = List.copyOf(Objects.requireNonNull(endpoints, "endpoints"));
    if (this.endpoints.isEmpty()) {
      throw new IllegalArgumentException("at least one endpoint is required");
    }
    this.bind = bind;
    this.subscriptions = subscriptions == null || subscriptions.isEmpty()
        ? List.of(FrameTopic.VIDEO.wireName(), FrameTopic.JPEG.wireName(), FrameTopic.LOG.wireName())
        : List.copyOf(subscriptions);
    if (receiveTimeoutMillis <= 0) {
      throw new IllegalArgumentException("receiveTimeoutMillis must be positive");
    }
    this.receiveTimeoutMillis = receiveTimeoutMillis;
  }

  @Override
  public void start() throws TransportException {
    if (socket != null) {
      throw new IllegalStateException("source already started");
    }
    ZContext ctx = new ZContext();
    try {
      ZMQ.Socket sub = ctx.createSocket(SocketType.SUB);
      sub.setLinger(0);
      sub.setReceiveTimeOut(receiveTimeoutMillis);
      for (String prefix : subscriptions) {
        sub.subscribe(prefix.getBytes(StandardCharsets.UTF_8));
      }
      for (String endpoint : endpoints) {
        if (bind) {
          if (!sub.bind(endpoint)) {
            throw new TransportException("Failed to bind SUB socket to " + endpoint);
          }
        } else if (!sub.connect(endpoint)) {
          throw new TransportException("Failed to connect SUB socket to " + endpoint);
        }
      }
      context = ctx;
      socket = sub;
    } catch (ZMQException ex) {
      ctx.close();
      throw new TransportException("ZeroMQ SUB setup failed: " + ex.getMessage(), ex);
    } catch (TransportException ex) {
      ctx.close();
      throw ex;
    }
    log.info("ZeroMQ SUB {} {} subscribed to {}", bind ? "bound to" : "connected to", endpoints, subscriptions);
  }

  @Override
  public Optional<MultipartMessage> poll() throws TransportException {
    if (socket == null) {
      throw new IllegalStateException("source not started");
    }
    try {
      byte[] first = socket.recv(0);
      if (first == null) {
        return Optional.empty();
      }
      List<byte[]> parts = new ArrayList<>(6);
      parts.add(first);
      while (socket.hasReceiveMore()) {
        byte[] part = socket.recv(0);
        if (part == null) {
          break;
        }
        parts.add(part);
      }
      return Optional.of(new MultipartMessage(parts));
    } catch (ZMQException ex) {
      throw new TransportException("ZeroMQ receive failed: " + ex.getMessage(), ex);
    }
  }

  @Override
  public void close() {
    ZContext ctx = context;
    context = null;
    socket = null;
    if (ctx != null) {
      ctx.close();
      log.debug("ZeroMQ SUB context closed");
    }
  }
}
