package ca.gc.cra.frametap.infrastructure.transport.zmq;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.frametap.application.port.TransportException;
import ca.gc.cra.frametap.domain.frame.MultipartMessage;
import java.io.IOException;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ZmqLoopbackTest {

  @Test
  void subscriberReceivesMultipartMessagesForSubscribedTopics() throws Exception {
    String endpoint = "tcp://127.0.0.1:" + freePort();
    ZmqFramePublisher publisher = new ZmqFramePublisher(List.of(endpoint), true);
    ZmqFrameSource source = new ZmqFrameSource(List.of(endpoint), false, List.of(), 50);
    MultipartMessage audio = MultipartMessage.of(bytes("AudioFrame"), bytes("srcA"), bytes("1.0"));
    MultipartMessage log = MultipartMessage.of(bytes("LogFrame/srcA"), bytes("srcA"), bytes("1.0"), bytes("{}"));
    try {
      publisher.start();
      source.start();

      Optional<MultipartMessage> received = Optional.empty();
      long deadline = System.currentTimeMillis() + 10_000;
      while (received.isEmpty() && System.currentTimeMillis() < deadline) {
        publisher.publish(audio, "srcA");
        publisher.publish(log, "srcA");
        received = source.poll();
      }

      assertTrue(received.isPresent());
      MultipartMessage message = received.get();
      assertEquals(4, message.size());
      assertArrayEquals(bytes("LogFrame/srcA"), message.part(0));
      assertArrayEquals(bytes("{}"), message.part(3));
    } finally {
      source.close();
      publisher.close();
    }
  }

  @Test
  void idlePollTimesOutEmpty() throws TransportException, IOException {
    ZmqFrameSource source = new ZmqFrameSource(
        List.of("tcp://127.0.0.1:" + freePort()), false, List.of("VideoFrame"), 20);
    try {
      source.start();
      assertTrue(source.poll().isEmpty());
    } finally {
      source.close();
    }
  }

  @Test
  void rejectsInvalidConstruction() {
    assertThrows(IllegalArgumentException.class, () -> new ZmqFrameSource(List.of(), false, List.of(), 10));
    assertThrows(IllegalArgumentException.class,
        () -> new ZmqFrameSource(List.of("tcp://127.0.0.1:1"), false, List.of(), 0));
    assertThrows(IllegalArgumentException.class, () -> new ZmqFramePublisher(List.of(), true));
  }

  @Test
  void publishBeforeStartFails() {
    ZmqFramePublisher publisher = new ZmqFramePublisher(List.of("tcp://127.0.0.1:1"), false);
    assertThrows(IllegalStateException.class, () -> publisher.publish(MultipartMessage.of(new byte[1]), "k"));
  }

  private static int freePort() throws IOException {
    try (ServerSocket socket = new ServerSocket(0)) {
      return socket.getLocalPort();
    }
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
