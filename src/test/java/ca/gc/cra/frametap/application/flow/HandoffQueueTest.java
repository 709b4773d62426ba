package ca.gc.cra.frametap.application.flow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class HandoffQueueTest {

  @Test
  void offerBeyondCapacityIsRejectedWithoutBlocking() {
    int capacity = 4;
    HandoffQueue<Integer> queue = new HandoffQueue<>(capacity);
    List<Boolean> results = new ArrayList<>();
    for (int i = 0; i <= capacity; i++) {
      results.add(queue.offer(i));
    }

    assertTrue(results.contains(Boolean.FALSE));
    assertFalse(results.get(capacity));
    List<Integer> drained = queue.drainAll();
    assertTrue(drained.size() <= capacity);
    assertEquals(List.of(0, 1, 2, 3), drained);
    assertEquals(0, queue.size());
  }

  @Test
  void drainOnEmptyQueueReturnsEmptyList() {
    assertTrue(new HandoffQueue<String>(1).drainAll().isEmpty());
  }

  @Test
  void capacityMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new HandoffQueue<>(0));
  }

  @Test
  void concurrentProducerAndConsumerNeverExceedCapacity() throws InterruptedException {
    HandoffQueue<Integer> queue = new HandoffQueue<>(8);
    AtomicInteger accepted = new AtomicInteger();
    AtomicInteger consumed = new AtomicInteger();
    AtomicInteger maxBatch = new AtomicInteger();
    CountDownLatch producerDone = new CountDownLatch(1);

    Thread producer = new Thread(() -> {
      for (int i = 0; i < 10_000; i++) {
        if (queue.offer(i)) {
          accepted.incrementAndGet();
        }
      }
      producerDone.countDown();
    });
    producer.start();
    while (producerDone.getCount() > 0 || queue.size() > 0) {
      List<Integer> batch = queue.drainAll();
      consumed.addAndGet(batch.size());
      maxBatch.accumulateAndGet(batch.size(), Math::max);
      producerDone.await(1, TimeUnit.MILLISECONDS);
    }
    producer.join();

    assertEquals(accepted.get(), consumed.get());
    assertTrue(maxBatch.get() <= 8);
  }
}
