package ca.gc.cra.frametap.application.flow;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;

/**
 * <strong>What:</strong> Bounded, non-blocking hand-off between the network thread and the render thread.
 * <p><strong>Why:</strong> Decode throughput must never wait on render throughput; when the renderer falls behind
 * the newest frame is dropped instead.</p>
 * <p><strong>Thread-safety:</strong> Single producer, single consumer; synchronization comes from the backing
 * {@link ArrayBlockingQueue}.</p>
 *
 * @param <T> item type
 * @since 0.1.0
 */
public final class HandoffQueue<T> {
  private final ArrayBlockingQueue<T> queue;
  private final int capacity;

  /**
   * Creates a queue.
   *
   * @param capacity maximum number of buffered items; must be positive
   */
  public HandoffQueue(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive (was " + capacity + ")");
    }
    this.capacity = capacity;
    this.queue = new ArrayBlockingQueue<>(capacity);
  }

  /**
   * Enqueues without blocking.
   *
   * @param item item to hand off
   * @return {@code false} when the queue was full and {@code item} was discarded
   */
  public boolean offer(T item) {
    return queue.offer(Objects.requireNonNull(item, "item"));
  }

  /**
   * Removes every currently buffered item without blocking.
   *
   * @return drained items in arrival order; empty when nothing was buffered
   */
  public List<T> drainAll() {
    List<T> drained = new ArrayList<>(Math.min(queue.size(), capacity));
    queue.drainTo(drained);
    return drained;
  }

  public int size() {
    return queue.size();
  }

  public int capacity() {
    return capacity;
  }
}
