package ca.gc.cra.frametap.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the executors backing FrameTap's background threads.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);
  private static final String DEFAULT_PREFIX = "frametap-display";

  private ExecutorFactories() {}

  /**
   * Builds a single-thread executor for the render loop. The thread is named {@code <prefix>-0}
   * and is not a daemon, so callers must shut it down.
   *
   * @param prefix thread-name prefix; blank selects {@code frametap-display}
   * @param handler uncaught exception handler; {@code null} logs at ERROR
   * @return configured executor service
   */
  public static ExecutorService newRenderExecutor(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? DEFAULT_PREFIX : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(
        handler, (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(false);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(1),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Shuts an executor down and waits for its tasks, interrupting them once the grace period ends.
   *
   * @param executor executor to stop
   * @param grace maximum time to wait before interrupting
   * @return {@code true} if the executor terminated
   */
  public static boolean shutdownGracefully(ExecutorService executor, Duration grace) {
    Objects.requireNonNull(executor, "executor");
    Objects.requireNonNull(grace, "grace");
    executor.shutdown();
    try {
      if (executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
        return true;
      }
      log.warn("Executor did not stop within {} ms; interrupting", grace.toMillis());
      executor.shutdownNow();
      return executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
