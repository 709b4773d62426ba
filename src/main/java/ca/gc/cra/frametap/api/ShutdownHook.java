package ca.gc.cra.frametap.api;

import ca.gc.cra.frametap.application.pipeline.CancellationToken;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JVM shutdown hook that cancels a running command and waits for its cleanup.
 *
 * <p>On SIGINT/SIGTERM the hook cancels the token, then blocks until {@link #close()} signals that
 * the command's {@code finally} chain has run (open log windows published, sockets closed) or the
 * grace period elapses.</p>
 */
final class ShutdownHook implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ShutdownHook.class);

  private final Thread thread;
  private final CountDownLatch finished = new CountDownLatch(1);

  private ShutdownHook(CancellationToken token, Duration grace) {
    this.thread = new Thread(() -> {
      log.info("Shutdown requested; stopping");
      token.cancel();
      try {
        if (!finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
          log.warn("Command did not finish within {} ms of shutdown", grace.toMillis());
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }, "frametap-shutdown");
  }

  static ShutdownHook install(CancellationToken token, Duration grace) {
    ShutdownHook hook = new ShutdownHook(
        Objects.requireNonNull(token, "token"), Objects.requireNonNull(grace, "grace"));
    Runtime.getRuntime().addShutdownHook(hook.thread);
    return hook;
  }

  @Override
  public void close() {
    finished.countDown();
    try {
      Runtime.getRuntime().removeShutdownHook(thread);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; hook left in place");
    }
  }
}
