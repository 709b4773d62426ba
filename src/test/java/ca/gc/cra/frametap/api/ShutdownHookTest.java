package ca.gc.cra.frametap.api;

import static org.junit.jupiter.api.Assertions.assertFalse;

import ca.gc.cra.frametap.application.pipeline.CancellationToken;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ShutdownHookTest {

  @Test
  void closeDeregistersWithoutCancelling() {
    CancellationToken token = new CancellationToken();
    ShutdownHook hook = ShutdownHook.install(token, Duration.ofMillis(10));

    hook.close();
    hook.close();

    assertFalse(token.isCancelled());
  }
}
