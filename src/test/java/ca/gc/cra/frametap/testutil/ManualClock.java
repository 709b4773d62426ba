package ca.gc.cra.frametap.testutil;

import ca.gc.cra.frametap.application.port.ClockPort;

/**
 * Clock whose time only moves when a test advances it.
 */
public final class ManualClock implements ClockPort {
  private long nowMillis;

  public ManualClock(long startMillis) {
    this.nowMillis = startMillis;
  }

  @Override
  public synchronized long nowMillis() {
    return nowMillis;
  }

  public synchronized void set(long millis) {
    this.nowMillis = millis;
  }

  public synchronized void advance(long millis) {
    this.nowMillis += millis;
  }
}
