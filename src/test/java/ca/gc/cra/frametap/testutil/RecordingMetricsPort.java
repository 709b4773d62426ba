package ca.gc.cra.frametap.testutil;

import ca.gc.cra.frametap.application.port.MetricsPort;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Test double capturing metric usage for assertions.
 */
public final class RecordingMetricsPort implements MetricsPort {
  private final Map<String, Integer> counters = new HashMap<>();
  private final Map<String, List<Long>> observations = new HashMap<>();

  @Override
  public synchronized void increment(String key) {
    counters.merge(key, 1, Integer::sum);
  }

  @Override
  public synchronized void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
  }

  public synchronized int count(String key) {
    return counters.getOrDefault(key, 0);
  }

  public synchronized List<Long> observed(String key) {
    return List.copyOf(observations.getOrDefault(key, Collections.emptyList()));
  }

  public synchronized boolean hasCounter(String key) {
    return counters.containsKey(key);
  }
}
