package ca.gc.cra.burstsafe.application.pipeline;

import ca.gc.cra.burstsafe.application.port.MetricsPort;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double capturing metric usage for assertions; safe for group workers.
 */
final class RecordingMetricsPort implements MetricsPort {
  private final Map<String, Integer> counters = new ConcurrentHashMap<>();
  private final Map<String, List<Long>> observations = new ConcurrentHashMap<>();

  @Override
  public void increment(String key) {
    counters.merge(key, 1, Integer::sum);
  }

  @Override
  public void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(value);
  }

  int count(String key) {
    return counters.getOrDefault(key, 0);
  }

  List<Long> observed(String key) {
    return observations.getOrDefault(key, Collections.emptyList());
  }
}
