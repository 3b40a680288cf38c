package io.bulkaction.dispatch;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-backed tracker. Entries live until released.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
  private final Set<String> inflight = ConcurrentHashMap.newKeySet();

  @Override
  public boolean tryAcquire(String batchKey) {
    return inflight.add(batchKey);
  }

  @Override
  public void release(String batchKey) {
    inflight.remove(batchKey);
  }

  int size() {
    return inflight.size();
  }
}
