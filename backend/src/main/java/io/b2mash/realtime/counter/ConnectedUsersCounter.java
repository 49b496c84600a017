package io.b2mash.realtime.counter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

/** Number of clients currently attached to each tenant on this node. */
@Component
public class ConnectedUsersCounter {

  private final Map<String, AtomicInteger> counts = new ConcurrentHashMap<>();

  public int join(String tenantId) {
    return counts.computeIfAbsent(tenantId, k -> new AtomicInteger()).incrementAndGet();
  }

  public int leave(String tenantId) {
    var result = new AtomicInteger();
    counts.computeIfPresent(
        tenantId,
        (k, count) -> {
          result.set(Math.max(0, count.decrementAndGet()));
          return result.get() == 0 ? null : count;
        });
    return result.get();
  }

  public int countForTenant(String tenantId) {
    var count = counts.get(tenantId);
    return count != null ? count.get() : 0;
  }
}
