package io.b2mash.realtime.counter;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.b2mash.realtime.tenant.Tenant;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

/**
 * Per-second database event counters of connected tenants. Counters exist only between {@link
 * #start} and {@link #remove}; a tenant without counters admits nothing.
 */
@Component
public class TenantRateCounters {

  private final Map<String, Integer> limits = new ConcurrentHashMap<>();
  private final Cache<String, AtomicInteger> windows;

  public TenantRateCounters() {
    this(Ticker.systemTicker());
  }

  TenantRateCounters(Ticker ticker) {
    this.windows =
        Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofSeconds(1))
            .maximumSize(10_000)
            .ticker(ticker)
            .build();
  }

  public void start(Tenant tenant) {
    limits.put(tenant.externalId(), tenant.maxEventsPerSecond());
  }

  public boolean isStarted(String tenantId) {
    return limits.containsKey(tenantId);
  }

  public boolean tryAcquire(String tenantId) {
    var limit = limits.get(tenantId);
    if (limit == null) {
      return false;
    }
    var window = windows.get(tenantId, k -> new AtomicInteger(0));
    if (window.incrementAndGet() > limit) {
      window.decrementAndGet();
      return false;
    }
    return true;
  }

  public RateStatus status(String tenantId) {
    int limit = limits.getOrDefault(tenantId, 0);
    var window = windows.getIfPresent(tenantId);
    int current = window != null ? window.get() : 0;
    return new RateStatus(current, limit, current < limit);
  }

  public void remove(String tenantId) {
    limits.remove(tenantId);
    windows.invalidate(tenantId);
  }

  public record RateStatus(int currentCount, int limit, boolean allowed) {}
}
