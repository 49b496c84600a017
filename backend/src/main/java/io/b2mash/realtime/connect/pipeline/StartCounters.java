package io.b2mash.realtime.connect.pipeline;

import io.b2mash.realtime.counter.TenantRateCounters;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(3)
public class StartCounters implements ConnectStep {

  private final TenantRateCounters rateCounters;

  public StartCounters(TenantRateCounters rateCounters) {
    this.rateCounters = rateCounters;
  }

  @Override
  public ConnectContext apply(ConnectContext context) {
    rateCounters.start(context.tenant());
    return context;
  }
}
