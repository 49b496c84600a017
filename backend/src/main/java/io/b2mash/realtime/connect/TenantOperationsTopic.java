package io.b2mash.realtime.connect;

import io.b2mash.realtime.event.TenantOperationEvent;
import io.b2mash.realtime.event.TenantOperationEvent.Operation;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Routes tenant operation events to the tenant's connection owner on this node. */
@Component
public class TenantOperationsTopic {

  private static final Logger log = LoggerFactory.getLogger(TenantOperationsTopic.class);

  private final Map<String, Consumer<Operation>> subscribers = new ConcurrentHashMap<>();

  public void subscribe(String tenantId, Consumer<Operation> subscriber) {
    subscribers.put(tenantId, subscriber);
  }

  public void unsubscribe(String tenantId, Consumer<Operation> subscriber) {
    subscribers.remove(tenantId, subscriber);
  }

  public boolean hasSubscriber(String tenantId) {
    return subscribers.containsKey(tenantId);
  }

  @EventListener
  public void onTenantOperation(TenantOperationEvent event) {
    var subscriber = subscribers.get(event.tenantId());
    if (subscriber == null) {
      log.debug("No subscriber for {} of tenant {}", event.operation(), event.tenantId());
      return;
    }
    subscriber.accept(event.operation());
  }
}
