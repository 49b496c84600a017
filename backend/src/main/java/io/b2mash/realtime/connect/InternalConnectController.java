package io.b2mash.realtime.connect;

import jakarta.validation.Valid;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Node-to-node API. Connect failures render as problem responses carrying their reason. */
@RestController
@RequestMapping("/internal/tenants")
public class InternalConnectController {

  private static final Logger log = LoggerFactory.getLogger(InternalConnectController.class);

  private final ConnectService connectService;

  public InternalConnectController(ConnectService connectService) {
    this.connectService = connectService;
  }

  /** Tenants connected on this node. */
  @GetMapping
  public ResponseEntity<Set<String>> localTenants() {
    return ResponseEntity.ok(connectService.localTenants());
  }

  @PostMapping("/{tenantId}/connect")
  public ResponseEntity<ConnectResponse> connect(
      @PathVariable String tenantId, @Valid @RequestBody(required = false) ConnectRequest request) {
    log.debug("Received connect for tenant {}", tenantId);
    var options = request != null ? request.toOptions() : ConnectOptions.defaults();
    var handle = connectService.connect(tenantId, options);
    return ResponseEntity.ok(
        ConnectResponse.of(tenantId, handle.node(), ConnectionStatus.connected(handle)));
  }

  @GetMapping("/{tenantId}/connection")
  public ResponseEntity<ConnectResponse> status(@PathVariable String tenantId) {
    var status = connectService.getStatus(tenantId);
    var node = connectService.whereis(tenantId).map(ConnectionOwner::node).orElse(null);
    return ResponseEntity.ok(ConnectResponse.of(tenantId, node, status));
  }

  @DeleteMapping("/{tenantId}/connection")
  public ResponseEntity<Void> shutdown(@PathVariable String tenantId) {
    log.info("Received shutdown for tenant {}", tenantId);
    connectService.shutdownLocal(tenantId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{tenantId}/suspend")
  public ResponseEntity<Void> suspend(@PathVariable String tenantId) {
    log.info("Received suspend for tenant {}", tenantId);
    connectService.suspend(tenantId);
    return ResponseEntity.accepted().build();
  }
}
