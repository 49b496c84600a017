package io.b2mash.realtime.connect.pipeline;

import static io.b2mash.realtime.TestFixtures.connection;
import static io.b2mash.realtime.TestFixtures.tenant;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import io.b2mash.realtime.connect.ConnectionManager;
import io.b2mash.realtime.exception.ConnectError;
import io.b2mash.realtime.exception.TenantConnectionException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConnectPipelineTest {

  private final ConnectionManager owner = mock(ConnectionManager.class);

  @Test
  void run_threadsContextThroughEveryStep() {
    var handle = connection("t1");
    var order = new ArrayList<String>();
    List<ConnectStep> steps =
        List.of(
            context -> {
              order.add("tenant");
              return context.withTenant(tenant("t1"));
            },
            context -> {
              order.add("connection");
              assertThat(context.tenant()).isNotNull();
              return context.withConnection(handle, null);
            });

    var result = ConnectPipeline.run(steps, ConnectContext.initial("t1", owner));

    assertThat(result.succeeded()).isTrue();
    assertThat(order).containsExactly("tenant", "connection");
    assertThat(result.context().connection()).isSameAs(handle);
    assertThat(result.context().owner()).isSameAs(owner);
  }

  @Test
  void run_stopsAtFirstFailureAndKeepsLastGoodContext() {
    var reached = new ArrayList<String>();
    List<ConnectStep> steps =
        List.of(
            context -> context.withTenant(tenant("t1")),
            context -> {
              throw new TenantConnectionException(ConnectError.TOO_MANY_CONNECTIONS, "full");
            },
            context -> {
              reached.add("register");
              return context;
            });

    var result = ConnectPipeline.run(steps, ConnectContext.initial("t1", owner));

    assertThat(result.succeeded()).isFalse();
    assertThat(result.error().getReason()).isEqualTo(ConnectError.TOO_MANY_CONNECTIONS);
    assertThat(result.context().tenant()).isNotNull();
    assertThat(reached).isEmpty();
  }

  @Test
  void run_wrapsUnexpectedExceptionsAsUnavailable() {
    var boom = new IllegalStateException("boom");
    List<ConnectStep> steps =
        List.of(
            context -> {
              throw boom;
            });

    var result = ConnectPipeline.run(steps, ConnectContext.initial("t1", owner));

    assertThat(result.error().getReason()).isEqualTo(ConnectError.UNAVAILABLE);
    assertThat(result.error().getCause()).isSameAs(boom);
  }
}
