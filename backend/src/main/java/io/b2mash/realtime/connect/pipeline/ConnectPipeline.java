package io.b2mash.realtime.connect.pipeline;

import io.b2mash.realtime.exception.ConnectError;
import io.b2mash.realtime.exception.TenantConnectionException;
import java.util.List;

/** Runs connect steps in order, stopping at the first failure. */
public final class ConnectPipeline {

  private ConnectPipeline() {}

  /**
   * Outcome of a run.
   *
   * @param context context after the last successful step; holds whatever must be cleaned up
   * @param error failure of the step that stopped the run, or null on success
   */
  public record Result(ConnectContext context, TenantConnectionException error) {

    public boolean succeeded() {
      return error == null;
    }
  }

  public static Result run(List<ConnectStep> steps, ConnectContext initial) {
    var context = initial;
    for (var step : steps) {
      try {
        context = step.apply(context);
      } catch (TenantConnectionException e) {
        return new Result(context, e);
      } catch (RuntimeException e) {
        return new Result(
            context,
            new TenantConnectionException(
                ConnectError.UNAVAILABLE,
                "Unexpected failure connecting tenant " + initial.tenantId(),
                e));
      }
    }
    return new Result(context, null);
  }
}
