package io.b2mash.realtime.exception;

import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A typed connection failure. The reason travels in the {@code reason} property of the problem
 * body so that a node receiving it over the internal API can rebuild the same error.
 */
public class TenantConnectionException extends ErrorResponseException {

  public static final String REASON_PROPERTY = "reason";

  private final ConnectError reason;

  public TenantConnectionException(ConnectError reason, String detail) {
    this(reason, detail, null);
  }

  public TenantConnectionException(ConnectError reason, String detail, Throwable cause) {
    super(reason.status(), createProblem(reason, detail), cause);
    this.reason = reason;
  }

  public ConnectError getReason() {
    return reason;
  }

  @Override
  public String getMessage() {
    return reason + ": " + getBody().getDetail();
  }

  private static ProblemDetail createProblem(ConnectError reason, String detail) {
    var problem = ProblemDetail.forStatus(reason.status());
    problem.setTitle(reason.title());
    problem.setDetail(detail);
    problem.setProperty(REASON_PROPERTY, reason.name());
    return problem;
  }
}
