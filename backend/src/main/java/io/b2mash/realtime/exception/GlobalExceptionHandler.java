package io.b2mash.realtime.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(TenantConnectionException.class)
  public ResponseEntity<ProblemDetail> handleTenantConnection(TenantConnectionException ex) {
    if (ex.getReason().status().is5xxServerError()) {
      log.warn("Tenant connection failed: reason={}, detail={}", ex.getReason(), detail(ex));
    } else {
      log.info("Tenant connection rejected: reason={}, detail={}", ex.getReason(), detail(ex));
    }
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  private static String detail(TenantConnectionException ex) {
    return ex.getBody().getDetail();
  }
}
