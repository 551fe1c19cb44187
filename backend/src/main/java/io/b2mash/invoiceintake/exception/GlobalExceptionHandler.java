package io.b2mash.invoiceintake.exception;

import io.b2mash.invoiceintake.mailbox.MailboxException;
import io.b2mash.invoiceintake.mailbox.TransientMailboxException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(AdminAuthenticationException.class)
  public ResponseEntity<ProblemDetail> handleAdminAuthentication(
      AdminAuthenticationException ex, HttpServletRequest request) {
    log.warn(
        "Admin request rejected: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getBody().getDetail());
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ex.getBody());
  }

  @ExceptionHandler(StateUnavailableException.class)
  public ResponseEntity<ProblemDetail> handleStateUnavailable(
      StateUnavailableException ex, HttpServletRequest request) {
    log.error(
        "State store unavailable: path={}, detail={}",
        request.getRequestURI(),
        ex.getBody().getDetail(),
        ex.getCause());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ex.getBody());
  }

  @ExceptionHandler(SyncInProgressException.class)
  public ResponseEntity<ProblemDetail> handleSyncInProgress(
      SyncInProgressException ex, HttpServletRequest request) {
    log.info("Request skipped, sync in progress: path={}", request.getRequestURI());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(ex.getBody());
  }

  @ExceptionHandler(MailboxException.class)
  public ResponseEntity<ProblemDetail> handleMailbox(
      MailboxException ex, HttpServletRequest request) {
    boolean retryable = ex instanceof TransientMailboxException;
    if (retryable) {
      log.warn(
          "Transient mailbox error: path={}, error={}",
          request.getRequestURI(),
          ex.getMessage());
    } else {
      log.error("Mailbox API error: path={}", request.getRequestURI(), ex);
    }
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("Mailbox API error");
    problem.setDetail(ex.getMessage());
    problem.setProperty("retryable", retryable);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(problem);
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<ProblemDetail> handleMisconfiguration(
      IllegalStateException ex, HttpServletRequest request) {
    log.error("Request failed: path={}, error={}", request.getRequestURI(), ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Service misconfigured");
    problem.setDetail(ex.getMessage());
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }
}
