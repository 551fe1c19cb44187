package io.b2mash.invoiceintake.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class SyncInProgressException extends ErrorResponseException {

  public SyncInProgressException(String operation) {
    super(HttpStatus.CONFLICT, createProblem(operation), null);
  }

  private static ProblemDetail createProblem(String operation) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Sync in progress");
    problem.setDetail("Another synchronization pass is running; " + operation + " was not started");
    return problem;
  }
}
