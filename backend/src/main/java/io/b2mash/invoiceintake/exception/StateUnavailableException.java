package io.b2mash.invoiceintake.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The watch state store could not be read or written. The current pass is aborted without touching
 * any cursor; the next trigger retries from the last persisted state.
 */
public class StateUnavailableException extends ErrorResponseException {

  public StateUnavailableException(String detail, Throwable cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("State store unavailable");
    problem.setDetail(detail);
    return problem;
  }
}
