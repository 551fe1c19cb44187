package io.b2mash.invoiceintake.push;

/** Push request without valid credentials. */
public class PushAuthenticationException extends RuntimeException {

  public PushAuthenticationException(String message) {
    super(message);
  }

  public PushAuthenticationException(String message, Throwable cause) {
    super(message, cause);
  }
}
