package io.b2mash.invoiceintake.conversion;

/** An attachment that does not contain a readable invoice. Not retried. */
public class MalformedInputException extends RuntimeException {

  public MalformedInputException(String message) {
    super(message);
  }

  public MalformedInputException(String message, Throwable cause) {
    super(message, cause);
  }
}
