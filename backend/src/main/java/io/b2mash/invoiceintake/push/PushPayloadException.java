package io.b2mash.invoiceintake.push;

/** Push body that cannot be decoded into a notification. Acknowledged, never retried. */
public class PushPayloadException extends RuntimeException {

  public PushPayloadException(String message) {
    super(message);
  }

  public PushPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
