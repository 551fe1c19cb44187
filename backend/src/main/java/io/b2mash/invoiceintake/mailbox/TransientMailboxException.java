package io.b2mash.invoiceintake.mailbox;

/**
 * A mailbox API call failed with a network error, timeout or rate limit and kept failing after the
 * call-site retries were exhausted.
 */
public class TransientMailboxException extends MailboxException {

  public TransientMailboxException(String message, Throwable cause) {
    super(message, cause);
  }
}
