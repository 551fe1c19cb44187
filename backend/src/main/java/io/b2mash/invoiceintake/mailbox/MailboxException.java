package io.b2mash.invoiceintake.mailbox;

/** A mailbox API call failed and will not succeed by retrying it as-is. */
public class MailboxException extends RuntimeException {

  public MailboxException(String message) {
    super(message);
  }

  public MailboxException(String message, Throwable cause) {
    super(message, cause);
  }
}
