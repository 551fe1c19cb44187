package io.b2mash.invoiceintake.mailbox;

/**
 * The requested start cursor is older than the history the mailbox retains. Callers fall back to a
 * full sync instead of retrying the incremental fetch.
 */
public class HistoryExpiredException extends MailboxException {

  private final HistoryMarker startCursor;

  public HistoryExpiredException(HistoryMarker startCursor, Throwable cause) {
    super("History expired for start cursor " + startCursor, cause);
    this.startCursor = startCursor;
  }

  public HistoryMarker getStartCursor() {
    return startCursor;
  }
}
