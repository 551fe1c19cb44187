package io.b2mash.invoiceintake.mailbox;

import java.util.List;

/** One change-log entry; only the messages it added are of interest. */
public record HistoryRecord(HistoryMarker id, List<CandidateMessage> messagesAdded) {

  public HistoryRecord {
    messagesAdded = messagesAdded == null ? List.of() : List.copyOf(messagesAdded);
  }
}
