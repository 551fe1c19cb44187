package io.b2mash.invoiceintake.mailbox;

import java.util.List;

/**
 * A page of the change log. {@code historyId} is the mailbox's current position as reported by the
 * API at the time of the call and may be {@code null}.
 */
public record HistoryPage(
    List<HistoryRecord> records, String nextPageToken, HistoryMarker historyId) {

  public HistoryPage {
    records = records == null ? List.of() : List.copyOf(records);
  }

  public boolean hasNextPage() {
    return nextPageToken != null && !nextPageToken.isBlank();
  }
}
