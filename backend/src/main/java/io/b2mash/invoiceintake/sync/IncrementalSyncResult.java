package io.b2mash.invoiceintake.sync;

import io.b2mash.invoiceintake.mailbox.CandidateMessage;
import io.b2mash.invoiceintake.mailbox.HistoryMarker;
import java.util.List;

/**
 * Outcome of a history pass. {@code newCursor} has not been persisted yet; the caller saves it once
 * the pass returns.
 */
public record IncrementalSyncResult(
    HistoryMarker newCursor, List<CandidateMessage> candidates, SyncSummary summary) {

  public IncrementalSyncResult {
    candidates = List.copyOf(candidates);
  }
}
