package io.b2mash.invoiceintake.push;

import io.b2mash.invoiceintake.sync.SyncSummary;

public record PushResponse(
    PushOutcome outcome,
    String historyId,
    String cursorBefore,
    String cursorAfter,
    SyncSummary summary,
    String detail) {

  static PushResponse of(PushOutcome outcome, String detail) {
    return new PushResponse(outcome, null, null, null, null, detail);
  }
}
