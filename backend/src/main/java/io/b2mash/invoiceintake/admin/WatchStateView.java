package io.b2mash.invoiceintake.admin;

import io.b2mash.invoiceintake.watch.WatchState;
import java.time.Instant;
import java.util.List;

public record WatchStateView(
    String mailboxAddress,
    String historyCursor,
    Instant watchExpiry,
    List<String> labelFilter,
    Instant updatedAt) {

  static WatchStateView from(WatchState state) {
    return new WatchStateView(
        state.getMailboxAddress(),
        state.hasCursor() ? state.getHistoryCursor().toString() : null,
        state.getWatchExpiry(),
        state.getLabelFilter(),
        state.getUpdatedAt());
  }
}
