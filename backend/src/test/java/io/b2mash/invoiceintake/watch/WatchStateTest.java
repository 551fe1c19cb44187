package io.b2mash.invoiceintake.watch;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.invoiceintake.mailbox.HistoryMarker;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class WatchStateTest {

  @Test
  void advanceCursor_neverMovesBackwards() {
    var state = new WatchState("invoices@example.com");

    state.advanceCursor(HistoryMarker.of(5));
    state.advanceCursor(HistoryMarker.of(3));
    state.advanceCursor(null);

    assertThat(state.getHistoryCursor()).isEqualTo(HistoryMarker.of(5));
  }

  @Test
  void advanceCursor_comparesNumerically() {
    var state = new WatchState("invoices@example.com");

    state.advanceCursor(HistoryMarker.of(9));
    state.advanceCursor(HistoryMarker.of(10));

    assertThat(state.getHistoryCursor()).isEqualTo(HistoryMarker.of(10));
  }

  @Test
  void clearCursor_leavesWatchDetails() {
    var state = new WatchState("invoices@example.com");
    state.advanceCursor(HistoryMarker.of(5));
    state.recordWatch(Instant.parse("2030-01-08T00:00:00Z"), List.of("INBOX", "Label_1"));

    state.clearCursor();

    assertThat(state.hasCursor()).isFalse();
    assertThat(state.getHistoryCursor()).isNull();
    assertThat(state.getLabelFilter()).containsExactly("INBOX", "Label_1");
    assertThat(state.getWatchExpiry()).isEqualTo(Instant.parse("2030-01-08T00:00:00Z"));
  }
}
