package io.b2mash.invoiceintake.watch;

import io.b2mash.invoiceintake.mailbox.HistoryMarker;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * The single authoritative sync position for a mailbox. The cursor is stored in its decimal string
 * form and only ever moves forward.
 */
@Entity
@Table(name = "watch_state")
public class WatchState {

  @Id
  @Column(name = "mailbox_address", nullable = false, length = 320)
  private String mailboxAddress;

  @Column(name = "history_cursor", length = 40)
  private String historyCursor;

  @Column(name = "watch_expiry")
  private Instant watchExpiry;

  @Column(name = "label_filter", length = 500)
  private String labelFilter;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected WatchState() {}

  public WatchState(String mailboxAddress) {
    this.mailboxAddress = mailboxAddress;
  }

  @PrePersist
  @PreUpdate
  void onSave() {
    this.updatedAt = Instant.now();
  }

  /** Moves the cursor to {@code candidate} if it is ahead of the stored one; never backwards. */
  public void advanceCursor(HistoryMarker candidate) {
    HistoryMarker advanced = HistoryMarker.max(getHistoryCursor(), candidate);
    this.historyCursor = advanced != null ? advanced.toString() : null;
  }

  /** Operator reset: the next push bootstraps with a full sync. */
  public void clearCursor() {
    this.historyCursor = null;
  }

  public void recordWatch(Instant expiry, List<String> labelIds) {
    this.watchExpiry = expiry;
    this.labelFilter = labelIds.isEmpty() ? null : String.join(",", labelIds);
  }

  public String getMailboxAddress() {
    return mailboxAddress;
  }

  public HistoryMarker getHistoryCursor() {
    return historyCursor != null ? HistoryMarker.parse(historyCursor) : null;
  }

  public boolean hasCursor() {
    return historyCursor != null;
  }

  public Instant getWatchExpiry() {
    return watchExpiry;
  }

  public List<String> getLabelFilter() {
    if (labelFilter == null || labelFilter.isBlank()) {
      return List.of();
    }
    return Arrays.stream(labelFilter.split(",")).map(String::strip).toList();
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
