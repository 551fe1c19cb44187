package io.b2mash.invoiceintake.sync;

import io.b2mash.invoiceintake.mailbox.HistoryMarker;
import io.b2mash.invoiceintake.pipeline.MessageProcessingResult;

/** Counts of one synchronization pass, plus the cursor it started from and left behind. */
public record SyncSummary(
    Mode mode,
    String cursorBefore,
    String cursorAfter,
    int checkedMessages,
    int processedMessages,
    int processedAttachments,
    int skippedMessages,
    int failedMessages) {

  public enum Mode {
    FULL,
    INCREMENTAL
  }

  public SyncSummary withCursors(HistoryMarker before, HistoryMarker after) {
    return new SyncSummary(
        mode,
        before != null ? before.toString() : null,
        after != null ? after.toString() : null,
        checkedMessages,
        processedMessages,
        processedAttachments,
        skippedMessages,
        failedMessages);
  }

  /** Mutable accumulator used while a pass runs. */
  static final class Tally {

    private int checked;
    private int processed;
    private int attachments;
    private int skipped;
    private int failed;

    void record(MessageProcessingResult result) {
      checked++;
      switch (result.outcome()) {
        case PROCESSED -> {
          processed++;
          attachments += result.attachments();
        }
        case SKIPPED -> skipped++;
        case FAILED -> failed++;
      }
    }

    SyncSummary toSummary(Mode mode) {
      return new SyncSummary(mode, null, null, checked, processed, attachments, skipped, failed);
    }
  }
}
