package io.b2mash.invoiceintake.push;

import io.b2mash.invoiceintake.config.IntakeProperties;
import io.b2mash.invoiceintake.mailbox.HistoryExpiredException;
import io.b2mash.invoiceintake.mailbox.HistoryMarker;
import io.b2mash.invoiceintake.mailbox.TransientMailboxException;
import io.b2mash.invoiceintake.sync.FullSyncPoller;
import io.b2mash.invoiceintake.sync.IncrementalSyncEngine;
import io.b2mash.invoiceintake.sync.IncrementalSyncResult;
import io.b2mash.invoiceintake.sync.SyncCoordinator;
import io.b2mash.invoiceintake.sync.SyncSummary;
import io.b2mash.invoiceintake.watch.WatchState;
import io.b2mash.invoiceintake.watch.WatchStateStore;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns an authenticated push delivery into at most one sync pass.
 *
 * <p>Notifications are delivered at least once and out of order, so the marker is only a hint: a
 * marker at or behind the stored cursor is a no-op, and the cursor is persisted only after the pass
 * has handed every candidate to the pipeline. A crash mid-pass re-fetches the same range, which
 * the pipeline's processed check turns into skips.
 */
@Service
public class PushIngestService {

  private static final Logger log = LoggerFactory.getLogger(PushIngestService.class);

  private final PushAuthenticator authenticator;
  private final PushEnvelopeDecoder decoder;
  private final SyncCoordinator syncCoordinator;
  private final WatchStateStore stateStore;
  private final IncrementalSyncEngine incrementalSyncEngine;
  private final FullSyncPoller fullSyncPoller;
  private final String mailboxAddress;
  private final int maxCycles;

  public PushIngestService(
      PushAuthenticator authenticator,
      PushEnvelopeDecoder decoder,
      SyncCoordinator syncCoordinator,
      WatchStateStore stateStore,
      IncrementalSyncEngine incrementalSyncEngine,
      FullSyncPoller fullSyncPoller,
      IntakeProperties properties) {
    this.authenticator = authenticator;
    this.decoder = decoder;
    this.syncCoordinator = syncCoordinator;
    this.stateStore = stateStore;
    this.incrementalSyncEngine = incrementalSyncEngine;
    this.fullSyncPoller = fullSyncPoller;
    this.mailboxAddress = properties.mailbox().address();
    this.maxCycles = properties.sync().maxCycles();
  }

  /**
   * @throws PushAuthenticationException if the delivery is not authenticated
   * @throws io.b2mash.invoiceintake.exception.StateUnavailableException if the cursor cannot be
   *     read or written
   */
  public PushResponse ingest(String payload, String authorization, String token) {
    authenticator.authenticate(authorization, token);

    Notification notification;
    try {
      notification = decoder.decode(payload);
    } catch (PushPayloadException e) {
      log.warn("Rejected push payload: {}", e.getMessage());
      return PushResponse.of(PushOutcome.REJECTED, e.getMessage());
    }

    if (!isConfiguredMailbox(notification.mailboxAddress())) {
      log.info("Ignoring push for mailbox {}", notification.mailboxAddress());
      return PushResponse.of(PushOutcome.IGNORED, "mailbox not watched");
    }

    try {
      return syncCoordinator
          .tryExclusive("push " + notification.historyMarker(), () -> handle(notification))
          .orElseGet(() -> PushResponse.of(PushOutcome.BUSY, "sync in progress"));
    } catch (TransientMailboxException e) {
      log.warn(
          "Push {} left for a later pass after transient mailbox error: {}",
          notification.historyMarker(),
          e.getMessage());
      return PushResponse.of(PushOutcome.RETRYABLE_ERROR, e.getMessage());
    }
  }

  private PushResponse handle(Notification notification) {
    HistoryMarker marker = notification.historyMarker();
    WatchState state = stateStore.loadOrCreate();
    HistoryMarker cursor = state.getHistoryCursor();

    if (cursor == null) {
      log.info("No cursor stored; bootstrapping with a full sync up to {}", marker);
      SyncSummary summary = fullSyncPoller.fullSync(maxCycles);
      return advanceAndSave(state, cursor, marker, PushOutcome.BOOTSTRAP_SYNC, marker, summary);
    }

    if (!marker.isAfter(cursor)) {
      log.debug("Push {} is at or behind cursor {}; nothing to do", marker, cursor);
      String current = cursor.toString();
      return new PushResponse(
          PushOutcome.DUPLICATE, marker.toString(), current, current, null, null);
    }

    try {
      IncrementalSyncResult result = incrementalSyncEngine.syncFrom(cursor, marker);
      return advanceAndSave(
          state,
          cursor,
          result.newCursor(),
          PushOutcome.HISTORY_INCREMENTAL,
          marker,
          result.summary());
    } catch (HistoryExpiredException e) {
      log.warn("History from {} no longer available; falling back to full sync", cursor);
      SyncSummary summary = fullSyncPoller.fullSync(maxCycles);
      return advanceAndSave(
          state, cursor, marker, PushOutcome.HISTORY_GAP_FULL_SYNC, marker, summary);
    }
  }

  private PushResponse advanceAndSave(
      WatchState state,
      HistoryMarker before,
      HistoryMarker candidate,
      PushOutcome outcome,
      HistoryMarker marker,
      SyncSummary summary) {
    state.advanceCursor(candidate);
    WatchState saved = stateStore.save(state);
    HistoryMarker after = saved.getHistoryCursor();
    log.info("Push {} handled as {}: cursor {} -> {}", marker, outcome, before, after);
    return new PushResponse(
        outcome,
        marker.toString(),
        before != null ? before.toString() : null,
        after != null ? after.toString() : null,
        summary.withCursors(before, after),
        null);
  }

  private boolean isConfiguredMailbox(String address) {
    if (mailboxAddress == null || mailboxAddress.isBlank()) {
      return true;
    }
    return mailboxAddress.strip().toLowerCase(Locale.ROOT).equals(address.toLowerCase(Locale.ROOT));
  }
}
