package io.b2mash.invoiceintake.sync;

import io.b2mash.invoiceintake.config.IntakeProperties;
import io.b2mash.invoiceintake.mailbox.CandidateMessage;
import io.b2mash.invoiceintake.mailbox.HistoryMarker;
import io.b2mash.invoiceintake.mailbox.HistoryPage;
import io.b2mash.invoiceintake.mailbox.HistoryRecord;
import io.b2mash.invoiceintake.mailbox.MailboxClient;
import io.b2mash.invoiceintake.pipeline.ProcessingPipeline;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Walks the mailbox change log forward from a cursor and feeds the newly added messages to the
 * pipeline.
 *
 * <p>Each message is handed over at most once per pass, in first-seen order. The returned cursor is
 * the highest of the start cursor, the push hint and every history id observed; it is never behind
 * the start cursor. A retained-history gap surfaces as {@link
 * io.b2mash.invoiceintake.mailbox.HistoryExpiredException} before any message is processed.
 */
@Service
public class IncrementalSyncEngine {

  private static final Logger log = LoggerFactory.getLogger(IncrementalSyncEngine.class);

  private final MailboxClient mailboxClient;
  private final ProcessingPipeline pipeline;
  private final Set<String> labelFilter;
  private final boolean excludeFilter;

  public IncrementalSyncEngine(
      MailboxClient mailboxClient, ProcessingPipeline pipeline, IntakeProperties properties) {
    this.mailboxClient = mailboxClient;
    this.pipeline = pipeline;
    this.labelFilter = Set.copyOf(properties.watch().labelIds());
    this.excludeFilter = "exclude".equalsIgnoreCase(properties.watch().labelFilterAction());
  }

  public IncrementalSyncResult syncFrom(HistoryMarker cursor, HistoryMarker upperBoundHint) {
    var candidates = new LinkedHashMap<String, CandidateMessage>();
    HistoryMarker highestSeen = null;
    int pages = 0;

    String pageToken = null;
    HistoryPage page;
    do {
      page = mailboxClient.fetchHistory(cursor, pageToken);
      pages++;
      highestSeen = HistoryMarker.max(highestSeen, page.historyId());
      for (HistoryRecord record : page.records()) {
        highestSeen = HistoryMarker.max(highestSeen, record.id());
        for (CandidateMessage message : record.messagesAdded()) {
          if (matchesLabelFilter(message)) {
            candidates.putIfAbsent(message.messageId(), message);
          }
        }
      }
      pageToken = page.nextPageToken();
    } while (page.hasNextPage());

    List<CandidateMessage> ordered = new ArrayList<>(candidates.values());
    log.info(
        "History from {} yielded {} candidate(s) over {} page(s)", cursor, ordered.size(), pages);

    var tally = new SyncSummary.Tally();
    for (CandidateMessage candidate : ordered) {
      tally.record(pipeline.process(candidate));
    }

    HistoryMarker newCursor =
        HistoryMarker.max(cursor, HistoryMarker.max(upperBoundHint, highestSeen));
    return new IncrementalSyncResult(
        newCursor,
        ordered,
        tally.toSummary(SyncSummary.Mode.INCREMENTAL).withCursors(cursor, newCursor));
  }

  private boolean matchesLabelFilter(CandidateMessage message) {
    if (labelFilter.isEmpty()) {
      return true;
    }
    boolean intersects = message.labels().stream().anyMatch(labelFilter::contains);
    return excludeFilter != intersects;
  }
}
