package io.b2mash.invoiceintake.sync;

import io.b2mash.invoiceintake.config.IntakeProperties;
import io.b2mash.invoiceintake.mailbox.CandidateMessage;
import io.b2mash.invoiceintake.mailbox.MailboxClient;
import io.b2mash.invoiceintake.mailbox.SearchPage;
import io.b2mash.invoiceintake.pipeline.MessageProcessingResult;
import io.b2mash.invoiceintake.pipeline.ProcessingOutcome;
import io.b2mash.invoiceintake.pipeline.ProcessingPipeline;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Backstop scan for mail that still lacks the processed label. Independent of the history cursor.
 *
 * <p>Each cycle reads one search page. When every fresh message on it was resolved (processed or
 * skipped) those messages drop out of the query, so the next cycle starts over at the first page;
 * otherwise it follows the page token past the failures. Messages are attempted at most once per
 * invocation.
 */
@Service
public class FullSyncPoller {

  private static final Logger log = LoggerFactory.getLogger(FullSyncPoller.class);

  private final MailboxClient mailboxClient;
  private final ProcessingPipeline pipeline;
  private final String query;
  private final int pageSize;

  public FullSyncPoller(
      MailboxClient mailboxClient, ProcessingPipeline pipeline, IntakeProperties properties) {
    this.mailboxClient = mailboxClient;
    this.pipeline = pipeline;
    this.query = properties.mailbox().unprocessedQuery();
    this.pageSize = properties.sync().maxMessagesPerCycle();
  }

  public SyncSummary fullSync(int maxCycles) {
    if (maxCycles < 1) {
      throw new IllegalArgumentException("maxCycles must be >= 1, got " + maxCycles);
    }
    Set<String> attempted = new HashSet<>();
    var tally = new SyncSummary.Tally();
    String pageToken = null;
    int cycles = 0;

    while (cycles < maxCycles) {
      cycles++;
      SearchPage page = mailboxClient.search(query, pageToken, pageSize);
      List<CandidateMessage> fresh =
          page.messages().stream().filter(m -> attempted.add(m.messageId())).toList();

      if (fresh.isEmpty()) {
        if (!page.hasNextPage()) {
          break;
        }
        pageToken = page.nextPageToken();
        continue;
      }

      boolean allResolved = true;
      for (CandidateMessage candidate : fresh) {
        MessageProcessingResult result = pipeline.process(candidate);
        tally.record(result);
        if (result.outcome() == ProcessingOutcome.FAILED) {
          allResolved = false;
        }
      }
      pageToken = allResolved ? null : page.nextPageToken();
    }

    SyncSummary summary = tally.toSummary(SyncSummary.Mode.FULL);
    log.info(
        "Full sync finished after {} cycle(s): checked={}, processed={}, skipped={}, failed={}",
        cycles,
        summary.checkedMessages(),
        summary.processedMessages(),
        summary.skippedMessages(),
        summary.failedMessages());
    return summary;
  }
}
