package io.b2mash.invoiceintake.sync;

import io.b2mash.invoiceintake.config.IntakeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodic backstop for notifications that were lost, deduplicated away or arrived while busy. */
@Component
@ConditionalOnProperty(name = "intake.scheduling.enabled", havingValue = "true")
public class FullSyncScheduler {

  private static final Logger log = LoggerFactory.getLogger(FullSyncScheduler.class);

  private final SyncCoordinator syncCoordinator;
  private final FullSyncPoller fullSyncPoller;
  private final int maxCycles;

  public FullSyncScheduler(
      SyncCoordinator syncCoordinator, FullSyncPoller fullSyncPoller, IntakeProperties properties) {
    this.syncCoordinator = syncCoordinator;
    this.fullSyncPoller = fullSyncPoller;
    this.maxCycles = properties.sync().maxCycles();
  }

  @Scheduled(
      fixedDelayString = "${intake.sync.poll-interval:PT10M}",
      initialDelayString = "${intake.sync.poll-interval:PT10M}")
  public void pollUnprocessed() {
    log.debug("Scheduled full sync starting");
    try {
      syncCoordinator
          .tryExclusive("scheduled full sync", () -> fullSyncPoller.fullSync(maxCycles))
          .ifPresent(
              summary ->
                  log.info(
                      "Scheduled full sync: checked={}, processed={}, failed={}",
                      summary.checkedMessages(),
                      summary.processedMessages(),
                      summary.failedMessages()));
    } catch (RuntimeException e) {
      log.error("Scheduled full sync failed: {}", e.getMessage(), e);
    }
  }
}
