package io.b2mash.invoiceintake.watch;

import io.b2mash.invoiceintake.sync.SyncCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Renews the push watch before it lapses. Gmail watches expire after about seven days. */
@Component
@ConditionalOnProperty(name = "intake.scheduling.enabled", havingValue = "true")
public class WatchRenewalScheduler {

  private static final Logger log = LoggerFactory.getLogger(WatchRenewalScheduler.class);

  private final SyncCoordinator syncCoordinator;

  public WatchRenewalScheduler(SyncCoordinator syncCoordinator) {
    this.syncCoordinator = syncCoordinator;
  }

  @Scheduled(cron = "${intake.watch.renewal-cron:0 0 */6 * * *}")
  public void renewIfDue() {
    try {
      syncCoordinator
          .renewIfDue()
          .ifPresent(result -> log.info("Watch renewed, expires {}", result.watchExpiry()));
    } catch (RuntimeException e) {
      log.error("Watch renewal failed: {}", e.getMessage(), e);
    }
  }
}
