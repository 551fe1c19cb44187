package io.b2mash.invoiceintake.watch;

import io.b2mash.invoiceintake.config.IntakeProperties;
import io.b2mash.invoiceintake.sync.SyncCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Registers the push watch on first deployment, when no watch state exists yet. A failure is logged
 * and does not stop the application; an operator can retry with {@code POST /admin/start-watch}.
 */
@Component
@Order(100)
public class WatchRegistrationRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(WatchRegistrationRunner.class);

  private final SyncCoordinator syncCoordinator;
  private final IntakeProperties.Watch watchProperties;

  public WatchRegistrationRunner(SyncCoordinator syncCoordinator, IntakeProperties properties) {
    this.syncCoordinator = syncCoordinator;
    this.watchProperties = properties.watch();
  }

  @Override
  public void run(ApplicationArguments args) {
    if (!watchProperties.registerOnStartup()) {
      log.debug("Watch registration on startup disabled");
      return;
    }
    if (watchProperties.topic() == null || watchProperties.topic().isBlank()) {
      log.warn("intake.watch.topic is not configured; skipping watch registration on startup");
      return;
    }
    try {
      syncCoordinator
          .registerIfAbsent()
          .ifPresentOrElse(
              result -> log.info("Initial watch registered, cursor {}", result.cursorAfter()),
              () -> log.info("Watch state already present; startup registration not needed"));
    } catch (RuntimeException e) {
      log.error("Watch registration on startup failed: {}", e.getMessage(), e);
    }
  }
}
