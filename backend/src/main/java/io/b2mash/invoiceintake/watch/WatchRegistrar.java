package io.b2mash.invoiceintake.watch;

import io.b2mash.invoiceintake.config.IntakeProperties;
import io.b2mash.invoiceintake.mailbox.HistoryMarker;
import io.b2mash.invoiceintake.mailbox.MailboxClient;
import io.b2mash.invoiceintake.mailbox.WatchRegistration;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Creates or renews the mailbox push watch and records it in {@link WatchState}. The expiry and
 * label filter are always overwritten; the cursor is seeded from the registration only when none is
 * stored yet. Callers hold the sync lock.
 */
@Service
public class WatchRegistrar {

  private static final Logger log = LoggerFactory.getLogger(WatchRegistrar.class);

  private final MailboxClient mailboxClient;
  private final WatchStateStore stateStore;
  private final IntakeProperties.Watch watchProperties;
  private final Clock clock;

  public WatchRegistrar(
      MailboxClient mailboxClient,
      WatchStateStore stateStore,
      IntakeProperties properties,
      Clock clock) {
    this.mailboxClient = mailboxClient;
    this.stateStore = stateStore;
    this.watchProperties = properties.watch();
    this.clock = clock;
  }

  public WatchRegistrationResult register() {
    String topic = watchProperties.topic();
    if (topic == null || topic.isBlank()) {
      throw new IllegalStateException("intake.watch.topic is not configured");
    }
    List<String> labelIds = watchProperties.labelIds();

    WatchRegistration registration =
        mailboxClient.createOrRenewWatch(topic, labelIds, watchProperties.labelFilterAction());

    WatchState state = stateStore.loadOrCreate();
    HistoryMarker before = state.getHistoryCursor();
    state.recordWatch(registration.expiry(), labelIds);
    if (before == null) {
      state.advanceCursor(registration.cursor());
    }
    WatchState saved = stateStore.save(state);

    log.info(
        "Watch registered for {}: cursor {} -> {}, expires {}",
        saved.getMailboxAddress(),
        before,
        saved.getHistoryCursor(),
        registration.expiry());
    return new WatchRegistrationResult(
        before != null ? before.toString() : null,
        saved.getHistoryCursor() != null ? saved.getHistoryCursor().toString() : null,
        registration.expiry(),
        labelIds);
  }

  /** True when no watch is recorded or the recorded one expires within the renewal window. */
  public boolean isRenewalDue() {
    return stateStore
        .load()
        .map(WatchState::getWatchExpiry)
        .map(expiry -> !expiry.minus(watchProperties.renewBefore()).isAfter(Instant.now(clock)))
        .orElse(true);
  }

  /** True when a state row exists; the startup runner registers only on first deployment. */
  public boolean isRegistered() {
    return stateStore.load().isPresent();
  }
}
