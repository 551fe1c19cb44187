package io.b2mash.invoiceintake.sync;

import io.b2mash.invoiceintake.config.IntakeProperties;
import io.b2mash.invoiceintake.exception.SyncInProgressException;
import io.b2mash.invoiceintake.mailbox.HistoryMarker;
import io.b2mash.invoiceintake.watch.WatchRegistrar;
import io.b2mash.invoiceintake.watch.WatchRegistrationResult;
import io.b2mash.invoiceintake.watch.WatchState;
import io.b2mash.invoiceintake.watch.WatchStateStore;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single writer for {@link WatchState} and the pipeline. Every trigger (push, admin, scheduled job)
 * runs its pass under one lock, so a load-modify-save of the state never interleaves with another
 * pass and a message is never handed to two passes at once.
 */
@Service
public class SyncCoordinator {

  private static final Logger log = LoggerFactory.getLogger(SyncCoordinator.class);

  private final ReentrantLock lock = new ReentrantLock(true);
  private final WatchStateStore stateStore;
  private final WatchRegistrar watchRegistrar;
  private final FullSyncPoller fullSyncPoller;
  private final IntakeProperties properties;
  private final Duration lockWait;

  public SyncCoordinator(
      WatchStateStore stateStore,
      WatchRegistrar watchRegistrar,
      FullSyncPoller fullSyncPoller,
      IntakeProperties properties) {
    this.stateStore = stateStore;
    this.watchRegistrar = watchRegistrar;
    this.fullSyncPoller = fullSyncPoller;
    this.properties = properties;
    this.lockWait = properties.sync().lockWait();
  }

  /**
   * Runs {@code action} under the sync lock, waiting at most the configured lock wait.
   *
   * @return the action's result, or empty when another pass held the lock throughout
   */
  public <T> Optional<T> tryExclusive(String operation, Supplier<T> action) {
    boolean acquired;
    try {
      acquired = lock.tryLock(lockWait.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      acquired = false;
    }
    if (!acquired) {
      log.info("{} skipped: another sync pass is running", operation);
      return Optional.empty();
    }
    try {
      return Optional.of(action.get());
    } finally {
      lock.unlock();
    }
  }

  /** Like {@link #tryExclusive} but reports a busy lock as {@link SyncInProgressException}. */
  public <T> T exclusive(String operation, Supplier<T> action) {
    return tryExclusive(operation, action)
        .orElseThrow(() -> new SyncInProgressException(operation));
  }

  /** Full sync that reports the cursor alongside the counts; the cursor itself is not moved. */
  public SyncSummary fullSync(int maxCycles) {
    return exclusive(
        "full sync",
        () -> {
          HistoryMarker cursor = stateStore.load().map(WatchState::getHistoryCursor).orElse(null);
          return fullSyncPoller.fullSync(maxCycles).withCursors(cursor, cursor);
        });
  }

  public StartWatchResult startWatch() {
    return exclusive(
        "start watch",
        () -> {
          WatchRegistrationResult registration = watchRegistrar.register();
          SyncSummary drained = null;
          if (properties.watch().syncAfterStart()) {
            HistoryMarker cursor = stateStore.load().map(WatchState::getHistoryCursor).orElse(null);
            drained =
                fullSyncPoller.fullSync(properties.sync().maxCycles()).withCursors(cursor, cursor);
          }
          return new StartWatchResult(registration, drained);
        });
  }

  /** Clears the cursor so the next push bootstraps with a full sync. */
  public WatchState resetState() {
    return exclusive(
        "state reset",
        () -> {
          WatchState state = stateStore.loadOrCreate();
          HistoryMarker previous = state.getHistoryCursor();
          state.clearCursor();
          WatchState saved = stateStore.save(state);
          log.warn("Watch state cursor for {} reset (was {})", saved.getMailboxAddress(), previous);
          return saved;
        });
  }

  /** Stored state, or an empty unsaved one before the first registration. Read without the lock. */
  public WatchState currentState() {
    return stateStore.loadOrCreate();
  }

  /** Startup registration: only when no state row exists yet. */
  public Optional<WatchRegistrationResult> registerIfAbsent() {
    return tryExclusive(
            "initial watch registration",
            () ->
                watchRegistrar.isRegistered()
                    ? Optional.<WatchRegistrationResult>empty()
                    : Optional.of(watchRegistrar.register()))
        .flatMap(result -> result);
  }

  /** Scheduled renewal: only when the recorded watch is missing or about to expire. */
  public Optional<WatchRegistrationResult> renewIfDue() {
    return tryExclusive(
            "watch renewal",
            () ->
                watchRegistrar.isRenewalDue()
                    ? Optional.of(watchRegistrar.register())
                    : Optional.<WatchRegistrationResult>empty())
        .flatMap(result -> result);
  }
}
