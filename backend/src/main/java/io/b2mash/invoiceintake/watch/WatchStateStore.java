package io.b2mash.invoiceintake.watch;

import java.util.Optional;

/**
 * Durable home of the {@link WatchState} for the configured mailbox. Callers must hold the sync
 * lock across a load-modify-save.
 *
 * <p>Implementations report any storage failure as {@link
 * io.b2mash.invoiceintake.exception.StateUnavailableException}.
 */
public interface WatchStateStore {

  /** Address the state is keyed by. */
  String mailboxAddress();

  Optional<WatchState> load();

  WatchState save(WatchState state);

  default WatchState loadOrCreate() {
    return load().orElseGet(() -> new WatchState(mailboxAddress()));
  }
}
