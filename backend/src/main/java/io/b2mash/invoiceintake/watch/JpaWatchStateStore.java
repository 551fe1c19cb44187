package io.b2mash.invoiceintake.watch;

import io.b2mash.invoiceintake.config.IntakeProperties;
import io.b2mash.invoiceintake.exception.StateUnavailableException;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

@Component
public class JpaWatchStateStore implements WatchStateStore {

  private static final Logger log = LoggerFactory.getLogger(JpaWatchStateStore.class);

  private final WatchStateRepository repository;
  private final String mailboxAddress;

  public JpaWatchStateStore(WatchStateRepository repository, IntakeProperties properties) {
    this.repository = repository;
    this.mailboxAddress = stateKey(properties.mailbox());
  }

  /** The configured address, or the API user alias when no address is set. */
  static String stateKey(IntakeProperties.Mailbox mailbox) {
    if (mailbox.address() != null && !mailbox.address().isBlank()) {
      return mailbox.address().strip().toLowerCase(Locale.ROOT);
    }
    return mailbox.user();
  }

  @Override
  public String mailboxAddress() {
    return mailboxAddress;
  }

  @Override
  public Optional<WatchState> load() {
    try {
      return repository.findById(mailboxAddress);
    } catch (DataAccessException | TransactionException e) {
      log.error("Failed to load watch state for {}: {}", mailboxAddress, e.getMessage());
      throw new StateUnavailableException("Watch state could not be loaded", e);
    }
  }

  @Override
  public WatchState save(WatchState state) {
    try {
      return repository.save(state);
    } catch (DataAccessException | TransactionException e) {
      log.error("Failed to save watch state for {}: {}", mailboxAddress, e.getMessage());
      throw new StateUnavailableException("Watch state could not be saved", e);
    }
  }
}
