package io.b2mash.invoiceintake.watch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.invoiceintake.config.IntakeProperties;
import io.b2mash.invoiceintake.mailbox.HistoryMarker;
import io.b2mash.invoiceintake.mailbox.MailboxClient;
import io.b2mash.invoiceintake.mailbox.TransientMailboxException;
import io.b2mash.invoiceintake.mailbox.WatchRegistration;
import io.b2mash.invoiceintake.testutil.InMemoryWatchStateStore;
import io.b2mash.invoiceintake.testutil.InvoiceFixtures;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WatchRegistrarTest {

  private static final Instant NOW = Instant.parse("2030-01-01T00:00:00Z");
  private static final Instant EXPIRY = Instant.parse("2030-01-08T00:00:00Z");

  @Mock private MailboxClient mailboxClient;

  private InMemoryWatchStateStore stateStore;
  private WatchRegistrar registrar;

  @BeforeEach
  void setUp() {
    stateStore = new InMemoryWatchStateStore("invoices@example.com");
    registrar =
        new WatchRegistrar(
            mailboxClient,
            stateStore,
            InvoiceFixtures.properties(),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void register_firstTime_seedsCursorFromRegistration() {
    when(mailboxClient.createOrRenewWatch(
            "projects/test/topics/gmail", List.of("INBOX"), "include"))
        .thenReturn(new WatchRegistration(HistoryMarker.of(500), EXPIRY));

    WatchRegistrationResult result = registrar.register();

    assertThat(result.cursorBefore()).isNull();
    assertThat(result.cursorAfter()).isEqualTo("500");
    assertThat(result.watchExpiry()).isEqualTo(EXPIRY);
    var stored = stateStore.load().orElseThrow();
    assertThat(stored.getHistoryCursor()).isEqualTo(HistoryMarker.of(500));
    assertThat(stored.getLabelFilter()).containsExactly("INBOX");
  }

  @Test
  void register_existingCursor_keepsCursorButRenewsExpiry() {
    var existing = new WatchState("invoices@example.com");
    existing.advanceCursor(HistoryMarker.of(120));
    existing.recordWatch(Instant.parse("2029-12-31T00:00:00Z"), List.of());
    stateStore.save(existing);
    when(mailboxClient.createOrRenewWatch(anyString(), anyList(), anyString()))
        .thenReturn(new WatchRegistration(HistoryMarker.of(900), EXPIRY));

    WatchRegistrationResult result = registrar.register();

    assertThat(result.cursorBefore()).isEqualTo("120");
    assertThat(result.cursorAfter()).isEqualTo("120");
    assertThat(stateStore.load().orElseThrow().getWatchExpiry()).isEqualTo(EXPIRY);
  }

  @Test
  void register_mailboxFailure_writesNoState() {
    when(mailboxClient.createOrRenewWatch(anyString(), anyList(), anyString()))
        .thenThrow(new TransientMailboxException("watch failed", null));

    assertThatThrownBy(() -> registrar.register()).isInstanceOf(TransientMailboxException.class);
    assertThat(stateStore.load()).isEmpty();
  }

  @Test
  void register_missingTopic_isConfigurationError() {
    var defaults = InvoiceFixtures.properties();
    var noTopic =
        new IntakeProperties(
            defaults.mailbox(),
            new IntakeProperties.Watch(
                " ", List.of("INBOX"), "include", false, Duration.ofHours(24), "0 0 * * * *", true),
            defaults.sync(),
            defaults.storage(),
            defaults.admin(),
            defaults.push(),
            defaults.google(),
            defaults.scheduling());
    var misconfigured =
        new WatchRegistrar(mailboxClient, stateStore, noTopic, Clock.fixed(NOW, ZoneOffset.UTC));

    assertThatThrownBy(misconfigured::register).isInstanceOf(IllegalStateException.class);
    verify(mailboxClient, never()).createOrRenewWatch(anyString(), anyList(), eq("include"));
  }

  @Test
  void isRenewalDue_followsRenewBeforeWindow() {
    assertThat(registrar.isRenewalDue()).isTrue();

    var state = new WatchState("invoices@example.com");
    state.recordWatch(NOW.plus(Duration.ofDays(3)), List.of("INBOX"));
    stateStore.save(state);
    assertThat(registrar.isRenewalDue()).isFalse();

    state.recordWatch(NOW.plus(Duration.ofHours(12)), List.of("INBOX"));
    stateStore.save(state);
    assertThat(registrar.isRenewalDue()).isTrue();
  }
}
