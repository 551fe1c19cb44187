package io.b2mash.invoiceintake.sync;

import static io.b2mash.invoiceintake.testutil.InvoiceFixtures.invoiceAttachment;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.invoiceintake.exception.StateUnavailableException;
import io.b2mash.invoiceintake.exception.SyncInProgressException;
import io.b2mash.invoiceintake.mailbox.HistoryMarker;
import io.b2mash.invoiceintake.testutil.IntakeHarness;
import io.b2mash.invoiceintake.watch.WatchState;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SyncCoordinatorTest {

  private final IntakeHarness harness = new IntakeHarness();
  private final ExecutorService executor = Executors.newSingleThreadExecutor();

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void tryExclusive_lockHeldElsewhere_returnsEmptyAfterWait() throws Exception {
    var held = new CountDownLatch(1);
    var release = new CountDownLatch(1);
    Future<Optional<String>> holder =
        executor.submit(
            () ->
                harness.coordinator.tryExclusive(
                    "holder",
                    () -> {
                      held.countDown();
                      awaitQuietly(release);
                      return "done";
                    }));
    assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

    Optional<String> result = harness.coordinator.tryExclusive("second", () -> "ran");
    assertThat(result).isEmpty();
    assertThatThrownBy(() -> harness.coordinator.exclusive("admin full sync", () -> "ran"))
        .isInstanceOf(SyncInProgressException.class);

    release.countDown();
    assertThat(holder.get(5, TimeUnit.SECONDS)).contains("done");
    assertThat(harness.coordinator.tryExclusive("third", () -> "ran")).contains("ran");
  }

  @Test
  void startWatch_registersAndDrainsUnprocessedMail() {
    harness.mailbox.addMessage("m1", invoiceAttachment("INV-1"));

    StartWatchResult result = harness.coordinator.startWatch();

    assertThat(result.registration().cursorBefore()).isNull();
    assertThat(result.registration().cursorAfter()).isEqualTo("101");
    assertThat(result.registration().watchExpiry())
        .isEqualTo(Instant.parse("2030-01-08T00:00:00Z"));
    assertThat(result.sync().processedMessages()).isEqualTo(1);
    assertThat(result.sync().cursorAfter()).isEqualTo("101");
    assertThat(harness.mailbox.isLabeledProcessed("m1")).isTrue();
  }

  @Test
  void startWatch_renewal_keepsExistingCursor() {
    harness.coordinator.startWatch();
    harness.mailbox.addMessage("m1", invoiceAttachment("INV-1"));

    StartWatchResult renewed = harness.coordinator.startWatch();

    assertThat(renewed.registration().cursorBefore()).isEqualTo("100");
    assertThat(renewed.registration().cursorAfter()).isEqualTo("100");
    assertThat(harness.mailbox.watchCalls).hasValue(2);
  }

  @Test
  void resetState_clearsCursorButKeepsWatch() {
    harness.coordinator.startWatch();

    WatchState reset = harness.coordinator.resetState();

    assertThat(reset.hasCursor()).isFalse();
    assertThat(reset.getWatchExpiry()).isEqualTo(Instant.parse("2030-01-08T00:00:00Z"));
    assertThat(harness.coordinator.currentState().getHistoryCursor()).isNull();
  }

  @Test
  void fullSync_reportsStoredCursorWithoutMovingIt() {
    harness.coordinator.startWatch();
    harness.mailbox.addMessage("m1", invoiceAttachment("INV-1"));

    SyncSummary summary = harness.coordinator.fullSync(3);

    assertThat(summary.cursorBefore()).isEqualTo("100");
    assertThat(summary.cursorAfter()).isEqualTo("100");
    assertThat(summary.processedMessages()).isEqualTo(1);
    assertThat(harness.coordinator.currentState().getHistoryCursor())
        .isEqualTo(HistoryMarker.of(100));
  }

  @Test
  void registerIfAbsent_onlyFirstCallRegisters() {
    assertThat(harness.coordinator.registerIfAbsent()).isPresent();
    assertThat(harness.coordinator.registerIfAbsent()).isEmpty();
    assertThat(harness.mailbox.watchCalls).hasValue(1);
  }

  @Test
  void renewIfDue_freshWatch_notRenewed() {
    harness.coordinator.startWatch();

    assertThat(harness.coordinator.renewIfDue()).isEmpty();
    assertThat(harness.mailbox.watchCalls).hasValue(1);
  }

  @Test
  void resetState_storeDown_propagates() {
    harness.stateStore.setUnavailable(true);

    assertThatThrownBy(() -> harness.coordinator.resetState())
        .isInstanceOf(StateUnavailableException.class);
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
