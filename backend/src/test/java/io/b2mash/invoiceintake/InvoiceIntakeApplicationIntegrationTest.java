package io.b2mash.invoiceintake;

import static io.b2mash.invoiceintake.testutil.InvoiceFixtures.invoiceAttachment;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.invoiceintake.admin.AdminTokenGuard;
import io.b2mash.invoiceintake.pipeline.ProcessedMessageRepository;
import io.b2mash.invoiceintake.testutil.DockerAvailable;
import io.b2mash.invoiceintake.testutil.FakeMailboxClient;
import io.b2mash.invoiceintake.testutil.FakeProviderConfiguration;
import io.b2mash.invoiceintake.testutil.InMemoryRemoteStorage;
import io.b2mash.invoiceintake.testutil.IntakeHarness;
import io.b2mash.invoiceintake.watch.WatchStateRepository;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.TestMethodOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@Import({TestcontainersConfiguration.class, FakeProviderConfiguration.class})
@ActiveProfiles("test")
@DockerAvailable
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class InvoiceIntakeApplicationIntegrationTest {

  private static final String ADMIN_TOKEN = "test-admin-token";
  private static final String PUSH_TOKEN = "test-push-token";
  private static final String MAILBOX = "invoices@example.com";

  @Autowired private MockMvc mockMvc;
  @Autowired private FakeMailboxClient mailbox;
  @Autowired private InMemoryRemoteStorage storage;
  @Autowired private WatchStateRepository watchStateRepository;
  @Autowired private ProcessedMessageRepository processedMessageRepository;

  private void push(long historyId, String expectedOutcome) throws Exception {
    mockMvc
        .perform(
            post("/pubsub/push")
                .param("token", PUSH_TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content(IntakeHarness.envelope(MAILBOX, Long.toString(historyId))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.outcome").value(expectedOutcome));
  }

  @Test
  @Order(1)
  void startWatch_persistsInitialCursor() throws Exception {
    mockMvc
        .perform(post("/admin/start-watch").header(AdminTokenGuard.HEADER, ADMIN_TOKEN))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.registration.cursorAfter").value("100"));

    assertThat(watchStateRepository.findById(MAILBOX))
        .get()
        .satisfies(
            state -> {
              assertThat(state.getHistoryCursor()).hasToString("100");
              assertThat(state.getLabelFilter()).containsExactly("INBOX");
              assertThat(state.getUpdatedAt()).isNotNull();
            });
  }

  @Test
  @Order(2)
  void push_newMail_processedAndCursorPersisted() throws Exception {
    mailbox.addMessage("m1", invoiceAttachment("INV-1"));

    push(101, "HISTORY_INCREMENTAL");

    assertThat(storage.listFolders("invoices")).containsExactly("INV-1");
    assertThat(storage.fileNames("invoices", "INV-1")).containsExactly("INV-1.csv", "INV-1.pdf");
    assertThat(processedMessageRepository.existsById("m1")).isTrue();
    assertThat(mailbox.isLabeledProcessed("m1")).isTrue();
    assertThat(watchStateRepository.findById(MAILBOX).orElseThrow().getHistoryCursor())
        .hasToString("101");
  }

  @Test
  @Order(3)
  void push_staleMarker_isDuplicate() throws Exception {
    push(100, "DUPLICATE");

    assertThat(storage.uploadCalls).hasValue(1);
    assertThat(watchStateRepository.findById(MAILBOX).orElseThrow().getHistoryCursor())
        .hasToString("101");
  }

  @Test
  @Order(4)
  void push_withoutToken_returns401() throws Exception {
    mockMvc
        .perform(
            post("/pubsub/push")
                .contentType(MediaType.APPLICATION_JSON)
                .content(IntakeHarness.envelope(MAILBOX, "500")))
        .andExpect(status().isUnauthorized());
  }

  @Test
  @Order(5)
  void resetState_thenPush_bootstrapsWithFullSync() throws Exception {
    mockMvc
        .perform(post("/admin/state/reset").header(AdminTokenGuard.HEADER, ADMIN_TOKEN))
        .andExpect(status().isOk());
    assertThat(watchStateRepository.findById(MAILBOX).orElseThrow().hasCursor()).isFalse();

    mailbox.addMessage("m2", invoiceAttachment("INV-2"));
    push(102, "BOOTSTRAP_SYNC");

    assertThat(storage.listFolders("invoices")).containsExactly("INV-1", "INV-2");
    mockMvc
        .perform(get("/admin/state").header(AdminTokenGuard.HEADER, ADMIN_TOKEN))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.historyCursor").value("102"));
  }

  @Test
  @Order(6)
  void fullSync_nothingLeft_reportsZeroProcessed() throws Exception {
    mockMvc
        .perform(
            post("/admin/full-sync")
                .param("max_cycles", "2")
                .header(AdminTokenGuard.HEADER, ADMIN_TOKEN))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.processedMessages").value(0))
        .andExpect(jsonPath("$.cursorAfter").value("102"));
  }
}
