package io.b2mash.invoiceintake.testutil;

import static org.mockito.Mockito.mock;

import io.b2mash.invoiceintake.config.IntakeProperties;
import io.b2mash.invoiceintake.conversion.CsvInvoiceConverter;
import io.b2mash.invoiceintake.conversion.InvoiceArchiveExtractor;
import io.b2mash.invoiceintake.pipeline.ProcessedMessageRepository;
import io.b2mash.invoiceintake.pipeline.ProcessingPipeline;
import io.b2mash.invoiceintake.push.PushAuthenticator;
import io.b2mash.invoiceintake.push.PushEnvelopeDecoder;
import io.b2mash.invoiceintake.push.PushIngestService;
import io.b2mash.invoiceintake.sync.FullSyncPoller;
import io.b2mash.invoiceintake.sync.IncrementalSyncEngine;
import io.b2mash.invoiceintake.sync.SyncCoordinator;
import io.b2mash.invoiceintake.watch.WatchRegistrar;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import tools.jackson.databind.ObjectMapper;

/** The sync stack wired over in-memory fakes, with a mocked processed-message ledger. */
public class IntakeHarness {

  public static final Instant NOW = Instant.parse("2030-01-01T00:00:00Z");

  public final IntakeProperties properties;
  public final FakeMailboxClient mailbox;
  public final InMemoryRemoteStorage storage = new InMemoryRemoteStorage();
  public final InMemoryWatchStateStore stateStore;
  public final ProcessedMessageRepository ledger = mock(ProcessedMessageRepository.class);
  public final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
  public final ProcessingPipeline pipeline;
  public final IncrementalSyncEngine incrementalSyncEngine;
  public final FullSyncPoller fullSyncPoller;
  public final WatchRegistrar watchRegistrar;
  public final SyncCoordinator coordinator;
  public final PushIngestService pushIngestService;

  public IntakeHarness() {
    this(InvoiceFixtures.properties(), new FakeMailboxClient());
  }

  public IntakeHarness(IntakeProperties properties, FakeMailboxClient mailbox) {
    this.properties = properties;
    this.mailbox = mailbox;
    this.stateStore = new InMemoryWatchStateStore(properties.mailbox().address());
    this.pipeline =
        new ProcessingPipeline(
            mailbox,
            storage,
            new InvoiceArchiveExtractor(),
            new CsvInvoiceConverter(),
            ledger,
            properties);
    this.incrementalSyncEngine = new IncrementalSyncEngine(mailbox, pipeline, properties);
    this.fullSyncPoller = new FullSyncPoller(mailbox, pipeline, properties);
    this.watchRegistrar = new WatchRegistrar(mailbox, stateStore, properties, clock);
    this.coordinator = new SyncCoordinator(stateStore, watchRegistrar, fullSyncPoller, properties);
    this.pushIngestService =
        new PushIngestService(
            new PushAuthenticator(properties, clock),
            new PushEnvelopeDecoder(new ObjectMapper()),
            coordinator,
            stateStore,
            incrementalSyncEngine,
            fullSyncPoller,
            properties);
  }

  /** A Pub/Sub envelope for the configured mailbox at {@code historyId}. */
  public static String envelope(String emailAddress, String historyIdJson) {
    String data =
        "{\"emailAddress\":\"" + emailAddress + "\",\"historyId\":" + historyIdJson + "}";
    String encoded =
        Base64.getEncoder().encodeToString(data.getBytes(StandardCharsets.UTF_8));
    return "{\"message\":{\"data\":\""
        + encoded
        + "\",\"messageId\":\"m-1\"},\"subscription\":\"projects/test/subscriptions/gmail\"}";
  }

  public String push(long historyId) {
    return envelope(properties.mailbox().address(), Long.toString(historyId));
  }

  public String pushToken() {
    return properties.push().verificationToken();
  }
}
